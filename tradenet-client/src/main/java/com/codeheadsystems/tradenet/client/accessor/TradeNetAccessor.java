package com.codeheadsystems.tradenet.client.accessor;

import com.codeheadsystems.tradenet.client.config.TradeClientConfig;
import com.codeheadsystems.tradenet.client.exceptions.TransportException;
import com.codeheadsystems.tradenet.client.scheduler.TaskScheduler;
import com.codeheadsystems.tradenet.model.ErrorResponse;
import com.codeheadsystems.tradenet.model.LoginRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP transport for the trade network endpoints.
 * <p>
 * Requests are sent with {@link HttpClient#sendAsync}; the caller is never blocked. Each
 * returned future completes on the {@link TaskScheduler}, never on an HTTP client thread, so
 * continuations may touch client state freely. A future always completes: with the body of a
 * 2xx answer, or exceptionally with a {@link TransportException} carrying the status and the
 * server's {@code detail} text.
 * <p>
 * This class knows nothing about tokens beyond attaching the one it is given; the re-auth
 * policy lives in {@code RequestClient}.
 */
@Singleton
public class TradeNetAccessor {

  private static final Logger log = LoggerFactory.getLogger(TradeNetAccessor.class);

  private final TradeClientConfig config;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final TaskScheduler scheduler;

  /**
   * Instantiates a new Trade net accessor.
   *
   * @param config       the config
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param scheduler    the scheduler completions are delivered on
   */
  @Inject
  public TradeNetAccessor(final TradeClientConfig config,
                          final HttpClient httpClient,
                          final ObjectMapper objectMapper,
                          final TaskScheduler scheduler) {
    log.info("TradeNetAccessor({})", config.serverUri());
    this.config = config;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.scheduler = scheduler;
  }

  /**
   * Exchanges an identity ticket for a bearer token. No authorization header is sent.
   *
   * @param request the login request
   * @return the raw response body
   */
  public CompletableFuture<String> login(final LoginRequest request) {
    log.debug("login({})", request);
    final String body;
    try {
      body = objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      return CompletableFuture.failedFuture(
          TransportException.noResponse("Unable to encode login request", e));
    }
    return send(HttpMethod.POST, "/auth/login", body, null);
  }

  /**
   * Sends one request.
   *
   * @param method      the method
   * @param path        the endpoint path
   * @param jsonBody    the JSON body, null for none
   * @param bearerToken the bearer token (without "Bearer " prefix), null for none
   * @return the raw response body
   */
  public CompletableFuture<String> send(final HttpMethod method,
                                        final String path,
                                        final String jsonBody,
                                        final String bearerToken) {
    final CompletableFuture<String> result = new CompletableFuture<>();
    final URI uri;
    final HttpRequest request;
    try {
      uri = config.resolve(path);
      request = buildRequest(method, uri, jsonBody, bearerToken);
    } catch (IllegalArgumentException e) {
      scheduler.execute(() -> result.completeExceptionally(
          TransportException.noResponse("Invalid request " + method + " " + path + ": " + e.getMessage(), e)));
      return result;
    }
    log.debug("send({} {}, auth={})", method, uri, bearerToken != null);
    httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .whenComplete((response, error) -> scheduler.execute(() -> {
          if (error != null) {
            result.completeExceptionally(noResponse(method, uri, error));
          } else {
            complete(result, method, uri, response);
          }
        }));
    return result;
  }

  private HttpRequest buildRequest(final HttpMethod method,
                                   final URI uri,
                                   final String jsonBody,
                                   final String bearerToken) {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(uri)
        .timeout(config.requestTimeout())
        .header("Accept", "application/json");
    if (bearerToken != null) {
      builder.header("Authorization", "Bearer " + bearerToken);
    }
    if (method == HttpMethod.GET) {
      builder.GET();
    } else {
      builder.header("Content-Type", "application/json")
          .method(method.name(), HttpRequest.BodyPublishers.ofString(jsonBody == null ? "" : jsonBody));
    }
    return builder.build();
  }

  private void complete(final CompletableFuture<String> result,
                        final HttpMethod method,
                        final URI uri,
                        final HttpResponse<String> response) {
    int status = response.statusCode();
    String body = response.body();
    if (status >= 200 && status < 300) {
      log.debug("{} {} -> {}", method, uri, status);
      result.complete(body == null ? "" : body);
      return;
    }
    String detail = detail(body);
    String message = "Server returned HTTP " + status + " for " + method + " " + uri.getPath()
        + (detail == null ? "" : ": " + detail);
    if (status == 401) {
      log.warn("{} {} rejected as unauthorized", method, uri.getPath());
    } else {
      log.error(message);
    }
    result.completeExceptionally(new TransportException(message, status, detail, body, null));
  }

  private String detail(final String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      ErrorResponse error = objectMapper.readValue(body, ErrorResponse.class);
      return error == null ? null : error.detailText();
    } catch (JsonProcessingException e) {
      log.debug("Error body is not a detail envelope: {}", e.getOriginalMessage());
      return null;
    }
  }

  private TransportException noResponse(final HttpMethod method, final URI uri, final Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    String reason = cause instanceof HttpTimeoutException
        ? "timed out after " + config.requestTimeout().toSeconds() + "s"
        : cause.getClass().getSimpleName() + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
    log.error("{} {} failed: {}", method, uri.getPath(), reason);
    return TransportException.noResponse("HTTP request failed for " + method + " " + uri.getPath() + ": " + reason, cause);
  }

  /**
   * The methods the trade network endpoints use.
   */
  public enum HttpMethod {
    GET,
    POST
  }
}
