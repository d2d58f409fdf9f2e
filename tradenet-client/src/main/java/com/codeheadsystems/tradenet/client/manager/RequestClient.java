package com.codeheadsystems.tradenet.client.manager;

import com.codeheadsystems.tradenet.client.accessor.TradeNetAccessor;
import com.codeheadsystems.tradenet.client.accessor.TradeNetAccessor.HttpMethod;
import com.codeheadsystems.tradenet.client.exceptions.AuthenticationRequiredException;
import com.codeheadsystems.tradenet.client.exceptions.TransportException;
import com.codeheadsystems.tradenet.client.scheduler.TaskScheduler;
import java.util.concurrent.CompletableFuture;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues authenticated calls and owns the 401 policy.
 * <p>
 * The bearer token is attached whenever {@link SessionManager#getToken()} has one. A 2xx answer
 * completes the future with the raw body and slides the token's expiry forward. Any failure
 * other than a 401 completes it exceptionally with the accessor's error as is.
 * <p>
 * A 401 on the first attempt clears the token and re-authenticates. Once that exchange settles,
 * a check queued on the scheduler looks at the session: with a valid token the request is sent
 * exactly once more, otherwise the call fails with {@link AuthenticationRequiredException}. A
 * 401 on the retry also ends in {@link AuthenticationRequiredException}. Every returned future
 * completes.
 */
@Singleton
public class RequestClient {

  private static final Logger log = LoggerFactory.getLogger(RequestClient.class);

  private final TradeNetAccessor accessor;
  private final SessionManager sessionManager;
  private final TaskScheduler scheduler;

  /**
   * Instantiates a new Request client.
   *
   * @param accessor       the accessor
   * @param sessionManager the session manager
   * @param scheduler      the scheduler
   */
  @Inject
  public RequestClient(final TradeNetAccessor accessor,
                       final SessionManager sessionManager,
                       final TaskScheduler scheduler) {
    log.info("RequestClient()");
    this.accessor = accessor;
    this.sessionManager = sessionManager;
    this.scheduler = scheduler;
  }

  /**
   * GET the path.
   *
   * @param path the path
   * @return the raw response body
   */
  public CompletableFuture<String> get(final String path) {
    return request(HttpMethod.GET, path, null);
  }

  /**
   * POST the JSON body to the path.
   *
   * @param path     the path
   * @param jsonBody the json body
   * @return the raw response body
   */
  public CompletableFuture<String> post(final String path, final String jsonBody) {
    return request(HttpMethod.POST, path, jsonBody);
  }

  /**
   * Runs one logical request, including its single re-authenticated retry.
   *
   * @param method   the method
   * @param path     the path
   * @param jsonBody the json body, null for none
   * @return the raw response body
   */
  public CompletableFuture<String> request(final HttpMethod method, final String path, final String jsonBody) {
    final CompletableFuture<String> result = new CompletableFuture<>();
    final String token = sessionManager.getToken().orElse(null);
    if (token == null) {
      log.warn("{} {} sent without a bearer token", method, path);
    }
    accessor.send(method, path, jsonBody, token).whenComplete((body, error) -> {
      if (error == null) {
        succeed(result, body);
        return;
      }
      Throwable failure = SessionManager.unwrap(error);
      if (isUnauthorized(failure)) {
        log.warn("{} {} rejected with 401, re-authenticating", method, path);
        reauthenticateAndRetry(method, path, jsonBody, result);
      } else {
        result.completeExceptionally(failure);
      }
    });
    return result;
  }

  private void reauthenticateAndRetry(final HttpMethod method,
                                      final String path,
                                      final String jsonBody,
                                      final CompletableFuture<String> result) {
    sessionManager.clearToken();
    final CompletableFuture<String> auth;
    try {
      auth = sessionManager.ensureAuthenticated();
    } catch (RuntimeException e) {
      result.completeExceptionally(new AuthenticationRequiredException(e));
      return;
    }
    auth.whenComplete((ignored, authError) -> scheduler.execute(() -> {
      if (!sessionManager.hasValidToken()) {
        Throwable cause = authError == null ? null : SessionManager.unwrap(authError);
        log.error("Re-authentication failed for {} {}", method, path);
        result.completeExceptionally(new AuthenticationRequiredException(cause));
        return;
      }
      retryOnce(method, path, jsonBody, result);
    }));
  }

  private void retryOnce(final HttpMethod method,
                         final String path,
                         final String jsonBody,
                         final CompletableFuture<String> result) {
    final String token = sessionManager.getToken().orElse(null);
    log.info("Retrying {} {} with new token", method, path);
    accessor.send(method, path, jsonBody, token).whenComplete((body, error) -> {
      if (error == null) {
        succeed(result, body);
        return;
      }
      Throwable failure = SessionManager.unwrap(error);
      if (isUnauthorized(failure)) {
        log.error("{} {} rejected again after re-authentication", method, path);
        result.completeExceptionally(new AuthenticationRequiredException(failure));
      } else {
        result.completeExceptionally(failure);
      }
    });
  }

  private void succeed(final CompletableFuture<String> result, final String body) {
    sessionManager.renewExpiry();
    result.complete(body);
  }

  private static boolean isUnauthorized(final Throwable failure) {
    return failure instanceof TransportException && ((TransportException) failure).isUnauthorized();
  }
}
