package com.codeheadsystems.tradenet.client.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Client-side configuration for talking to a trade network server.
 * <p>
 * The token lifetime and login retry policy are part of the protocol with the server: the
 * client treats a token as valid for {@link #tokenTtl()} after it was issued or last used, and
 * gives the ticket exchange {@link #maxLoginAttempts()} tries spaced {@link #loginRetryDelay()}
 * apart. Use {@link #forDevelopment()} against a local server and {@link #forServer(URI)}
 * otherwise.
 *
 * @param serverUri        base URI of the server, e.g. {@code http://localhost:5000}
 * @param requestTimeout   timeout applied to every request, between 5 and 60 seconds
 * @param tokenTtl         sliding validity window of a bearer token
 * @param maxLoginAttempts total attempts for the ticket exchange, at least 1
 * @param loginRetryDelay  delay between ticket exchange attempts
 */
public record TradeClientConfig(URI serverUri,
                                Duration requestTimeout,
                                Duration tokenTtl,
                                int maxLoginAttempts,
                                Duration loginRetryDelay) {

  /**
   * The server used by {@link #forDevelopment()}.
   */
  public static final URI DEVELOPMENT_SERVER = URI.create("http://localhost:5000");
  /**
   * The default request timeout.
   */
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
  /**
   * The smallest accepted request timeout.
   */
  public static final Duration MIN_REQUEST_TIMEOUT = Duration.ofSeconds(5);
  /**
   * The largest accepted request timeout.
   */
  public static final Duration MAX_REQUEST_TIMEOUT = Duration.ofSeconds(60);
  /**
   * The default token ttl.
   */
  public static final Duration DEFAULT_TOKEN_TTL = Duration.ofHours(24);
  /**
   * The default max login attempts.
   */
  public static final int DEFAULT_MAX_LOGIN_ATTEMPTS = 3;
  /**
   * The default login retry delay.
   */
  public static final Duration DEFAULT_LOGIN_RETRY_DELAY = Duration.ofSeconds(2);

  /**
   * Validates the configuration.
   */
  public TradeClientConfig {
    Objects.requireNonNull(serverUri, "serverUri");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    Objects.requireNonNull(tokenTtl, "tokenTtl");
    Objects.requireNonNull(loginRetryDelay, "loginRetryDelay");
    if (requestTimeout.compareTo(MIN_REQUEST_TIMEOUT) < 0 || requestTimeout.compareTo(MAX_REQUEST_TIMEOUT) > 0) {
      throw new IllegalArgumentException("requestTimeout must be between 5 and 60 seconds: " + requestTimeout);
    }
    if (tokenTtl.isNegative() || tokenTtl.isZero()) {
      throw new IllegalArgumentException("tokenTtl must be positive: " + tokenTtl);
    }
    if (maxLoginAttempts < 1) {
      throw new IllegalArgumentException("maxLoginAttempts must be >= 1: " + maxLoginAttempts);
    }
    if (loginRetryDelay.isNegative()) {
      throw new IllegalArgumentException("loginRetryDelay must not be negative: " + loginRetryDelay);
    }
  }

  /**
   * Defaults pointing at a server on the local machine.
   *
   * @return the trade client config
   */
  public static TradeClientConfig forDevelopment() {
    return forServer(DEVELOPMENT_SERVER);
  }

  /**
   * Defaults pointing at the given server.
   *
   * @param serverUri the server uri
   * @return the trade client config
   */
  public static TradeClientConfig forServer(final URI serverUri) {
    return new TradeClientConfig(serverUri, DEFAULT_REQUEST_TIMEOUT, DEFAULT_TOKEN_TTL,
        DEFAULT_MAX_LOGIN_ATTEMPTS, DEFAULT_LOGIN_RETRY_DELAY);
  }

  /**
   * Copy with a different request timeout.
   *
   * @param timeout the timeout
   * @return the trade client config
   */
  public TradeClientConfig withRequestTimeout(final Duration timeout) {
    return new TradeClientConfig(serverUri, timeout, tokenTtl, maxLoginAttempts, loginRetryDelay);
  }

  /**
   * Resolves an endpoint path against the server URI, tolerating slashes on either side.
   *
   * @param path the endpoint path, e.g. {@code /forsale}
   * @return the uri
   */
  public URI resolve(final String path) {
    String base = serverUri.toString();
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String relative = path;
    while (relative.startsWith("/")) {
      relative = relative.substring(1);
    }
    return URI.create(base + "/" + relative);
  }
}
