package com.codeheadsystems.tradenet.client.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * The durable form of a bearer token: {@code {"token": "...", "expires_at": <unix seconds>}}.
 *
 * @param token                the bearer token
 * @param expiresAtUnixSeconds absolute expiry as unix seconds
 */
public record CachedToken(
    @JsonProperty("token") String token,
    @JsonProperty("expires_at") long expiresAtUnixSeconds) {

  /**
   * Of cached token.
   *
   * @param token     the token
   * @param expiresAt the expires at
   * @return the cached token
   */
  public static CachedToken of(final String token, final Instant expiresAt) {
    return new CachedToken(token, expiresAt.getEpochSecond());
  }

  /**
   * Expires at instant.
   *
   * @return the instant
   */
  @JsonIgnore
  public Instant expiresAt() {
    return Instant.ofEpochSecond(expiresAtUnixSeconds);
  }

  /**
   * Valid iff the token is non-empty and {@code now} is before the expiry.
   *
   * @param now the now
   * @return the boolean
   */
  public boolean isValidAt(final Instant now) {
    return token != null && !token.isEmpty() && now.isBefore(expiresAt());
  }

  @Override
  public String toString() {
    return "CachedToken[token=<redacted>, expiresAt=" + expiresAt() + "]";
  }
}
