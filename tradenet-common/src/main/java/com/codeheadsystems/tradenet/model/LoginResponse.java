package com.codeheadsystems.tradenet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the server's answer to a login.
 * <p>
 * Only {@code token} is required by the client; the other fields are informational and may be
 * absent on older servers. The client applies its own validity window rather than trusting
 * {@code expires_in}.
 * <p>
 * Used by: {@code POST /auth/login} response
 *
 * @param status     the status, usually {@code "success"}
 * @param token      the bearer token, null when the login was not accepted
 * @param tokenType  the token type, usually {@code "bearer"}
 * @param playerName the name the server bound to the token
 * @param expiresIn  server-side token lifetime in seconds, if reported
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LoginResponse(
    @JsonProperty("status") String status,
    @JsonProperty("token") String token,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("player_name") String playerName,
    @JsonProperty("expires_in") Long expiresIn) {

  /**
   * Has token boolean.
   *
   * @return the boolean
   */
  public boolean hasToken() {
    return token != null && !token.isBlank();
  }

  @Override
  public String toString() {
    return "LoginResponse[status=" + status + ", token=" + (hasToken() ? "<redacted>" : "none")
        + ", tokenType=" + tokenType + ", playerName=" + playerName + ", expiresIn=" + expiresIn + "]";
  }
}
