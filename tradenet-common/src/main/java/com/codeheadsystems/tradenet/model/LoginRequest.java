package com.codeheadsystems.tradenet.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for the ticket-for-token exchange.
 * <p>
 * The ticket is the platform identity ticket rendered as a lowercase hex string; the server
 * validates it against the identity platform and answers with a bearer token.
 * <p>
 * Used by: {@code POST /auth/login}
 *
 * @param authTicket lowercase hex encoding of the identity ticket bytes
 * @param playerName display name of the authenticated identity
 */
public record LoginRequest(
    @JsonProperty("authTicket") String authTicket,
    @JsonProperty("playerName") String playerName) {

  @Override
  public String toString() {
    return "LoginRequest[authTicket=<" + (authTicket == null ? 0 : authTicket.length())
        + " hex chars>, playerName=" + playerName + "]";
  }
}
