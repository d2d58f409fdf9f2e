package com.codeheadsystems.tradenet.client.identity;

import java.util.Optional;

/**
 * The platform identity service the player is signed in to. It vouches for the player by
 * issuing tickets the trade server can verify.
 * <p>
 * Implementations are called on the client's scheduler thread only.
 */
public interface IdentityProvider {

  /**
   * Whether a signed-in identity is currently available.
   *
   * @return the boolean
   */
  boolean isAvailable();

  /**
   * Display name of the signed-in player.
   *
   * @return the string
   */
  String displayName();

  /**
   * Stable identifier of the signed-in player.
   *
   * @return the string
   */
  String identityHandle();

  /**
   * Requests a new authentication ticket bound to the current identity.
   *
   * @return the ticket, or empty when the provider refused to issue one
   */
  Optional<IdentityTicket> acquireTicket();

  /**
   * Cancels a previously issued ticket. Canceling an unknown ticket is a no-op.
   *
   * @param ticket the ticket
   */
  void cancelTicket(IdentityTicket ticket);
}
