package com.codeheadsystems.tradenet.client.exceptions;

/**
 * The platform identity provider could not produce a ticket. Retrying will not help until the
 * user signs in to the platform.
 */
public class IdentityUnavailableException extends TradeNetException {

  /**
   * Instantiates a new Identity unavailable exception.
   *
   * @param message the message
   */
  public IdentityUnavailableException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Identity unavailable exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public IdentityUnavailableException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
