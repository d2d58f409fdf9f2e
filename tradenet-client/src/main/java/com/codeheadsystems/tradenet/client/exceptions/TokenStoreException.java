package com.codeheadsystems.tradenet.client.exceptions;

/**
 * The durable token cache could not be read or written.
 */
public class TokenStoreException extends TradeNetException {

  /**
   * Instantiates a new Token store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TokenStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
