package com.codeheadsystems.tradenet.client.exceptions;

/**
 * A trade failed a client-side check and was never sent to the server.
 */
public class TradeValidationException extends TradeNetException {

  /**
   * Instantiates a new Trade validation exception.
   *
   * @param message the message
   */
  public TradeValidationException(final String message) {
    super(message);
  }
}
