package com.codeheadsystems.tradenet.client.exceptions;

/**
 * A response could not be decoded at all. Individual bad records inside an otherwise readable
 * response are dropped instead of raising this.
 */
public class DecodeException extends TradeNetException {

  /**
   * Instantiates a new Decode exception.
   *
   * @param message the message
   */
  public DecodeException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Decode exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DecodeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
