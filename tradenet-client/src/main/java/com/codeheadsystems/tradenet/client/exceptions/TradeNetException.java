package com.codeheadsystems.tradenet.client.exceptions;

/**
 * Root of every failure the trade network client reports.
 */
public class TradeNetException extends RuntimeException {

  /**
   * Instantiates a new Trade net exception.
   *
   * @param message the message
   */
  public TradeNetException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Trade net exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TradeNetException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
