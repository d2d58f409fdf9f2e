package com.codeheadsystems.tradenet.client.exceptions;

/**
 * A ticket was obtained but the server did not hand out a token for it within the allowed
 * number of attempts.
 */
public class AuthExchangeFailedException extends TradeNetException {

  private final int attempts;

  /**
   * Instantiates a new Auth exchange failed exception.
   *
   * @param message  the message
   * @param attempts the number of attempts made
   * @param cause    the last failure, may be null
   */
  public AuthExchangeFailedException(final String message, final int attempts, final Throwable cause) {
    super(message, cause);
    this.attempts = attempts;
  }

  /**
   * Attempts int.
   *
   * @return the int
   */
  public int attempts() {
    return attempts;
  }
}
