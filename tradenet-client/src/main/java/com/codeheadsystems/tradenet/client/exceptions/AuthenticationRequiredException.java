package com.codeheadsystems.tradenet.client.exceptions;

/**
 * Terminal authentication failure: the server rejected our token and re-authenticating did not
 * fix it. The user has to restart the session; retrying the same call is pointless.
 */
public class AuthenticationRequiredException extends TradeNetException {

  /**
   * The message shown to the user.
   */
  public static final String RESTART_SESSION = "Authentication failed - please restart the session";

  /**
   * Instantiates a new Authentication required exception.
   *
   * @param cause the cause, may be null
   */
  public AuthenticationRequiredException(final Throwable cause) {
    super(RESTART_SESSION, cause);
  }
}
