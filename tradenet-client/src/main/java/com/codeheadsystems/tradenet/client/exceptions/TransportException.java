package com.codeheadsystems.tradenet.client.exceptions;

/**
 * A request did not produce a 2xx answer: either no response arrived at all
 * ({@link #statusCode()} is {@link #NO_RESPONSE}) or the server answered with an error status.
 * <p>
 * The server's {@code detail} text, when present, is kept verbatim so the caller can show the
 * specific reason ("Not enough silver. Required: 50, You have: 10").
 */
public class TransportException extends TradeNetException {

  /**
   * Status used when the request failed before any response was received.
   */
  public static final int NO_RESPONSE = 0;

  private final int statusCode;
  private final String detail;
  private final String body;

  /**
   * Instantiates a new Transport exception.
   *
   * @param message    the message
   * @param statusCode the HTTP status, or {@link #NO_RESPONSE}
   * @param detail     the server detail text, may be null
   * @param body       the raw response body, may be null
   * @param cause      the cause, may be null
   */
  public TransportException(final String message,
                            final int statusCode,
                            final String detail,
                            final String body,
                            final Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
    this.detail = detail;
    this.body = body;
  }

  /**
   * Failure before any response arrived (connection refused, timeout, interrupted).
   *
   * @param message the message
   * @param cause   the cause
   * @return the transport exception
   */
  public static TransportException noResponse(final String message, final Throwable cause) {
    return new TransportException(message, NO_RESPONSE, null, null, cause);
  }

  /**
   * Status code int.
   *
   * @return the int
   */
  public int statusCode() {
    return statusCode;
  }

  /**
   * Detail string.
   *
   * @return the string, may be null
   */
  public String detail() {
    return detail;
  }

  /**
   * Body string.
   *
   * @return the string, may be null
   */
  public String body() {
    return body;
  }

  /**
   * Whether the server rejected the credentials (HTTP 401).
   *
   * @return the boolean
   */
  public boolean isUnauthorized() {
    return statusCode == 401;
  }
}
