package com.codeheadsystems.tradenet.model;

import java.util.Locale;

/**
 * Outcome reported by {@code POST /sales/claim}.
 */
public enum ClaimStatus {
  SUCCESS,
  ERROR;

  /**
   * Maps the server's status text. Anything other than {@code "success"} is an error.
   *
   * @param status the wire status, may be null
   * @return the claim status
   */
  public static ClaimStatus fromWire(final String status) {
    if (status != null && "success".equals(status.trim().toLowerCase(Locale.ROOT))) {
      return SUCCESS;
    }
    return ERROR;
  }
}
