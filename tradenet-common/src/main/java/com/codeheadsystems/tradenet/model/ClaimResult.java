package com.codeheadsystems.tradenet.model;

/**
 * The outcome of settling previously sold items.
 *
 * @param status       success or error
 * @param totalClaimed currency claimed, {@code >= 0}
 * @param claimedCount number of sales settled, {@code >= 0}
 */
public record ClaimResult(ClaimStatus status, int totalClaimed, int claimedCount) {

  private static final ClaimResult ERROR = new ClaimResult(ClaimStatus.ERROR, 0, 0);

  /**
   * Clamps negative amounts to zero and defaults a missing status to {@link ClaimStatus#ERROR}.
   */
  public ClaimResult {
    status = status == null ? ClaimStatus.ERROR : status;
    totalClaimed = Math.max(0, totalClaimed);
    claimedCount = Math.max(0, claimedCount);
  }

  /**
   * The result used when nothing usable could be decoded.
   *
   * @return the error result
   */
  public static ClaimResult error() {
    return ERROR;
  }

  /**
   * Is success boolean.
   *
   * @return the boolean
   */
  public boolean isSuccess() {
    return status == ClaimStatus.SUCCESS;
  }
}
