package com.codeheadsystems.tradenet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for {@code POST /sales/claim}.
 *
 * @param status            {@code "success"} or an error text
 * @param totalClaimed      currency claimed
 * @param claimedSalesCount number of pending sales settled
 * @param message           optional human readable note, e.g. "No pending sales to claim"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClaimResponse(
    @JsonProperty("status") String status,
    @JsonProperty("total_claimed") int totalClaimed,
    @JsonProperty("claimed_sales_count") int claimedSalesCount,
    @JsonProperty("message") String message) {

  /**
   * Converts to the client-side result.
   *
   * @return the claim result
   */
  public ClaimResult toClaimResult() {
    return new ClaimResult(ClaimStatus.fromWire(status), totalClaimed, claimedSalesCount);
  }
}
