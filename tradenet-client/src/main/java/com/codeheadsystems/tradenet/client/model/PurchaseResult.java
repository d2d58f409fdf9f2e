package com.codeheadsystems.tradenet.client.model;

import java.util.List;

/**
 * An acknowledged purchase.
 *
 * @param totalCost the total the server charged
 * @param bought    the lines that were delivered
 */
public record PurchaseResult(long totalCost, List<StagedTrade> bought) {

  /**
   * Copies the bought lines.
   */
  public PurchaseResult {
    bought = List.copyOf(bought);
  }
}
