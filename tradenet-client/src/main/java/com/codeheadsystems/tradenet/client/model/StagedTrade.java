package com.codeheadsystems.tradenet.client.model;

import com.codeheadsystems.tradenet.model.TradeRecord;

/**
 * One line the user selected for trading.
 *
 * @param record    the listed record, as last seen
 * @param quantity  the quantity to transfer, {@code > 0}
 * @param unitPrice the unit price to trade at
 */
public record StagedTrade(TradeRecord record, int quantity, int unitPrice) {

  /**
   * Quantity times unit price.
   *
   * @return the long
   */
  public long totalCost() {
    return (long) quantity * unitPrice;
  }

  /**
   * The record as it is sent to the server: staged quantity and price replace the listed ones.
   *
   * @return the trade record
   */
  public TradeRecord toRecord() {
    return record.withQuantity(quantity).withUnitPrice(unitPrice);
  }
}
