package com.codeheadsystems.tradenet.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One tradable line item: either something the colony offers for sale or a line of an
 * incoming purchase/sale listed on the server.
 * <p>
 * Records are immutable. Staged quantities and prices live in the client's pending-trade set,
 * never in the record itself, so a record received from the server can be compared by identity
 * while the user edits a trade.
 * <p>
 * Used by: {@code GET /forsale}, {@code GET /my-items}, {@code POST /trade}
 *
 * @param itemKind         the item definition name, never null; empty means "invalid record"
 * @param quantity         number of units, {@code >= 0}
 * @param unitPrice        price per unit in the trade currency, {@code >= 0}
 * @param counterpartyName the player listing (or buying) the item, never null
 * @param quality          quality label, empty when the item has none
 */
public record TradeRecord(
    @JsonProperty("DefName") String itemKind,
    @JsonProperty("Quantity") int quantity,
    @JsonProperty("Price") int unitPrice,
    @JsonProperty("PlayerName") String counterpartyName,
    @JsonProperty("Quality") String quality) {

  /**
   * Normalizes null strings to empty and rejects negative amounts.
   */
  public TradeRecord {
    itemKind = itemKind == null ? "" : itemKind;
    counterpartyName = counterpartyName == null ? "" : counterpartyName;
    quality = quality == null ? "" : quality;
    if (quantity < 0) {
      throw new IllegalArgumentException("quantity must be >= 0: " + quantity);
    }
    if (unitPrice < 0) {
      throw new IllegalArgumentException("unitPrice must be >= 0: " + unitPrice);
    }
  }

  /**
   * Copy of this record with a different quantity.
   *
   * @param newQuantity the quantity
   * @return the trade record
   */
  public TradeRecord withQuantity(final int newQuantity) {
    return new TradeRecord(itemKind, newQuantity, unitPrice, counterpartyName, quality);
  }

  /**
   * Copy of this record with a different unit price.
   *
   * @param newUnitPrice the unit price
   * @return the trade record
   */
  public TradeRecord withUnitPrice(final int newUnitPrice) {
    return new TradeRecord(itemKind, quantity, newUnitPrice, counterpartyName, quality);
  }

  /**
   * Whether the record names an item kind at all.
   *
   * @return true if the item kind is non-empty
   */
  public boolean hasItemKind() {
    return !itemKind.isEmpty();
  }
}
