package com.codeheadsystems.tradenet.client.model;

import com.codeheadsystems.tradenet.model.TradeRecord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The user's in-progress selection over a listing: how many units of each listed record to
 * transfer, and optionally at what unit price.
 * <p>
 * Records are matched by identity, not by value, so two identical lines from the server stay
 * two separate selections. A quantity of 0 means "not selected". The presentation layer
 * mutates the set; the trade flows only read it.
 */
public class PendingTradeSet {

  private final List<TradeRecord> records;
  private final int[] quantities;
  private final int[] unitPrices;

  /**
   * Starts an empty selection over the listing.
   *
   * @param records the listed records
   */
  public PendingTradeSet(final List<TradeRecord> records) {
    this.records = Collections.unmodifiableList(new ArrayList<>(records));
    this.quantities = new int[records.size()];
    this.unitPrices = new int[records.size()];
    for (int i = 0; i < unitPrices.length; i++) {
      unitPrices[i] = this.records.get(i).unitPrice();
    }
  }

  /**
   * The listing this selection is over.
   *
   * @return the list
   */
  public List<TradeRecord> records() {
    return records;
  }

  /**
   * Sets the quantity to transfer for a listed record.
   *
   * @param record   the record, must be one of {@link #records()}
   * @param quantity the quantity, 0 to deselect
   */
  public void stage(final TradeRecord record, final int quantity) {
    if (quantity < 0) {
      throw new IllegalArgumentException("quantity must be >= 0: " + quantity);
    }
    quantities[indexOf(record)] = quantity;
  }

  /**
   * Overrides the unit price for a listed record (used when offering items for sale).
   *
   * @param record    the record
   * @param unitPrice the unit price
   */
  public void price(final TradeRecord record, final int unitPrice) {
    if (unitPrice < 0) {
      throw new IllegalArgumentException("unitPrice must be >= 0: " + unitPrice);
    }
    unitPrices[indexOf(record)] = unitPrice;
  }

  /**
   * Staged quantity of a record.
   *
   * @param record the record
   * @return the int
   */
  public int quantityFor(final TradeRecord record) {
    return quantities[indexOf(record)];
  }

  /**
   * Lines with a positive staged quantity, in listing order.
   *
   * @return the list
   */
  public List<StagedTrade> selected() {
    List<StagedTrade> selected = new ArrayList<>();
    for (int i = 0; i < quantities.length; i++) {
      if (quantities[i] > 0) {
        selected.add(new StagedTrade(records.get(i), quantities[i], unitPrices[i]));
      }
    }
    return selected;
  }

  /**
   * Deselects everything.
   */
  public void clear() {
    Arrays.fill(quantities, 0);
  }

  private int indexOf(final TradeRecord record) {
    for (int i = 0; i < records.size(); i++) {
      if (records.get(i) == record) {
        return i;
      }
    }
    throw new IllegalArgumentException("Record is not part of this listing: " + record);
  }
}
