package com.codeheadsystems.tradenet.client.inventory;

import com.codeheadsystems.tradenet.model.TradeRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WorldInventory} held in plain maps. Suitable for tools and tests that have no game
 * world behind them.
 */
public class InMemoryWorldInventory implements WorldInventory {

  private static final Logger log = LoggerFactory.getLogger(InMemoryWorldInventory.class);

  private final Map<String, Integer> quantities = new LinkedHashMap<>();
  private final Map<String, Integer> unitPrices = new LinkedHashMap<>();
  private final Map<String, String> qualities = new LinkedHashMap<>();
  private int currency;

  /**
   * Instantiates a new In memory world inventory.
   *
   * @param currency the starting currency
   */
  public InMemoryWorldInventory(final int currency) {
    this.currency = currency;
  }

  /**
   * Adds a stack of an item. Stacks of the same kind are aggregated; the first stack's price
   * and quality are kept.
   *
   * @param itemKind  the item kind
   * @param quantity  the quantity
   * @param unitPrice the unit price
   * @param quality   the quality
   * @return this inventory
   */
  public InMemoryWorldInventory addStack(final String itemKind, final int quantity,
                                         final int unitPrice, final String quality) {
    quantities.merge(itemKind, quantity, Integer::sum);
    unitPrices.putIfAbsent(itemKind, unitPrice);
    qualities.putIfAbsent(itemKind, quality == null ? "" : quality);
    return this;
  }

  /**
   * Quantity owned of a kind.
   *
   * @param itemKind the item kind
   * @return the int
   */
  public int quantityOf(final String itemKind) {
    return quantities.getOrDefault(itemKind, 0);
  }

  @Override
  public List<TradeRecord> sellableRecords() {
    List<TradeRecord> records = new ArrayList<>();
    quantities.forEach((kind, quantity) -> {
      if (quantity > 0) {
        records.add(new TradeRecord(kind, quantity, unitPrices.getOrDefault(kind, 0), "",
            qualities.getOrDefault(kind, "")));
      }
    });
    return records;
  }

  @Override
  public int removeQuantity(final String itemKind, final int quantity) {
    int owned = quantityOf(itemKind);
    int removed = Math.min(owned, Math.max(0, quantity));
    quantities.put(itemKind, owned - removed);
    int remaining = quantity - removed;
    if (remaining > 0) {
      log.warn("Could not remove all items: {} of {} remained", remaining, itemKind);
    }
    return remaining;
  }

  @Override
  public void deliver(final String itemKind, final int quantity) {
    if (quantity > 0) {
      quantities.merge(itemKind, quantity, Integer::sum);
    }
  }

  @Override
  public int currencyBalance() {
    return currency;
  }

  @Override
  public void removeCurrency(final int amount) {
    if (amount <= 0) {
      log.warn("removeCurrency called with non-positive amount {}", amount);
      return;
    }
    currency = Math.max(0, currency - amount);
  }

  @Override
  public void deliverCurrency(final int amount) {
    if (amount > 0) {
      currency += amount;
    }
  }
}
