package com.codeheadsystems.tradenet.client.inventory;

import com.codeheadsystems.tradenet.model.TradeRecord;
import java.util.List;

/**
 * The game world's view of what the player owns. The trade client never changes the world on
 * its own initiative; it calls into this collaborator only after the server acknowledged a
 * trade.
 * <p>
 * Implementations are called on the client's scheduler thread only.
 */
public interface WorldInventory {

  /**
   * Locally owned tradable items, one record per item kind with the quantities of all stacks
   * summed. The counterparty name is empty.
   *
   * @return the list
   */
  List<TradeRecord> sellableRecords();

  /**
   * Removes up to {@code quantity} units of the kind from local ownership.
   *
   * @param itemKind the item kind
   * @param quantity the quantity
   * @return the number of units that could not be removed, 0 when everything was removed
   */
  int removeQuantity(String itemKind, int quantity);

  /**
   * Materializes {@code quantity} units of the kind and places them into the world.
   *
   * @param itemKind the item kind
   * @param quantity the quantity
   */
  void deliver(String itemKind, int quantity);

  /**
   * Trade currency the player currently owns.
   *
   * @return the int
   */
  int currencyBalance();

  /**
   * Removes trade currency from local ownership.
   *
   * @param amount the amount
   */
  void removeCurrency(int amount);

  /**
   * Places trade currency into the world.
   *
   * @param amount the amount
   */
  void deliverCurrency(int amount);
}
