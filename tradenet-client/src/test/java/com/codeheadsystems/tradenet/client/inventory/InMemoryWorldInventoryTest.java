package com.codeheadsystems.tradenet.client.inventory;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.tradenet.model.TradeRecord;
import org.junit.jupiter.api.Test;

/**
 * The type In memory world inventory test.
 */
class InMemoryWorldInventoryTest {

  @Test
  void sellableRecords_aggregatesStacksByKind() {
    InMemoryWorldInventory inventory = new InMemoryWorldInventory(0)
        .addStack("Steel", 75, 2, "")
        .addStack("Steel", 25, 3, "")
        .addStack("Gun_Revolver", 1, 200, "Normal");

    assertThat(inventory.sellableRecords()).containsExactly(
        new TradeRecord("Steel", 100, 2, "", ""),
        new TradeRecord("Gun_Revolver", 1, 200, "", "Normal"));
  }

  @Test
  void removeQuantity_returnsWhatCouldNotBeRemoved() {
    InMemoryWorldInventory inventory = new InMemoryWorldInventory(0).addStack("Steel", 10, 2, "");

    assertThat(inventory.removeQuantity("Steel", 4)).isZero();
    assertThat(inventory.removeQuantity("Steel", 10)).isEqualTo(4);
    assertThat(inventory.quantityOf("Steel")).isZero();
    assertThat(inventory.sellableRecords()).isEmpty();
  }

  @Test
  void currency_neverGoesNegative() {
    InMemoryWorldInventory inventory = new InMemoryWorldInventory(100);

    inventory.deliverCurrency(50);
    inventory.removeCurrency(500);

    assertThat(inventory.currencyBalance()).isZero();
  }

  @Test
  void deliver_addsToExistingStock() {
    InMemoryWorldInventory inventory = new InMemoryWorldInventory(0).addStack("Steel", 10, 2, "");

    inventory.deliver("Steel", 5);
    inventory.deliver("WoodLog", 20);

    assertThat(inventory.quantityOf("Steel")).isEqualTo(15);
    assertThat(inventory.quantityOf("WoodLog")).isEqualTo(20);
  }
}
