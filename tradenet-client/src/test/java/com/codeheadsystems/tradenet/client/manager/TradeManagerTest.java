package com.codeheadsystems.tradenet.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.tradenet.client.codec.TradeCodec;
import com.codeheadsystems.tradenet.client.exceptions.TradeNetException;
import com.codeheadsystems.tradenet.client.exceptions.TradeValidationException;
import com.codeheadsystems.tradenet.client.exceptions.TransportException;
import com.codeheadsystems.tradenet.client.inventory.InMemoryWorldInventory;
import com.codeheadsystems.tradenet.client.model.PendingTradeSet;
import com.codeheadsystems.tradenet.client.model.PurchaseResult;
import com.codeheadsystems.tradenet.model.ClaimResult;
import com.codeheadsystems.tradenet.model.ClaimStatus;
import com.codeheadsystems.tradenet.model.PendingSale;
import com.codeheadsystems.tradenet.model.TradeRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * The type Trade manager test.
 */
@ExtendWith(MockitoExtension.class)
class TradeManagerTest {

  private static final TradeRecord STEEL = new TradeRecord("Steel", 50, 2, "bob", "");
  private static final TradeRecord RIFLE = new TradeRecord("Gun_BoltActionRifle", 1, 300, "carol", "Good");

  @Mock private RequestClient requestClient;

  private InMemoryWorldInventory inventory;
  private TradeManager tradeManager;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    inventory = new InMemoryWorldInventory(1000);
    tradeManager = new TradeManager(requestClient, new TradeCodec(new ObjectMapper()), inventory);
  }

  private static Throwable causeOf(final CompletableFuture<?> future) {
    try {
      future.join();
    } catch (CompletionException e) {
      return e.getCause();
    }
    throw new AssertionError("expected failure");
  }

  // ── Browsing ──────────────────────────────────────────────────────────────

  @Test
  void fetchStock_decodesListingAndDropsRecordsWithoutKind() {
    when(requestClient.get("/forsale")).thenReturn(CompletableFuture.completedFuture(
        "{\"records\":[{\"DefName\":\"Steel\",\"Quantity\":50,\"Price\":2,\"PlayerName\":\"bob\",\"Quality\":\"\"},"
            + "{\"DefName\":\"\",\"Quantity\":1,\"Price\":1,\"PlayerName\":\"x\",\"Quality\":\"\"}]}"));

    List<TradeRecord> stock = tradeManager.fetchStock().join();

    assertThat(stock).containsExactly(STEEL);
  }

  @Test
  void fetchStock_transportError_propagatesUnchanged() {
    TransportException down = TransportException.noResponse("HTTP request failed for GET /forsale", null);
    when(requestClient.get("/forsale")).thenReturn(CompletableFuture.failedFuture(down));

    assertThat(causeOf(tradeManager.fetchStock())).isSameAs(down);
  }

  @Test
  void fetchMyListings_usesTradeRecordDecoder() {
    when(requestClient.get("/my-items")).thenReturn(CompletableFuture.completedFuture(
        "{\"my_items\":[{\"DefName\":\"Steel\",\"Quantity\":50,\"Price\":2,\"PlayerName\":\"bob\",\"Quality\":\"\"}],"
            + "\"count\":1}"));

    assertThat(tradeManager.fetchMyListings().join()).containsExactly(STEEL);
  }

  @Test
  void removeListing_postsIndex() {
    when(requestClient.post("/remove-item", "{\"index\":2}"))
        .thenReturn(CompletableFuture.completedFuture("{\"status\":\"success\"}"));

    assertThat(tradeManager.removeListing(2).join()).contains("success");
  }

  @Test
  void removeListing_negativeIndex_failsWithoutRequest() {
    assertThat(causeOf(tradeManager.removeListing(-1))).isInstanceOf(TradeValidationException.class);
    verifyNoInteractions(requestClient);
  }

  // ── Buying ────────────────────────────────────────────────────────────────

  @Test
  void submitBuy_quantityAboveListing_neverCallsNetwork() {
    PendingTradeSet selection = new PendingTradeSet(List.of(STEEL, RIFLE));
    selection.stage(STEEL, 51);

    assertThat(causeOf(tradeManager.submitBuy(selection)))
        .isInstanceOf(TradeValidationException.class)
        .hasMessageContaining("Only 50 Steel available");
    verifyNoInteractions(requestClient);
  }

  @Test
  void submitBuy_totalAboveBalance_neverCallsNetwork() {
    inventory = new InMemoryWorldInventory(250);
    tradeManager = new TradeManager(requestClient, new TradeCodec(new ObjectMapper()), inventory);
    PendingTradeSet selection = new PendingTradeSet(List.of(STEEL, RIFLE));
    selection.stage(RIFLE, 1);

    assertThat(causeOf(tradeManager.submitBuy(selection)))
        .isInstanceOf(TradeValidationException.class)
        .hasMessage("Not enough currency! Need 300, but only have 250");
    verifyNoInteractions(requestClient);
  }

  @Test
  void submitBuy_nothingStaged_failsWithoutRequest() {
    assertThat(causeOf(tradeManager.submitBuy(new PendingTradeSet(List.of(STEEL)))))
        .isInstanceOf(TradeValidationException.class)
        .hasMessageStartingWith("No items selected");
    verifyNoInteractions(requestClient);
  }

  @Test
  void submitBuy_acknowledged_chargesServerTotalAndDeliversItems() {
    PendingTradeSet selection = new PendingTradeSet(List.of(STEEL, RIFLE));
    selection.stage(STEEL, 10);
    when(requestClient.post("/buy",
        "{\"items\":[{\"def_name\":\"Steel\",\"quantity\":10,\"seller_name\":\"bob\"}],\"client_silver\":1000}"))
        .thenReturn(CompletableFuture.completedFuture(
            "{\"status\":\"success\",\"purchased_items\":[],\"total_cost\":18}"));

    PurchaseResult result = tradeManager.submitBuy(selection).join();

    assertThat(result.totalCost()).isEqualTo(18);
    assertThat(result.bought()).hasSize(1);
    assertThat(inventory.currencyBalance()).isEqualTo(982);
    assertThat(inventory.quantityOf("Steel")).isEqualTo(10);
    assertThat(selection.selected()).isEmpty();
  }

  @Test
  void submitBuy_ackWithoutTotal_chargesComputedTotal() {
    PendingTradeSet selection = new PendingTradeSet(List.of(STEEL));
    selection.stage(STEEL, 5);
    when(requestClient.post("/buy",
        "{\"items\":[{\"def_name\":\"Steel\",\"quantity\":5,\"seller_name\":\"bob\"}],\"client_silver\":1000}"))
        .thenReturn(CompletableFuture.completedFuture("OK"));

    assertThat(tradeManager.submitBuy(selection).join().totalCost()).isEqualTo(10);
    assertThat(inventory.currencyBalance()).isEqualTo(990);
  }

  @Test
  void submitBuy_serverRejects_surfacesDetailAndLeavesInventory() {
    PendingTradeSet selection = new PendingTradeSet(List.of(STEEL));
    selection.stage(STEEL, 5);
    TransportException rejected = new TransportException(
        "Server returned HTTP 400 for POST /buy: Not enough stock. Available: 3", 400,
        "Not enough stock. Available: 3", "{}", null);
    when(requestClient.post("/buy",
        "{\"items\":[{\"def_name\":\"Steel\",\"quantity\":5,\"seller_name\":\"bob\"}],\"client_silver\":1000}"))
        .thenReturn(CompletableFuture.failedFuture(rejected));

    Throwable cause = causeOf(tradeManager.submitBuy(selection));

    assertThat(cause).isSameAs(rejected);
    assertThat(((TransportException) cause).detail()).isEqualTo("Not enough stock. Available: 3");
    assertThat(inventory.currencyBalance()).isEqualTo(1000);
    assertThat(inventory.quantityOf("Steel")).isZero();
    assertThat(selection.quantityFor(STEEL)).isEqualTo(5);
  }

  // ── Selling ───────────────────────────────────────────────────────────────

  @Test
  void submitSell_removesInventoryOnlyAfterAcknowledgement() {
    inventory.addStack("Steel", 30, 3, "");
    List<TradeRecord> sellables = tradeManager.colonySellables();
    PendingTradeSet selection = new PendingTradeSet(sellables);
    selection.stage(sellables.get(0), 10);
    selection.price(sellables.get(0), 5);
    CompletableFuture<String> ack = new CompletableFuture<>();
    when(requestClient.post("/trade",
        "{\"records\":[{\"DefName\":\"Steel\",\"Quantity\":10,\"Price\":5,\"PlayerName\":\"\",\"Quality\":\"\"}]}"))
        .thenReturn(ack);

    CompletableFuture<List<TradeRecord>> result = tradeManager.submitSell(selection);

    assertThat(inventory.quantityOf("Steel")).isEqualTo(30);
    ack.complete("Trade data received");
    assertThat(result.join()).containsExactly(new TradeRecord("Steel", 10, 5, "", ""));
    assertThat(inventory.quantityOf("Steel")).isEqualTo(20);
  }

  @Test
  void submitSell_failure_keepsInventory() {
    inventory.addStack("Steel", 30, 3, "");
    List<TradeRecord> sellables = tradeManager.colonySellables();
    PendingTradeSet selection = new PendingTradeSet(sellables);
    selection.stage(sellables.get(0), 10);
    when(requestClient.post("/trade",
        "{\"records\":[{\"DefName\":\"Steel\",\"Quantity\":10,\"Price\":3,\"PlayerName\":\"\",\"Quality\":\"\"}]}"))
        .thenReturn(CompletableFuture.failedFuture(TransportException.noResponse("down", null)));

    assertThat(causeOf(tradeManager.submitSell(selection))).isInstanceOf(TransportException.class);
    assertThat(inventory.quantityOf("Steel")).isEqualTo(30);
  }

  @Test
  void submitSell_sendsOnlyPositivelyStagedLines() {
    inventory.addStack("Steel", 30, 3, "").addStack("WoodLog", 100, 1, "");
    List<TradeRecord> sellables = tradeManager.colonySellables();
    PendingTradeSet selection = new PendingTradeSet(sellables);
    selection.stage(sellables.get(1), 40);
    when(requestClient.post("/trade",
        "{\"records\":[{\"DefName\":\"WoodLog\",\"Quantity\":40,\"Price\":1,\"PlayerName\":\"\",\"Quality\":\"\"}]}"))
        .thenReturn(CompletableFuture.completedFuture("ok"));

    assertThat(tradeManager.submitSell(selection).join()).hasSize(1);
    assertThat(inventory.quantityOf("Steel")).isEqualTo(30);
    assertThat(inventory.quantityOf("WoodLog")).isEqualTo(60);
  }

  @Test
  void submitSell_nothingStaged_failsWithoutRequest() {
    inventory.addStack("Steel", 30, 3, "");

    assertThat(causeOf(tradeManager.submitSell(new PendingTradeSet(tradeManager.colonySellables()))))
        .isInstanceOf(TradeValidationException.class)
        .hasMessageStartingWith("No items selected");
    verifyNoInteractions(requestClient);
  }

  // ── Settlement ────────────────────────────────────────────────────────────

  @Test
  void claimSales_success_deliversCurrency() {
    when(requestClient.post("/sales/claim", "{}")).thenReturn(CompletableFuture.completedFuture(
        "{\"status\":\"success\",\"total_claimed\":120,\"claimed_sales_count\":2}"));

    ClaimResult result = tradeManager.claimSales().join();

    assertThat(result).isEqualTo(new ClaimResult(ClaimStatus.SUCCESS, 120, 2));
    assertThat(inventory.currencyBalance()).isEqualTo(1120);
  }

  @Test
  void claimSales_errorStatus_failsWithInvalidResponse() {
    when(requestClient.post("/sales/claim", "{}"))
        .thenReturn(CompletableFuture.completedFuture("{\"status\":\"error\"}"));

    assertThat(causeOf(tradeManager.claimSales()))
        .isInstanceOf(TradeNetException.class)
        .hasMessage("Failed to claim sales: invalid response");
    assertThat(inventory.currencyBalance()).isEqualTo(1000);
  }

  @Test
  void fetchPendingSales_decodesEnvelope() {
    when(requestClient.get("/sales/pending")).thenReturn(CompletableFuture.completedFuture(
        "{\"pending_sales\":[{\"buyer_name\":\"dave\",\"item\":\"Steel\",\"quantity\":4,\"price\":2,"
            + "\"total_silver\":8,\"timestamp\":1767000000.5}],\"count\":1}"));

    List<PendingSale> sales = tradeManager.fetchPendingSales().join();

    assertThat(sales).hasSize(1);
    assertThat(sales.get(0).buyerName()).isEqualTo("dave");
    assertThat(sales.get(0).totalSilver()).isEqualTo(8);
  }

  @Test
  void submitBuy_rejectedLocally_throwsNothingSynchronously() {
    PendingTradeSet selection = new PendingTradeSet(List.of(STEEL));
    selection.stage(STEEL, 100);

    assertThatThrownBy(() -> tradeManager.submitBuy(selection).join())
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(TradeValidationException.class);
  }
}
