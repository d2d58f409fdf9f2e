package com.codeheadsystems.tradenet.client.manager;

import com.codeheadsystems.tradenet.client.codec.TradeCodec;
import com.codeheadsystems.tradenet.client.exceptions.TradeNetException;
import com.codeheadsystems.tradenet.client.exceptions.TradeValidationException;
import com.codeheadsystems.tradenet.client.inventory.WorldInventory;
import com.codeheadsystems.tradenet.client.model.PendingTradeSet;
import com.codeheadsystems.tradenet.client.model.PurchaseResult;
import com.codeheadsystems.tradenet.client.model.StagedTrade;
import com.codeheadsystems.tradenet.model.ClaimResult;
import com.codeheadsystems.tradenet.model.PendingSale;
import com.codeheadsystems.tradenet.model.TradeRecord;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The trading flows offered to the player.
 * <p>
 * Local checks run before anything is sent; a rejected submission never reaches the network.
 * The world inventory is only changed once the server has acknowledged a trade. Server
 * rejections are passed through with their detail text.
 */
@Singleton
public class TradeManager {

  private static final Logger log = LoggerFactory.getLogger(TradeManager.class);

  private static final String FOR_SALE = "/forsale";
  private static final String TRADE = "/trade";
  private static final String BUY = "/buy";
  private static final String PENDING_SALES = "/sales/pending";
  private static final String CLAIM_SALES = "/sales/claim";
  private static final String MY_ITEMS = "/my-items";
  private static final String REMOVE_ITEM = "/remove-item";

  private final RequestClient requestClient;
  private final TradeCodec tradeCodec;
  private final WorldInventory worldInventory;

  /**
   * Instantiates a new Trade manager.
   *
   * @param requestClient  the request client
   * @param tradeCodec     the trade codec
   * @param worldInventory the world inventory
   */
  @Inject
  public TradeManager(final RequestClient requestClient,
                      final TradeCodec tradeCodec,
                      final WorldInventory worldInventory) {
    log.info("TradeManager()");
    this.requestClient = requestClient;
    this.tradeCodec = tradeCodec;
    this.worldInventory = worldInventory;
  }

  // ── Browsing ──────────────────────────────────────────────────────────────

  /**
   * Everything currently offered by other players.
   *
   * @return the listing, records without an item kind removed
   */
  public CompletableFuture<List<TradeRecord>> fetchStock() {
    log.debug("fetchStock()");
    return requestClient.get(FOR_SALE).thenApply(body -> {
      List<TradeRecord> records = tradeCodec.decodeTradeRecords(body).stream()
          .filter(TradeRecord::hasItemKind)
          .collect(Collectors.toList());
      log.info("Fetched {} listed records", records.size());
      return records;
    });
  }

  /**
   * What the player owns and could offer for sale.
   *
   * @return the list
   */
  public List<TradeRecord> colonySellables() {
    return worldInventory.sellableRecords();
  }

  /**
   * The player's own active listings.
   *
   * @return the list
   */
  public CompletableFuture<List<TradeRecord>> fetchMyListings() {
    log.debug("fetchMyListings()");
    return requestClient.get(MY_ITEMS).thenApply(tradeCodec::decodeTradeRecords);
  }

  /**
   * Withdraws one of the player's listings.
   *
   * @param index position in the list returned by {@link #fetchMyListings()}
   * @return the server acknowledgement
   */
  public CompletableFuture<String> removeListing(final int index) {
    if (index < 0) {
      return CompletableFuture.failedFuture(new TradeValidationException("Invalid listing index: " + index));
    }
    log.debug("removeListing({})", index);
    return requestClient.post(REMOVE_ITEM, tradeCodec.encodeRemoveItemRequest(index));
  }

  // ── Buying ────────────────────────────────────────────────────────────────

  /**
   * Buys the staged lines of a stock listing.
   * <p>
   * Fails with {@link TradeValidationException}, without a request, when nothing is staged,
   * when a line asks for more than was listed or when the total exceeds the local currency
   * balance. On acknowledgement the charged total is taken from the currency balance and the
   * items are delivered.
   *
   * @param selection the selection over the last fetched stock
   * @return the purchase
   */
  public CompletableFuture<PurchaseResult> submitBuy(final PendingTradeSet selection) {
    final List<StagedTrade> lines = selection.selected();
    final int balance = worldInventory.currencyBalance();
    final long total;
    try {
      total = validatePurchase(lines, balance);
    } catch (TradeValidationException e) {
      log.warn("Purchase rejected locally: {}", e.getMessage());
      return CompletableFuture.failedFuture(e);
    }
    log.info("Buying {} lines for {} (balance {})", lines.size(), total, balance);
    return requestClient.post(BUY, tradeCodec.encodeBuyRequest(lines, balance)).thenApply(body -> {
      long charged = tradeCodec.decodeTotalCost(body).orElse(total);
      if (charged > 0) {
        worldInventory.removeCurrency((int) Math.min(charged, Integer.MAX_VALUE));
      }
      for (StagedTrade line : lines) {
        worldInventory.deliver(line.record().itemKind(), line.quantity());
      }
      selection.clear();
      log.info("Purchase acknowledged, charged {}", charged);
      return new PurchaseResult(charged, lines);
    });
  }

  private long validatePurchase(final List<StagedTrade> lines, final int balance) {
    if (lines.isEmpty()) {
      throw new TradeValidationException("No items selected for purchase");
    }
    long total = 0;
    for (StagedTrade line : lines) {
      if (line.quantity() > line.record().quantity()) {
        throw new TradeValidationException("Only " + line.record().quantity() + " "
            + line.record().itemKind() + " available, requested " + line.quantity());
      }
      total += (long) line.quantity() * line.record().unitPrice();
    }
    if (total > balance) {
      throw new TradeValidationException("Not enough currency! Need " + total + ", but only have " + balance);
    }
    return total;
  }

  // ── Selling ───────────────────────────────────────────────────────────────

  /**
   * Offers the staged lines for sale. Only lines with a positive quantity are sent, at their
   * staged price. The sold quantities leave the world inventory once the server accepts the
   * offer.
   *
   * @param selection the selection over {@link #colonySellables()}
   * @return the records that were listed
   */
  public CompletableFuture<List<TradeRecord>> submitSell(final PendingTradeSet selection) {
    final List<StagedTrade> lines = selection.selected();
    if (lines.isEmpty()) {
      return CompletableFuture.failedFuture(new TradeValidationException("No items selected for sale"));
    }
    for (StagedTrade line : lines) {
      if (line.quantity() > line.record().quantity()) {
        return CompletableFuture.failedFuture(new TradeValidationException("Only " + line.record().quantity()
            + " " + line.record().itemKind() + " owned, staged " + line.quantity()));
      }
    }
    final List<TradeRecord> offered = lines.stream().map(StagedTrade::toRecord).collect(Collectors.toList());
    log.info("Offering {} lines for sale", offered.size());
    return requestClient.post(TRADE, tradeCodec.encodeSellRequest(offered)).thenApply(ack -> {
      for (TradeRecord record : offered) {
        int missing = worldInventory.removeQuantity(record.itemKind(), record.quantity());
        if (missing > 0) {
          log.warn("Listed {} {} but {} could not be removed locally", record.quantity(), record.itemKind(), missing);
        }
      }
      selection.clear();
      log.info("Sale acknowledged");
      return offered;
    });
  }

  /**
   * Sales by this player that have not been claimed yet.
   *
   * @return the list
   */
  public CompletableFuture<List<PendingSale>> fetchPendingSales() {
    log.debug("fetchPendingSales()");
    return requestClient.get(PENDING_SALES).thenApply(tradeCodec::decodePendingSales);
  }

  /**
   * Collects the proceeds of completed sales and delivers them as currency.
   *
   * @return the claim; fails with {@link TradeNetException} when the server does not report success
   */
  public CompletableFuture<ClaimResult> claimSales() {
    log.debug("claimSales()");
    return requestClient.post(CLAIM_SALES, "{}").thenApply(body -> {
      ClaimResult result = tradeCodec.decodeClaimResult(body);
      if (!result.isSuccess()) {
        log.warn("Claim returned an unexpected response");
        throw new TradeNetException("Failed to claim sales: invalid response");
      }
      if (result.totalClaimed() > 0) {
        worldInventory.deliverCurrency(result.totalClaimed());
        log.info("Claimed {} from {} sales", result.totalClaimed(), result.claimedCount());
      } else {
        log.info("No pending sales to claim");
      }
      return result;
    });
  }
}
