package com.codeheadsystems.tradenet.cli;

import com.codeheadsystems.tradenet.client.accessor.TradeNetAccessor;
import com.codeheadsystems.tradenet.client.codec.TradeCodec;
import com.codeheadsystems.tradenet.client.config.TradeClientConfig;
import com.codeheadsystems.tradenet.client.exceptions.AuthenticationRequiredException;
import com.codeheadsystems.tradenet.client.exceptions.TradeNetException;
import com.codeheadsystems.tradenet.client.identity.StaticIdentityProvider;
import com.codeheadsystems.tradenet.client.inventory.InMemoryWorldInventory;
import com.codeheadsystems.tradenet.client.manager.RequestClient;
import com.codeheadsystems.tradenet.client.manager.SessionManager;
import com.codeheadsystems.tradenet.client.manager.TradeManager;
import com.codeheadsystems.tradenet.client.model.PendingTradeSet;
import com.codeheadsystems.tradenet.client.model.PurchaseResult;
import com.codeheadsystems.tradenet.client.scheduler.ExecutorTaskScheduler;
import com.codeheadsystems.tradenet.client.scheduler.TaskScheduler;
import com.codeheadsystems.tradenet.client.store.FileTokenStore;
import com.codeheadsystems.tradenet.client.store.InMemoryTokenStore;
import com.codeheadsystems.tradenet.client.store.TokenStore;
import com.codeheadsystems.tradenet.model.ClaimResult;
import com.codeheadsystems.tradenet.model.PendingSale;
import com.codeheadsystems.tradenet.model.TradeRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Command-line trading client.
 *
 * <pre>
 * Usage:
 *   java -jar tradenet-cli.jar &lt;command&gt; [arguments] --ticket &lt;hex&gt; [options]
 *
 * Commands:
 *   login                 Exchange the ticket for a bearer token and cache it.
 *   stock                 List everything offered for sale.
 *   mine                  List this player's own listings.
 *   remove &lt;index&gt;        Withdraw one of this player's listings.
 *   buy &lt;index&gt; &lt;qty&gt;     Buy from the stock listing (needs --currency).
 *   pending               List sales waiting to be claimed.
 *   claim                 Claim the proceeds of completed sales.
 *
 * Options:
 *   --server &lt;url&gt;        Server base URL             (default: http://localhost:5000)
 *   --ticket &lt;hex&gt;        Identity ticket, hex encoded (required)
 *   --player &lt;name&gt;       Player display name          (default: player)
 *   --save-dir &lt;dir&gt;      Directory of the token cache (default: ~/.tradenet)
 *   --timeout &lt;seconds&gt;   Request timeout, 5..60       (default: 30)
 *   --currency &lt;n&gt;        Local currency balance       (default: 0)
 *   --no-cache            Do not read or write the token cache
 * </pre>
 *
 * <p>The cached token is reused across runs until it expires, so {@code login} is only needed to
 * check the ticket.
 */
public class TradeNetCli {

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    final CliOptions options;
    try {
      options = CliOptions.parse(args);
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      printUsage();
      System.exit(1);
      return;
    }

    int status;
    try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler()) {
      status = run(options, scheduler);
    }
    System.exit(status);
  }

  static int run(final CliOptions options, final TaskScheduler scheduler) {
    final ObjectMapper objectMapper = new ObjectMapper();
    final TradeClientConfig config;
    final StaticIdentityProvider identityProvider;
    try {
      config = options.clientConfig();
      identityProvider = StaticIdentityProvider.fromHex(options.playerName(), options.ticketHex());
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
    TokenStore tokenStore = options.noCache()
        ? new InMemoryTokenStore()
        : FileTokenStore.inSaveDirectory(options.saveDir(), objectMapper);
    HttpClient httpClient = HttpClient.newBuilder().connectTimeout(config.requestTimeout()).build();
    TradeNetAccessor accessor = new TradeNetAccessor(config, httpClient, objectMapper, scheduler);
    InMemoryWorldInventory inventory = new InMemoryWorldInventory(options.currency());

    System.out.println("Server : " + config.serverUri());
    System.out.println("Player : " + options.playerName());
    System.out.println();

    try {
      SessionManager session = onLoop(scheduler, () -> CompletableFuture.completedFuture(
          new SessionManager(config, accessor, identityProvider, tokenStore, scheduler, objectMapper, Clock.systemUTC())));
      try {
        return runCommand(options, scheduler, session, accessor, inventory, objectMapper);
      } finally {
        runOnLoop(scheduler, session::close);
      }
    } catch (AuthenticationRequiredException e) {
      System.err.println(e.getMessage());
      return 2;
    } catch (TradeNetException | IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private static int runCommand(final CliOptions options,
                                final TaskScheduler scheduler,
                                final SessionManager session,
                                final TradeNetAccessor accessor,
                                final InMemoryWorldInventory inventory,
                                final ObjectMapper objectMapper) {
    RequestClient requestClient = new RequestClient(accessor, session, scheduler);
    TradeManager tradeManager = new TradeManager(requestClient, new TradeCodec(objectMapper), inventory);
    switch (options.command()) {
      case "login"   -> runLogin(scheduler, session);
      case "stock"   -> printRecords(onLoop(scheduler, tradeManager::fetchStock));
      case "mine"    -> printRecords(onLoop(scheduler, tradeManager::fetchMyListings));
      case "remove"  -> runRemove(scheduler, tradeManager, options.intArgument(0, "index"));
      case "buy"     -> runBuy(scheduler, tradeManager, options.intArgument(0, "index"),
          options.intArgument(1, "qty"));
      case "pending" -> printPendingSales(onLoop(scheduler, tradeManager::fetchPendingSales));
      case "claim"   -> runClaim(scheduler, tradeManager);
      default -> {
        System.err.println("Unknown command: " + options.command());
        printUsage();
        return 1;
      }
    }
    return 0;
  }

  private static void runLogin(final TaskScheduler scheduler, final SessionManager session) {
    System.out.println("Authenticating...");
    onLoop(scheduler, session::ensureAuthenticated);
    System.out.println("Authentication successful.");
    System.out.println("  expires at : " + onLoop(scheduler, () -> CompletableFuture.completedFuture(session.expiresAt())));
  }

  private static void runRemove(final TaskScheduler scheduler, final TradeManager tradeManager, final int index) {
    String ack = onLoop(scheduler, () -> tradeManager.removeListing(index));
    System.out.println("Listing " + index + " removed: " + ack);
  }

  private static void runBuy(final TaskScheduler scheduler, final TradeManager tradeManager,
                             final int index, final int quantity) {
    List<TradeRecord> stock = onLoop(scheduler, tradeManager::fetchStock);
    if (index < 0 || index >= stock.size()) {
      throw new IllegalArgumentException("No listing at index " + index + " (" + stock.size() + " listed)");
    }
    PurchaseResult result = onLoop(scheduler, () -> {
      PendingTradeSet selection = new PendingTradeSet(stock);
      selection.stage(stock.get(index), quantity);
      return tradeManager.submitBuy(selection);
    });
    System.out.println("Bought " + quantity + " " + stock.get(index).itemKind() + " for " + result.totalCost());
  }

  private static void runClaim(final TaskScheduler scheduler, final TradeManager tradeManager) {
    ClaimResult result = onLoop(scheduler, tradeManager::claimSales);
    System.out.println("Claimed " + result.totalClaimed() + " from " + result.claimedCount() + " sales.");
  }

  private static void printRecords(final List<TradeRecord> records) {
    if (records.isEmpty()) {
      System.out.println("(nothing listed)");
    }
    for (int i = 0; i < records.size(); i++) {
      TradeRecord r = records.get(i);
      System.out.printf("%3d  %-30s x%-6d @ %-6d %-10s %s%n",
          i, r.itemKind(), r.quantity(), r.unitPrice(), r.quality(), r.counterpartyName());
    }
  }

  private static void printPendingSales(final List<PendingSale> sales) {
    if (sales.isEmpty()) {
      System.out.println("(no pending sales)");
    }
    for (PendingSale sale : sales) {
      System.out.printf("%-20s bought %-6d %-30s for %d%n",
          sale.buyerName(), sale.quantity(), sale.item(), sale.totalSilver());
    }
  }

  /**
   * Starts the operation on the scheduler thread and waits for it.
   */
  static <T> T onLoop(final TaskScheduler scheduler, final Supplier<CompletableFuture<T>> operation) {
    CompletableFuture<T> result = new CompletableFuture<>();
    scheduler.execute(() -> {
      try {
        operation.get().whenComplete((value, error) -> {
          if (error != null) {
            result.completeExceptionally(error);
          } else {
            result.complete(value);
          }
        });
      } catch (RuntimeException e) {
        result.completeExceptionally(e);
      }
    });
    try {
      return result.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TradeNetException("Interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      while (cause instanceof CompletionException && cause.getCause() != null) {
        cause = cause.getCause();
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new TradeNetException(String.valueOf(cause.getMessage()), cause);
    }
  }

  /**
   * Runs the action on the scheduler thread and waits for it to finish.
   */
  static void runOnLoop(final TaskScheduler scheduler, final Runnable action) {
    onLoop(scheduler, () -> {
      action.run();
      return CompletableFuture.completedFuture(null);
    });
  }

  private static void printUsage() {
    System.err.println("Usage: TradeNetCli <command> [arguments] --ticket <hex> [options]");
    System.err.println();
    System.err.println("Commands:");
    System.err.println("  login                 Exchange the ticket for a bearer token");
    System.err.println("  stock                 List everything offered for sale");
    System.err.println("  mine                  List this player's own listings");
    System.err.println("  remove <index>        Withdraw one of this player's listings");
    System.err.println("  buy <index> <qty>     Buy from the stock listing (needs --currency)");
    System.err.println("  pending               List sales waiting to be claimed");
    System.err.println("  claim                 Claim the proceeds of completed sales");
    System.err.println();
    System.err.println("Options:");
    System.err.println("  --server <url>        Server base URL              (default: " + TradeClientConfig.DEVELOPMENT_SERVER + ")");
    System.err.println("  --ticket <hex>        Identity ticket, hex encoded (required)");
    System.err.println("  --player <name>       Player display name          (default: " + CliOptions.DEFAULT_PLAYER + ")");
    System.err.println("  --save-dir <dir>      Directory of the token cache (default: " + CliOptions.DEFAULT_SAVE_DIR + ")");
    System.err.println("  --timeout <seconds>   Request timeout, 5..60       (default: 30)");
    System.err.println("  --currency <n>        Local currency balance       (default: 0)");
    System.err.println("  --no-cache            Do not read or write the token cache");
  }
}
