package com.codeheadsystems.tradenet.client.manager;

import com.codeheadsystems.tradenet.client.accessor.TradeNetAccessor;
import com.codeheadsystems.tradenet.client.config.TradeClientConfig;
import com.codeheadsystems.tradenet.client.exceptions.AuthExchangeFailedException;
import com.codeheadsystems.tradenet.client.exceptions.IdentityUnavailableException;
import com.codeheadsystems.tradenet.client.exceptions.TokenStoreException;
import com.codeheadsystems.tradenet.client.identity.IdentityProvider;
import com.codeheadsystems.tradenet.client.identity.IdentityTicket;
import com.codeheadsystems.tradenet.client.scheduler.TaskScheduler;
import com.codeheadsystems.tradenet.client.store.CachedToken;
import com.codeheadsystems.tradenet.client.store.TokenStore;
import com.codeheadsystems.tradenet.model.LoginRequest;
import com.codeheadsystems.tradenet.model.LoginResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the player's credentials: the outstanding identity ticket and the bearer token.
 * <p>
 * The token is mirrored in memory and in the {@link TokenStore}. The stored copy is read once,
 * at construction, and is what survives a restart; from then on the in-memory copy is
 * authoritative and every change is written through. Validity is always re-evaluated against
 * the {@link Clock}, never cached.
 * <p>
 * <strong>Ticket exchange:</strong>
 * <ol>
 *   <li>Cancel the outstanding ticket, if any, and request a new one from the identity provider.</li>
 *   <li>Send it as lowercase hex with the player's display name to {@code POST /auth/login}.</li>
 *   <li>On an answer carrying a token, cache it for {@link TradeClientConfig#tokenTtl()}.
 *       Otherwise retry after {@link TradeClientConfig#loginRetryDelay()} on the scheduler, up to
 *       {@link TradeClientConfig#maxLoginAttempts()} attempts in total.</li>
 * </ol>
 * Every method must be called on the scheduler thread. Overlapping exchanges are tolerated: the
 * last one to finish wins.
 */
@Singleton
public class SessionManager implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private final TradeClientConfig config;
  private final TradeNetAccessor accessor;
  private final IdentityProvider identityProvider;
  private final TokenStore tokenStore;
  private final TaskScheduler scheduler;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private IdentityTicket outstandingTicket;
  private String token;
  private Instant expiresAt = Instant.MIN;

  /**
   * Instantiates a new Session manager and loads the durable token, discarding it if expired.
   *
   * @param config           the config
   * @param accessor         the accessor
   * @param identityProvider the identity provider
   * @param tokenStore       the token store
   * @param scheduler        the scheduler
   * @param objectMapper     the object mapper
   * @param clock            the clock
   */
  @Inject
  public SessionManager(final TradeClientConfig config,
                        final TradeNetAccessor accessor,
                        final IdentityProvider identityProvider,
                        final TokenStore tokenStore,
                        final TaskScheduler scheduler,
                        final ObjectMapper objectMapper,
                        final Clock clock) {
    log.info("SessionManager()");
    this.config = config;
    this.accessor = accessor;
    this.identityProvider = identityProvider;
    this.tokenStore = tokenStore;
    this.scheduler = scheduler;
    this.objectMapper = objectMapper;
    this.clock = clock;
    loadCachedToken();
  }

  private void loadCachedToken() {
    final Optional<CachedToken> cached;
    try {
      cached = tokenStore.load();
    } catch (TokenStoreException e) {
      log.warn("Discarding unreadable token cache: {}", e.getMessage());
      deleteStoredToken();
      return;
    }
    if (cached.isEmpty()) {
      return;
    }
    if (cached.get().isValidAt(clock.instant())) {
      token = cached.get().token();
      expiresAt = cached.get().expiresAt();
      log.info("Loaded cached bearer token, expires {}", expiresAt);
    } else {
      log.warn("Cached bearer token has expired, clearing");
      clearToken();
    }
  }

  // ── Token access ──────────────────────────────────────────────────────────

  /**
   * Whether a token is cached and unexpired right now.
   *
   * @return the boolean
   */
  public boolean hasValidToken() {
    return token != null && !token.isEmpty() && clock.instant().isBefore(expiresAt);
  }

  /**
   * The token if it is currently valid. Otherwise the stale token is dropped, an
   * {@link #ensureAuthenticated()} is queued on the scheduler, and empty is returned; a later
   * call may then succeed.
   *
   * @return the bearer token
   */
  public Optional<String> getToken() {
    if (hasValidToken()) {
      return Optional.of(token);
    }
    if (token != null) {
      log.warn("Bearer token expired at {}, re-authenticating", expiresAt);
      clearToken();
    } else {
      log.warn("No valid bearer token, authenticating");
    }
    scheduler.execute(() -> ensureAuthenticated().whenComplete((ignored, error) -> {
      if (error != null) {
        log.warn("Background authentication failed: {}", unwrap(error).getMessage());
      }
    }));
    return Optional.empty();
  }

  /**
   * Makes sure a valid token is cached.
   * <p>
   * Returns at once, without any network call, when the cached token is still valid. Otherwise
   * runs the ticket exchange.
   *
   * @return the token; fails with {@link IdentityUnavailableException} when no ticket can be
   *     obtained, or {@link AuthExchangeFailedException} when every exchange attempt failed
   */
  public CompletableFuture<String> ensureAuthenticated() {
    if (hasValidToken()) {
      log.debug("ensureAuthenticated: using cached token");
      return CompletableFuture.completedFuture(token);
    }
    if (token != null) {
      clearToken();
    }
    final IdentityTicket ticket;
    try {
      ticket = acquireTicket();
    } catch (IdentityUnavailableException e) {
      log.error("Cannot authenticate: {}", e.getMessage());
      return CompletableFuture.failedFuture(e);
    }
    final LoginRequest login = new LoginRequest(ticket.toHex(), identityProvider.displayName());
    final CompletableFuture<String> result = new CompletableFuture<>();
    log.info("Authenticating {} with server", login.playerName());
    attemptLogin(ticket, login, 1, result);
    return result;
  }

  private IdentityTicket acquireTicket() {
    if (!identityProvider.isAvailable()) {
      throw new IdentityUnavailableException("Identity provider is not available; sign in to the platform first");
    }
    try {
      cancelOutstandingTicket();
      IdentityTicket ticket = identityProvider.acquireTicket()
          .filter(t -> !t.isEmpty())
          .orElseThrow(() -> new IdentityUnavailableException("Identity provider did not issue a ticket"));
      outstandingTicket = ticket;
      return ticket;
    } catch (IdentityUnavailableException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new IdentityUnavailableException("Identity provider failed: " + e.getMessage(), e);
    }
  }

  private void attemptLogin(final IdentityTicket ticket,
                            final LoginRequest login,
                            final int attempt,
                            final CompletableFuture<String> result) {
    if (attempt > 1 && superseded(ticket, attempt - 1, result)) {
      return;
    }
    accessor.login(login).whenComplete((body, error) -> {
      Throwable failure = error == null ? null : unwrap(error);
      String issued = failure == null ? extractToken(body) : null;
      if (issued != null) {
        storeToken(issued);
        log.info("Authenticated with server on attempt {}, token expires {}", attempt, expiresAt);
        result.complete(issued);
        return;
      }
      String reason = failure != null ? failure.getMessage() : "no token in response";
      if (superseded(ticket, attempt, result)) {
        return;
      }
      if (attempt < config.maxLoginAttempts()) {
        log.warn("Authentication attempt {} failed: {}. Retrying in {}s",
            attempt, reason, config.loginRetryDelay().toSeconds());
        scheduler.schedule(() -> attemptLogin(ticket, login, attempt + 1, result), config.loginRetryDelay());
      } else {
        log.error("Server authentication failed after {} attempts: {}", attempt, reason);
        result.completeExceptionally(new AuthExchangeFailedException(
            "Server authentication failed after " + attempt + " attempts: " + reason, attempt, failure));
      }
    });
  }

  // A canceled ticket can never be exchanged, so its retries stop here.
  private boolean superseded(final IdentityTicket ticket,
                             final int attempts,
                             final CompletableFuture<String> result) {
    if (outstandingTicket == ticket) {
      return false;
    }
    log.info("Ticket {} was canceled, abandoning its exchange after {} attempt(s)", ticket.handle(), attempts);
    result.completeExceptionally(new AuthExchangeFailedException(
        "Identity ticket was canceled before the exchange succeeded", attempts, null));
    return true;
  }

  private String extractToken(final String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      LoginResponse response = objectMapper.readValue(body, LoginResponse.class);
      return response != null && response.hasToken() ? response.token() : null;
    } catch (JsonProcessingException e) {
      log.warn("Unreadable login response: {}", e.getOriginalMessage());
      return null;
    }
  }

  private void storeToken(final String issued) {
    token = issued;
    expiresAt = clock.instant().plus(config.tokenTtl());
    persist();
  }

  // ── Lifecycle ─────────────────────────────────────────────────────────────

  /**
   * Slides the token's expiry to a full {@link TradeClientConfig#tokenTtl()} from now and
   * persists it. Called after every successful authenticated call. Does not contact the
   * identity provider.
   */
  public void renewExpiry() {
    if (token == null || token.isEmpty()) {
      return;
    }
    expiresAt = clock.instant().plus(config.tokenTtl());
    persist();
    log.debug("Token expiry renewed to {}", expiresAt);
  }

  /**
   * Forgets the token in memory and in the store. Used when the server rejects the token or it
   * has expired.
   */
  public void clearToken() {
    token = null;
    expiresAt = Instant.MIN;
    deleteStoredToken();
  }

  /**
   * Cancels the outstanding ticket and forgets the in-memory credentials. The stored token is
   * kept so the next process start can reuse it.
   */
  public void cleanup() {
    cancelOutstandingTicket();
    token = null;
    expiresAt = Instant.MIN;
    log.info("Identity ticket and bearer token cleaned up");
  }

  @Override
  public void close() {
    cleanup();
  }

  /**
   * The in-memory expiry, {@link Instant#MIN} when no token is held.
   *
   * @return the instant
   */
  public Instant expiresAt() {
    return expiresAt;
  }

  private void cancelOutstandingTicket() {
    if (outstandingTicket != null) {
      IdentityTicket ticket = outstandingTicket;
      outstandingTicket = null;
      identityProvider.cancelTicket(ticket);
    }
  }

  private void persist() {
    try {
      tokenStore.save(CachedToken.of(token, expiresAt));
    } catch (TokenStoreException e) {
      log.error("Unable to persist bearer token, keeping it in memory only: {}", e.getMessage());
    }
  }

  private void deleteStoredToken() {
    try {
      tokenStore.delete();
    } catch (TokenStoreException e) {
      log.error("Unable to delete token cache: {}", e.getMessage());
    }
  }

  static Throwable unwrap(final Throwable error) {
    return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
  }
}
