package com.codeheadsystems.tradenet.client.store;

import java.util.Optional;

/**
 * Durable home of the last known bearer token.
 * <p>
 * The stored copy is what survives a restart. Every {@link #save} replaces the whole entry;
 * a reader never observes a half-written one.
 */
public interface TokenStore {

  /**
   * Loads the stored token, whether or not it is still valid.
   *
   * @return the cached token, or empty if nothing is stored
   * @throws com.codeheadsystems.tradenet.client.exceptions.TokenStoreException if the entry
   *                                                                            exists but cannot be read
   */
  Optional<CachedToken> load();

  /**
   * Replaces the stored entry.
   *
   * @param cachedToken the cached token
   */
  void save(CachedToken cachedToken);

  /**
   * Removes the stored entry. Deleting a missing entry is a no-op.
   */
  void delete();
}
