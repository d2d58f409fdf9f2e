package com.codeheadsystems.tradenet.client.store;

import java.util.Optional;

/**
 * Non-persistent {@link TokenStore}. The token is lost when the process exits.
 */
public class InMemoryTokenStore implements TokenStore {

  private CachedToken cachedToken;

  @Override
  public Optional<CachedToken> load() {
    return Optional.ofNullable(cachedToken);
  }

  @Override
  public void save(final CachedToken cachedToken) {
    this.cachedToken = cachedToken;
  }

  @Override
  public void delete() {
    cachedToken = null;
  }
}
