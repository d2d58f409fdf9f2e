package com.codeheadsystems.tradenet.client.identity;

import java.util.HashSet;
import java.util.HexFormat;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IdentityProvider} that hands out a fixed ticket under a fixed name.
 * <p>
 * Useful where the ticket is obtained out of band, e.g. pasted into the command line, and for
 * tests. Each call to {@link #acquireTicket()} yields a fresh handle so cancellation can be
 * tracked.
 */
public class StaticIdentityProvider implements IdentityProvider {

  private static final Logger log = LoggerFactory.getLogger(StaticIdentityProvider.class);

  private final String displayName;
  private final String identityHandle;
  private final byte[] ticketData;
  private final Set<Long> outstanding = new HashSet<>();
  private long nextHandle = 1;

  /**
   * Instantiates a new Static identity provider.
   *
   * @param displayName    the display name
   * @param identityHandle the identity handle
   * @param ticketData     the ticket bytes, empty means "not signed in"
   */
  public StaticIdentityProvider(final String displayName,
                                final String identityHandle,
                                final byte[] ticketData) {
    log.info("StaticIdentityProvider({})", displayName);
    this.displayName = displayName;
    this.identityHandle = identityHandle;
    this.ticketData = ticketData == null ? new byte[0] : ticketData.clone();
  }

  /**
   * Provider for a ticket given as a hex string.
   *
   * @param displayName the display name
   * @param ticketHex   the ticket in hex
   * @return the static identity provider
   */
  public static StaticIdentityProvider fromHex(final String displayName, final String ticketHex) {
    return new StaticIdentityProvider(displayName, displayName, HexFormat.of().parseHex(ticketHex));
  }

  @Override
  public boolean isAvailable() {
    return ticketData.length > 0;
  }

  @Override
  public String displayName() {
    return displayName;
  }

  @Override
  public String identityHandle() {
    return identityHandle;
  }

  @Override
  public Optional<IdentityTicket> acquireTicket() {
    if (!isAvailable()) {
      return Optional.empty();
    }
    long handle = nextHandle++;
    outstanding.add(handle);
    return Optional.of(new IdentityTicket(handle, ticketData));
  }

  @Override
  public void cancelTicket(final IdentityTicket ticket) {
    if (ticket != null && outstanding.remove(ticket.handle())) {
      log.debug("cancelTicket(handle={})", ticket.handle());
    }
  }

  /**
   * Number of tickets issued and not canceled.
   *
   * @return the int
   */
  public int outstandingTickets() {
    return outstanding.size();
  }
}
