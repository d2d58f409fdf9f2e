package com.codeheadsystems.tradenet.client.identity;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * An opaque authentication ticket issued by the platform identity provider for the current
 * player. A ticket is invalid once it has been canceled or replaced.
 *
 * @param handle provider-assigned handle, used to cancel the ticket
 * @param data   the ticket bytes
 */
public record IdentityTicket(long handle, byte[] data) {

  /**
   * Copies the ticket bytes.
   */
  public IdentityTicket {
    data = data == null ? new byte[0] : data.clone();
  }

  @Override
  public byte[] data() {
    return data.clone();
  }

  /**
   * The ticket as a lowercase hex string, two characters per byte.
   *
   * @return the string
   */
  public String toHex() {
    return HexFormat.of().formatHex(data);
  }

  /**
   * Is empty boolean.
   *
   * @return the boolean
   */
  public boolean isEmpty() {
    return data.length == 0;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof IdentityTicket other)) {
      return false;
    }
    return handle == other.handle && Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(handle) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "IdentityTicket[handle=" + handle + ", bytes=" + data.length + "]";
  }
}
