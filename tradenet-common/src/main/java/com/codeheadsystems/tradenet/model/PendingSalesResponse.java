package com.codeheadsystems.tradenet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model for {@code GET /sales/pending}.
 *
 * @param pendingSales the pending sales, may be null on an empty answer
 * @param count        the count reported by the server
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingSalesResponse(
    @JsonProperty("pending_sales") List<PendingSale> pendingSales,
    @JsonProperty("count") int count) {

  /**
   * The pending sales, never null.
   *
   * @return the list
   */
  public List<PendingSale> salesOrEmpty() {
    return pendingSales == null ? List.of() : pendingSales;
  }
}
