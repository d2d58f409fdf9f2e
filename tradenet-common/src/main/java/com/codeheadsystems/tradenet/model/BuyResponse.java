package com.codeheadsystems.tradenet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for {@code POST /buy}. The purchased item details the server echoes back are
 * ignored; the client delivers what it staged.
 *
 * @param status    the status
 * @param totalCost the authoritative total charged, null if the server omitted it
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BuyResponse(
    @JsonProperty("status") String status,
    @JsonProperty("total_cost") Long totalCost) {
}
