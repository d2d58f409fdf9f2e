package com.codeheadsystems.tradenet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A sale another player made from our listings that has not been claimed yet.
 *
 * @param buyerName   the buyer
 * @param item        the item kind sold
 * @param quantity    units sold
 * @param price       unit price
 * @param totalSilver currency owed for this sale
 * @param timestamp   unix time of the sale in seconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingSale(
    @JsonProperty("buyer_name") String buyerName,
    @JsonProperty("item") String item,
    @JsonProperty("quantity") int quantity,
    @JsonProperty("price") int price,
    @JsonProperty("total_silver") long totalSilver,
    @JsonProperty("timestamp") double timestamp) {
}
