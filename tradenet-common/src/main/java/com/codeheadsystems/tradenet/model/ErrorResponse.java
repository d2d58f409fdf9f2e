package com.codeheadsystems.tradenet.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a rejected request: {@code {"detail": ...}}.
 * <p>
 * Business rejections carry a plain string ("Not enough silver. Required: 50, You have: 10").
 * Request validation failures carry a structured value (a list of field errors); it is kept as
 * whatever Jackson produced and rendered with {@link #detailText()}.
 *
 * @param detail the detail, a String for business errors or a List/Map for validation errors
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorResponse(@JsonProperty("detail") Object detail) {

  /**
   * The detail as display text, or null when the server sent none.
   *
   * @return the string
   */
  public String detailText() {
    if (detail == null) {
      return null;
    }
    return detail instanceof String text ? text : detail.toString();
  }
}
