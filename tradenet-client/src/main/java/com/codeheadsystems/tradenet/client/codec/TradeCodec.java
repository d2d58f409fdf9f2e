package com.codeheadsystems.tradenet.client.codec;

import com.codeheadsystems.tradenet.client.exceptions.DecodeException;
import com.codeheadsystems.tradenet.client.model.StagedTrade;
import com.codeheadsystems.tradenet.model.BuyResponse;
import com.codeheadsystems.tradenet.model.ClaimResponse;
import com.codeheadsystems.tradenet.model.ClaimResult;
import com.codeheadsystems.tradenet.model.ClaimStatus;
import com.codeheadsystems.tradenet.model.PendingSale;
import com.codeheadsystems.tradenet.model.PendingSalesResponse;
import com.codeheadsystems.tradenet.model.TradeRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts trade records and settlement results to and from the server's JSON.
 * <p>
 * Trade-record lists come back under endpoint-specific envelopes ({@code records},
 * {@code items}, {@code my_items}) and individual records may be incomplete, so they are read
 * with {@link JsonLiteParser} element by element: a damaged record is dropped, the rest of the
 * batch survives. Request bodies for buying and selling are written by hand with every string
 * escaped. Schema-shaped answers (claim, buy, pending sales) go through Jackson first.
 */
@Singleton
public class TradeCodec {

  private static final Logger log = LoggerFactory.getLogger(TradeCodec.class);

  private static final Pattern EMPTY_ARRAY_MARKER =
      Pattern.compile("\"(records|items)\"\\s*:\\s*\\[\\s*]");

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Trade codec.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public TradeCodec(final ObjectMapper objectMapper) {
    log.info("TradeCodec()");
    this.objectMapper = objectMapper;
  }

  // ── Trade records ─────────────────────────────────────────────────────────

  /**
   * Decodes the trade records of a listing answer.
   * <p>
   * Records without an item kind, and elements that are not readable objects, are dropped.
   *
   * @param text the response body
   * @return the records, in server order
   * @throws DecodeException if no array can be located in the text at all
   */
  public List<TradeRecord> decodeTradeRecords(final String text) {
    if (text == null) {
      throw new DecodeException("Empty response, expected a list of trade records");
    }
    int[] span = JsonLiteParser.outerArraySpan(text);
    Matcher emptyMarker = EMPTY_ARRAY_MARKER.matcher(text);
    if (emptyMarker.find() && (span == null || emptyMarker.start() < span[0])) {
      log.debug("decodeTradeRecords: empty listing");
      return List.of();
    }
    if (span == null) {
      throw new DecodeException("No trade record array found in response");
    }
    List<TradeRecord> records = new ArrayList<>();
    int dropped = 0;
    for (String element : JsonLiteParser.splitElements(text.substring(span[0] + 1, span[1]))) {
      TradeRecord record = decodeElement(element);
      if (record == null) {
        dropped++;
      } else {
        records.add(record);
      }
    }
    if (dropped > 0) {
      log.warn("decodeTradeRecords: dropped {} malformed record(s), kept {}", dropped, records.size());
    }
    log.debug("decodeTradeRecords: {} record(s)", records.size());
    return records;
  }

  private TradeRecord decodeElement(final String element) {
    Object value;
    try {
      value = JsonLiteParser.parse(element);
    } catch (DecodeException e) {
      log.debug("Unreadable trade record: {}", e.getMessage());
      return null;
    }
    if (!(value instanceof Map<?, ?> fields)) {
      return null;
    }
    String itemKind = "";
    String counterparty = "";
    String quality = "";
    int quantity = 0;
    int unitPrice = 0;
    for (Map.Entry<?, ?> field : fields.entrySet()) {
      switch (normalizeKey(String.valueOf(field.getKey()))) {
        case "defname" -> itemKind = asText(field.getValue());
        case "quantity" -> quantity = asCount(field.getValue());
        case "price" -> unitPrice = asCount(field.getValue());
        case "playername" -> counterparty = asText(field.getValue());
        case "quality" -> quality = asText(field.getValue());
        default -> {
          // unknown fields are ignored
        }
      }
    }
    if (itemKind.isBlank() || quantity < 0 || unitPrice < 0) {
      return null;
    }
    return new TradeRecord(itemKind, quantity, unitPrice, counterparty, quality);
  }

  private static String normalizeKey(final String key) {
    return key.replace("_", "").toLowerCase(Locale.ROOT);
  }

  private static String asText(final Object value) {
    if (value instanceof String text) {
      return text;
    }
    if (value instanceof Number || value instanceof Boolean) {
      return value.toString();
    }
    return "";
  }

  private static int asCount(final Object value) {
    if (value instanceof Long number) {
      return number > Integer.MAX_VALUE || number < Integer.MIN_VALUE ? -1 : number.intValue();
    }
    if (value instanceof Double number) {
      return number > Integer.MAX_VALUE || number < Integer.MIN_VALUE ? -1 : number.intValue();
    }
    if (value instanceof String text) {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException e) {
        return 0;
      }
    }
    return 0;
  }

  /**
   * Body for {@code POST /trade}: {@code {"records":[{"DefName":..,"Quantity":..,"Price":..,
   * "PlayerName":..,"Quality":..}]}}.
   *
   * @param items the items to list
   * @return the json
   */
  public String encodeSellRequest(final List<TradeRecord> items) {
    StringBuilder sb = new StringBuilder("{\"records\":[");
    for (int i = 0; i < items.size(); i++) {
      TradeRecord record = items.get(i);
      if (i > 0) {
        sb.append(',');
      }
      sb.append("{\"DefName\":").append(quote(record.itemKind()))
          .append(",\"Quantity\":").append(record.quantity())
          .append(",\"Price\":").append(record.unitPrice())
          .append(",\"PlayerName\":").append(quote(record.counterpartyName()))
          .append(",\"Quality\":").append(quote(record.quality()))
          .append('}');
    }
    return sb.append("]}").toString();
  }

  /**
   * Body for {@code POST /buy}. The client's currency balance is sent along so the server can
   * spot a client acting on stale state.
   *
   * @param items        the lines to buy
   * @param clientSilver the locally observed currency balance
   * @return the json
   */
  public String encodeBuyRequest(final List<StagedTrade> items, final int clientSilver) {
    StringBuilder sb = new StringBuilder("{\"items\":[");
    for (int i = 0; i < items.size(); i++) {
      StagedTrade item = items.get(i);
      if (i > 0) {
        sb.append(',');
      }
      sb.append("{\"def_name\":").append(quote(item.record().itemKind()))
          .append(",\"quantity\":").append(item.quantity())
          .append(",\"seller_name\":").append(quote(item.record().counterpartyName()))
          .append('}');
    }
    return sb.append("],\"client_silver\":").append(clientSilver).append('}').toString();
  }

  /**
   * Body for {@code POST /remove-item}.
   *
   * @param index the listing index
   * @return the json
   */
  public String encodeRemoveItemRequest(final int index) {
    return "{\"index\":" + index + "}";
  }

  /**
   * JSON string literal for the value, quotes included.
   *
   * @param value the value, null is written as an empty string
   * @return the string
   */
  static String quote(final String value) {
    StringBuilder sb = new StringBuilder("\"");
    String text = value == null ? "" : value;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    return sb.append('"').toString();
  }

  // ── Settlement ────────────────────────────────────────────────────────────

  /**
   * Decodes the answer of {@code POST /sales/claim}. Never fails: an unusable answer yields
   * {@link ClaimResult#error()}.
   *
   * @param text the response body
   * @return the claim result
   */
  public ClaimResult decodeClaimResult(final String text) {
    if (text == null || text.isBlank()) {
      return ClaimResult.error();
    }
    try {
      ClaimResponse response = objectMapper.readValue(text, ClaimResponse.class);
      if (response != null && response.status() != null) {
        return response.toClaimResult();
      }
    } catch (JsonProcessingException e) {
      log.warn("Claim response did not match its schema, scanning for fields: {}", e.getOriginalMessage());
    }
    try {
      String status = scanString(text, "status");
      int totalClaimed = scanInt(text, "total_claimed");
      int claimedCount = scanInt(text, "claimed_sales_count");
      if (status == null) {
        return ClaimResult.error();
      }
      return new ClaimResult(ClaimStatus.fromWire(status), totalClaimed, claimedCount);
    } catch (RuntimeException e) {
      log.warn("Unable to scan claim response: {}", e.getMessage());
      return ClaimResult.error();
    }
  }

  /**
   * Value of a string field found by searching for its quoted key, or null.
   */
  static String scanString(final String text, final String key) {
    int valueStart = valueStart(text, key);
    if (valueStart < 0 || valueStart >= text.length() || text.charAt(valueStart) != '"') {
      return null;
    }
    StringBuilder sb = new StringBuilder();
    for (int i = valueStart + 1; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\\' && i + 1 < text.length()) {
        sb.append(text.charAt(++i));
      } else if (c == '"') {
        return sb.toString();
      } else {
        sb.append(c);
      }
    }
    return null;
  }

  /**
   * Value of an integer field found by searching for its quoted key, or 0.
   */
  static int scanInt(final String text, final String key) {
    int valueStart = valueStart(text, key);
    if (valueStart < 0) {
      return 0;
    }
    int end = valueStart;
    if (end < text.length() && text.charAt(end) == '-') {
      end++;
    }
    while (end < text.length() && Character.isDigit(text.charAt(end))) {
      end++;
    }
    try {
      return Integer.parseInt(text.substring(valueStart, end));
    } catch (NumberFormatException e) {
      return 0;
    }
  }

  private static int valueStart(final String text, final String key) {
    int keyIndex = text.indexOf("\"" + key + "\"");
    if (keyIndex < 0) {
      return -1;
    }
    int colon = text.indexOf(':', keyIndex + key.length() + 2);
    if (colon < 0) {
      return -1;
    }
    int start = colon + 1;
    while (start < text.length() && Character.isWhitespace(text.charAt(start))) {
      start++;
    }
    return start;
  }

  // ── Other answers ─────────────────────────────────────────────────────────

  /**
   * The authoritative total of a purchase, if the server reported one.
   *
   * @param text the body of a successful {@code POST /buy}
   * @return the total cost
   */
  public OptionalLong decodeTotalCost(final String text) {
    try {
      BuyResponse response = objectMapper.readValue(text, BuyResponse.class);
      if (response != null && response.totalCost() != null) {
        return OptionalLong.of(response.totalCost());
      }
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.warn("Unable to read total cost from buy response: {}", e.getMessage());
    }
    return OptionalLong.empty();
  }

  /**
   * Decodes {@code GET /sales/pending}.
   *
   * @param text the response body
   * @return the pending sales
   * @throws DecodeException if the body is not a pending-sales answer
   */
  public List<PendingSale> decodePendingSales(final String text) {
    try {
      PendingSalesResponse response = objectMapper.readValue(text, PendingSalesResponse.class);
      return response == null ? List.of() : response.salesOrEmpty();
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new DecodeException("Unable to decode pending sales", e);
    }
  }
}
