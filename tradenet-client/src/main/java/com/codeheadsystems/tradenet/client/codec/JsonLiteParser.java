package com.codeheadsystems.tradenet.client.codec;

import com.codeheadsystems.tradenet.client.exceptions.DecodeException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A small recursive-descent JSON reader for loosely shaped server answers.
 * <p>
 * Grammar: object, array, string, number, {@code true}, {@code false}, {@code null}.
 * Objects become {@link LinkedHashMap}s, arrays {@link ArrayList}s, integral numbers that fit
 * {@link Long}s and other numbers {@link Double}s. Duplicate keys keep the last value.
 * <p>
 * Besides whole-document parsing it offers the two scanning primitives the trade-record decoder
 * needs to survive a damaged element: locating the outermost array and splitting an array body
 * into its top-level elements. Both skip over string literals, so brackets and commas inside
 * strings never count.
 */
public final class JsonLiteParser {

  private final String text;
  private int pos;

  private JsonLiteParser(final String text) {
    this.text = text;
    this.pos = 0;
  }

  /**
   * Parses a complete JSON value. Leading and trailing whitespace is allowed, anything else
   * after the value is an error.
   *
   * @param text the text
   * @return the value: Map, List, String, Long, Double, Boolean or null
   * @throws DecodeException if the text is not a single well-formed value
   */
  public static Object parse(final String text) {
    if (text == null) {
      throw new DecodeException("Cannot parse null text");
    }
    JsonLiteParser parser = new JsonLiteParser(text);
    parser.skipWhitespace();
    Object value = parser.readValue();
    parser.skipWhitespace();
    if (parser.pos != text.length()) {
      throw parser.error("Unexpected trailing content");
    }
    return value;
  }

  /**
   * Locates the outermost array: the first {@code [} outside a string literal and its matching
   * {@code ]}. When the brackets inside are unbalanced the last {@code ]} in the text closes it.
   *
   * @param text the text
   * @return {@code {start, end}} indexes of the brackets, or null if no array can be located
   */
  public static int[] outerArraySpan(final String text) {
    if (text == null) {
      return null;
    }
    int start = -1;
    int depth = 0;
    boolean inString = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (c == '\\') {
          i++;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == '[') {
        if (start < 0) {
          start = i;
        }
        depth++;
      } else if (c == ']' && start >= 0) {
        depth--;
        if (depth == 0) {
          return new int[]{start, i};
        }
      }
    }
    if (start < 0) {
      return null;
    }
    int end = text.lastIndexOf(']');
    return end > start ? new int[]{start, end} : null;
  }

  /**
   * Splits the body of an array (the text between its brackets) at its top-level commas.
   * Blank elements are dropped.
   *
   * @param body the array body
   * @return the element texts, trimmed
   */
  public static List<String> splitElements(final String body) {
    List<String> elements = new ArrayList<>();
    int depth = 0;
    int from = 0;
    boolean inString = false;
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (inString) {
        if (c == '\\') {
          i++;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      switch (c) {
        case '"' -> inString = true;
        case '{', '[' -> depth++;
        case '}', ']' -> depth = Math.max(0, depth - 1);
        case ',' -> {
          if (depth == 0) {
            addIfNotBlank(elements, body.substring(from, i));
            from = i + 1;
          }
        }
        default -> {
        }
      }
    }
    addIfNotBlank(elements, body.substring(from));
    return elements;
  }

  private static void addIfNotBlank(final List<String> elements, final String element) {
    String trimmed = element.trim();
    if (!trimmed.isEmpty()) {
      elements.add(trimmed);
    }
  }

  private Object readValue() {
    if (pos >= text.length()) {
      throw error("Unexpected end of input");
    }
    char c = text.charAt(pos);
    return switch (c) {
      case '{' -> readObject();
      case '[' -> readArray();
      case '"' -> readString();
      case 't' -> readLiteral("true", Boolean.TRUE);
      case 'f' -> readLiteral("false", Boolean.FALSE);
      case 'n' -> readLiteral("null", null);
      default -> {
        if (c == '-' || (c >= '0' && c <= '9')) {
          yield readNumber();
        }
        throw error("Unexpected character '" + c + "'");
      }
    };
  }

  private Map<String, Object> readObject() {
    Map<String, Object> object = new LinkedHashMap<>();
    pos++;
    skipWhitespace();
    if (peek() == '}') {
      pos++;
      return object;
    }
    while (true) {
      skipWhitespace();
      if (peek() != '"') {
        throw error("Expected object key");
      }
      String key = readString();
      skipWhitespace();
      expect(':');
      skipWhitespace();
      object.put(key, readValue());
      skipWhitespace();
      char c = next();
      if (c == '}') {
        return object;
      }
      if (c != ',') {
        throw error("Expected ',' or '}' in object");
      }
    }
  }

  private List<Object> readArray() {
    List<Object> array = new ArrayList<>();
    pos++;
    skipWhitespace();
    if (peek() == ']') {
      pos++;
      return array;
    }
    while (true) {
      skipWhitespace();
      array.add(readValue());
      skipWhitespace();
      char c = next();
      if (c == ']') {
        return array;
      }
      if (c != ',') {
        throw error("Expected ',' or ']' in array");
      }
    }
  }

  private String readString() {
    expect('"');
    StringBuilder sb = new StringBuilder();
    while (true) {
      if (pos >= text.length()) {
        throw error("Unterminated string");
      }
      char c = text.charAt(pos++);
      if (c == '"') {
        return sb.toString();
      }
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      if (pos >= text.length()) {
        throw error("Unterminated escape");
      }
      char escaped = text.charAt(pos++);
      switch (escaped) {
        case '"' -> sb.append('"');
        case '\\' -> sb.append('\\');
        case '/' -> sb.append('/');
        case 'b' -> sb.append('\b');
        case 'f' -> sb.append('\f');
        case 'n' -> sb.append('\n');
        case 'r' -> sb.append('\r');
        case 't' -> sb.append('\t');
        case 'u' -> {
          if (pos + 4 > text.length()) {
            throw error("Truncated unicode escape");
          }
          int code = 0;
          for (int i = 0; i < 4; i++) {
            char hex = text.charAt(pos + i);
            int digit = hex < 128 ? Character.digit(hex, 16) : -1;
            if (digit < 0) {
              throw error("Invalid unicode escape");
            }
            code = code * 16 + digit;
          }
          sb.append((char) code);
          pos += 4;
        }
        default -> throw error("Invalid escape '\\" + escaped + "'");
      }
    }
  }

  private Object readNumber() {
    int start = pos;
    boolean integral = true;
    if (peek() == '-') {
      pos++;
    }
    if (!Character.isDigit(peek())) {
      throw error("Expected digit");
    }
    while (Character.isDigit(peek())) {
      pos++;
    }
    if (peek() == '.') {
      integral = false;
      pos++;
      if (!Character.isDigit(peek())) {
        throw error("Expected digit after decimal point");
      }
      while (Character.isDigit(peek())) {
        pos++;
      }
    }
    if (peek() == 'e' || peek() == 'E') {
      integral = false;
      pos++;
      if (peek() == '+' || peek() == '-') {
        pos++;
      }
      if (!Character.isDigit(peek())) {
        throw error("Expected digit in exponent");
      }
      while (Character.isDigit(peek())) {
        pos++;
      }
    }
    String number = text.substring(start, pos);
    if (integral) {
      try {
        return Long.parseLong(number);
      } catch (NumberFormatException e) {
        // too large for a long
        return Double.parseDouble(number);
      }
    }
    return Double.parseDouble(number);
  }

  private Object readLiteral(final String literal, final Object value) {
    if (!text.startsWith(literal, pos)) {
      throw error("Expected '" + literal + "'");
    }
    pos += literal.length();
    return value;
  }

  private void skipWhitespace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
      pos++;
    }
  }

  private char peek() {
    return pos < text.length() ? text.charAt(pos) : '\0';
  }

  private char next() {
    if (pos >= text.length()) {
      throw error("Unexpected end of input");
    }
    return text.charAt(pos++);
  }

  private void expect(final char expected) {
    if (next() != expected) {
      pos--;
      throw error("Expected '" + expected + "'");
    }
  }

  private DecodeException error(final String message) {
    return new DecodeException(message + " at position " + pos);
  }
}
