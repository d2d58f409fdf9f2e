package com.codeheadsystems.tradenet.client.codec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tradenet.client.exceptions.DecodeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * The type Json lite parser test.
 */
class JsonLiteParserTest {

  @Test
  void parse_object_keepsKeyOrderAndTypes() {
    Object value = JsonLiteParser.parse(" {\"b\": 1, \"a\": [true, null, 2.5], \"c\": \"x\"} ");

    assertThat(value).isInstanceOf(Map.class);
    @SuppressWarnings("unchecked")
    Map<String, Object> map = (Map<String, Object>) value;
    assertThat(new ArrayList<>(map.keySet())).containsExactly("b", "a", "c");
    assertThat(map.get("b")).isEqualTo(1L);
    @SuppressWarnings("unchecked")
    List<Object> array = (List<Object>) map.get("a");
    assertThat(array).containsExactly(true, null, 2.5);
    assertThat(map.get("c")).isEqualTo("x");
  }

  @Test
  void parse_stringEscapes_areDecoded() {
    assertThat(JsonLiteParser.parse("\"q\\\"b\\\\n\\n\\u0041\"")).isEqualTo("q\"b\\n\nA");
  }

  @Test
  void parse_unicodeEscapeWithSign_fails() {
    assertThatThrownBy(() -> JsonLiteParser.parse("\"a\\u-001\""))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("Invalid unicode escape");
    assertThatThrownBy(() -> JsonLiteParser.parse("\"a\\u+0041\""))
        .isInstanceOf(DecodeException.class);
  }

  @Test
  void parse_negativeAndExponentNumbers() {
    assertThat(JsonLiteParser.parse("-12")).isEqualTo(-12L);
    assertThat(JsonLiteParser.parse("1e3")).isEqualTo(1000.0);
  }

  @Test
  void parse_trailingContent_fails() {
    assertThatThrownBy(() -> JsonLiteParser.parse("{} x"))
        .isInstanceOf(DecodeException.class)
        .hasMessageContaining("position");
  }

  @Test
  void parse_missingValue_fails() {
    assertThatThrownBy(() -> JsonLiteParser.parse("{\"Quantity\":}"))
        .isInstanceOf(DecodeException.class);
  }

  @Test
  void outerArraySpan_ignoresBracketsInStrings() {
    String text = "{\"note\":\"[not this]\",\"records\":[{\"a\":[1]}]}";

    int[] span = JsonLiteParser.outerArraySpan(text);

    assertThat(span).isNotNull();
    assertThat(text.substring(span[0], span[1] + 1)).isEqualTo("[{\"a\":[1]}]");
  }

  @Test
  void outerArraySpan_noArray_returnsNull() {
    assertThat(JsonLiteParser.outerArraySpan("{\"status\":\"ok\"}")).isNull();
  }

  @Test
  void splitElements_splitsOnlyTopLevelCommas() {
    List<String> elements = JsonLiteParser.splitElements(
        " {\"a\":\"x,y\",\"b\":[1,2]} , {\"c\":{\"d\":1,\"e\":2}} ,  ");

    assertThat(elements).containsExactly("{\"a\":\"x,y\",\"b\":[1,2]}", "{\"c\":{\"d\":1,\"e\":2}}");
  }

  @Test
  void splitElements_singleElement_isReturnedWhole() {
    assertThat(JsonLiteParser.splitElements("{\"DefName\":\"Steel\"}"))
        .containsExactly("{\"DefName\":\"Steel\"}");
  }
}
