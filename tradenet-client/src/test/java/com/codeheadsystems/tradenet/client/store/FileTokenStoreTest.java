package com.codeheadsystems.tradenet.client.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.tradenet.client.exceptions.TokenStoreException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * The type File token store test.
 */
class FileTokenStoreTest {

  private static final Instant EXPIRY = Instant.parse("2026-01-11T12:00:00Z");

  @TempDir
  Path saveDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private FileTokenStore store;

  /**
   * Sets up.
   */
  @BeforeEach
  void setUp() {
    store = FileTokenStore.inSaveDirectory(saveDir, objectMapper);
  }

  @Test
  void inSaveDirectory_usesWellKnownFileName() {
    assertThat(store.file()).isEqualTo(saveDir.resolve("TradeNet_Token_Cache.json"));
  }

  @Test
  void load_missingFile_returnsEmpty() {
    assertThat(store.load()).isEmpty();
  }

  @Test
  void save_writesTokenAndUnixSecondsExpiry() throws IOException {
    store.save(CachedToken.of("tok-1", EXPIRY));

    JsonNode json = objectMapper.readTree(Files.readString(store.file(), StandardCharsets.UTF_8));
    assertThat(json.get("token").asText()).isEqualTo("tok-1");
    assertThat(json.get("expires_at").asLong()).isEqualTo(EXPIRY.getEpochSecond());
    assertThat(json.size()).isEqualTo(2);
  }

  @Test
  void save_overwriteIsIdempotentAndLeavesNoTemporaryFiles() throws IOException {
    store.save(CachedToken.of("a-much-longer-first-token-value", EXPIRY.plusSeconds(60)));
    store.save(CachedToken.of("tok-2", EXPIRY));
    String afterFirst = Files.readString(store.file(), StandardCharsets.UTF_8);
    store.save(CachedToken.of("tok-2", EXPIRY));
    String afterSecond = Files.readString(store.file(), StandardCharsets.UTF_8);

    assertThat(afterSecond).isEqualTo(afterFirst);
    assertThat(store.load()).contains(new CachedToken("tok-2", EXPIRY.getEpochSecond()));
    try (Stream<Path> files = Files.list(saveDir)) {
      assertThat(files).containsExactly(store.file());
    }
  }

  @Test
  void save_createsMissingSaveDirectory() {
    FileTokenStore nested = FileTokenStore.inSaveDirectory(saveDir.resolve("a").resolve("b"), objectMapper);

    nested.save(CachedToken.of("tok", EXPIRY));

    assertThat(nested.load()).isPresent();
  }

  @Test
  void delete_removesFileAndIsIdempotent() {
    store.save(CachedToken.of("tok", EXPIRY));

    store.delete();
    store.delete();

    assertThat(Files.exists(store.file())).isFalse();
    assertThat(store.load()).isEmpty();
  }

  @Test
  void load_blankFile_returnsEmpty() throws IOException {
    Files.writeString(store.file(), "  \n", StandardCharsets.UTF_8);

    assertThat(store.load()).isEmpty();
  }

  @Test
  void load_malformedFile_throwsTokenStoreException() throws IOException {
    Files.writeString(store.file(), "{\"token\":\"half", StandardCharsets.UTF_8);

    assertThatThrownBy(() -> store.load())
        .isInstanceOf(TokenStoreException.class)
        .hasMessageContaining("TradeNet_Token_Cache.json");
  }

  @Test
  void cachedToken_validity() {
    CachedToken token = CachedToken.of("tok", EXPIRY);

    assertThat(token.isValidAt(EXPIRY.minusSeconds(1))).isTrue();
    assertThat(token.isValidAt(EXPIRY)).isFalse();
    assertThat(new CachedToken("", EXPIRY.getEpochSecond()).isValidAt(EXPIRY.minusSeconds(1))).isFalse();
    assertThat(token.toString()).doesNotContain("tok,").contains("redacted");
  }
}
