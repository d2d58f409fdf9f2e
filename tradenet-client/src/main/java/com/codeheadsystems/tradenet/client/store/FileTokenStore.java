package com.codeheadsystems.tradenet.client.store;

import com.codeheadsystems.tradenet.client.exceptions.TokenStoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TokenStore} keeping the token as a small JSON file in the host's per-user save area.
 * <p>
 * Writes go to a temporary file next to the target which is then moved over it, so the file is
 * always either the previous entry or the new one in full.
 */
public class FileTokenStore implements TokenStore {

  /**
   * The fixed file name inside the save directory.
   */
  public static final String CACHE_FILE_NAME = "TradeNet_Token_Cache.json";

  private static final Logger log = LoggerFactory.getLogger(FileTokenStore.class);

  private final Path file;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new File token store.
   *
   * @param file         the cache file
   * @param objectMapper the object mapper
   */
  public FileTokenStore(final Path file, final ObjectMapper objectMapper) {
    log.info("FileTokenStore({})", file);
    this.file = file;
    this.objectMapper = objectMapper;
  }

  /**
   * Store at the well-known location inside a save directory.
   *
   * @param saveDirectory the save directory
   * @param objectMapper  the object mapper
   * @return the file token store
   */
  public static FileTokenStore inSaveDirectory(final Path saveDirectory, final ObjectMapper objectMapper) {
    return new FileTokenStore(saveDirectory.resolve(CACHE_FILE_NAME), objectMapper);
  }

  /**
   * File path.
   *
   * @return the path
   */
  public Path file() {
    return file;
  }

  @Override
  public Optional<CachedToken> load() {
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      String json = Files.readString(file, StandardCharsets.UTF_8);
      if (json.isBlank()) {
        return Optional.empty();
      }
      return Optional.of(objectMapper.readValue(json, CachedToken.class));
    } catch (NoSuchFileException e) {
      return Optional.empty();
    } catch (IOException e) {
      throw new TokenStoreException("Unable to read token cache: " + file, e);
    }
  }

  @Override
  public void save(final CachedToken cachedToken) {
    Path temp = null;
    try {
      Path directory = file.toAbsolutePath().getParent();
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
      Files.writeString(temp, objectMapper.writeValueAsString(cachedToken), StandardCharsets.UTF_8);
      try {
        Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
      temp = null;
      log.debug("Token cached to {} (expires {})", file, cachedToken.expiresAt());
    } catch (IOException e) {
      throw new TokenStoreException("Unable to write token cache: " + file, e);
    } finally {
      if (temp != null) {
        deleteQuietly(temp);
      }
    }
  }

  @Override
  public void delete() {
    try {
      if (Files.deleteIfExists(file)) {
        log.debug("Token cache {} deleted", file);
      }
    } catch (IOException e) {
      throw new TokenStoreException("Unable to delete token cache: " + file, e);
    }
  }

  private void deleteQuietly(final Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Unable to remove temporary token file {}: {}", temp, e.getMessage());
    }
  }
}
