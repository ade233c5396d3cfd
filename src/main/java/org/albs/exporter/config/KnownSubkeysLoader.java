package org.albs.exporter.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.albs.exporter.application.signature.KnownSubkeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the known subkey delegation file, a JSON object mapping a primary key id to its subkey ids.
 *
 * <pre>
 * {"51d6647ec21ad6ea": ["d36cb86cb86b3716", "3abb34f8"]}
 * </pre>
 */
public final class KnownSubkeysLoader {
  private static final Logger log = LoggerFactory.getLogger(KnownSubkeysLoader.class);
  private static final TypeReference<Map<String, List<String>>> SHAPE = new TypeReference<>() {};

  private KnownSubkeysLoader() {}

  /**
   * Loads the delegation map.
   *
   * @param path file location
   * @param mapper JSON mapper
   * @return delegation, empty when the file does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the file is not a JSON object of string arrays
   */
  public static KnownSubkeys load(Path path, ObjectMapper mapper) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mapper, "mapper");
    if (!Files.exists(path)) {
      log.info("No known subkeys file at {}; subkey delegation disabled", path);
      return KnownSubkeys.empty();
    }
    Map<String, List<String>> raw;
    try {
      raw = mapper.readValue(path.toFile(), SHAPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("known subkeys file is malformed: " + path, ex);
    }
    KnownSubkeys subkeys = KnownSubkeys.of(raw == null ? Map.of() : raw);
    log.debug("Loaded subkeys for {} primary keys from {}", subkeys.size(), path);
    return subkeys;
  }
}
