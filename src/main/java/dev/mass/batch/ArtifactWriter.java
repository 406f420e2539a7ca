package dev.mass.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

/**
 * Writes batch results as pretty-printed JSON files named {@code
 * {category}_{query}_{domain}_{yyyyMMdd_HHmmss}.json}, where query and domain are reduced to
 * letters, digits and underscores.
 */
@Component
public class ArtifactWriter {

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private final Path outputDir;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public ArtifactWriter(BatchProperties properties, ObjectMapper objectMapper, Clock clock) {
    this.outputDir = Path.of(properties.outputDir());
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Serializes {@code payload} into a new artifact file.
   *
   * @param category file name prefix, e.g. {@code links} or {@code combined}
   * @param query the batch keyword
   * @param domain the batch domain, with or without scheme
   * @param payload any Jackson-serializable value
   * @return path of the written file
   * @throws IOException if the directory or file cannot be written
   */
  public Path write(String category, String query, String domain, Object payload)
      throws IOException {
    Files.createDirectories(outputDir);
    String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    Path path =
        outputDir.resolve(
            "%s_%s_%s_%s.json".formatted(category, slug(query), slug(hostPart(domain)), timestamp));
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), payload);
    return path;
  }

  static String slug(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    value.codePoints()
        .forEach(c -> sb.appendCodePoint(Character.isLetterOrDigit(c) ? c : '_'));
    return sb.toString();
  }

  static String hostPart(String domain) {
    String stripped = domain.replaceFirst("^https?://", "");
    int slash = stripped.indexOf('/');
    return slash < 0 ? stripped : stripped.substring(0, slash);
  }
}
