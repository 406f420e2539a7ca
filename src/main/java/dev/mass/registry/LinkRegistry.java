package dev.mass.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable cross-run record of which registrant first saw which URL.
 *
 * <p>Backed by a single JSON file. Every operation re-reads the file first, so registrations and
 * clears made by other processes are visible, and every mutation is flushed immediately. Concurrent processes
 * racing on the same URLs resolve as last writer wins; entries are idempotent so this only
 * re-stamps a key.
 *
 * <p>An unreadable or corrupt file never fails construction: the registry starts empty and records
 * the load error in its metadata. A failed flush is logged and the in-memory state is kept until a
 * later flush succeeds. Entries without a registrant are counted under
 * {@value #UNKNOWN_REGISTRANT}.
 */
public class LinkRegistry {

  private static final Logger log = LoggerFactory.getLogger(LinkRegistry.class);

  static final String UNKNOWN_REGISTRANT = "unknown";

  private final Path file;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  private Map<String, RegistryEntry> links = new LinkedHashMap<>();
  private String created;
  private String lastUpdated;
  private @Nullable String loadError;
  private boolean unflushed;

  public LinkRegistry(Path file, ObjectMapper objectMapper, Clock clock) {
    this.file = file;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.created = now();
    this.lastUpdated = created;
    load();
  }

  /**
   * Keeps the URLs that are unregistered, or that were registered by {@code registrant} itself.
   * Blank URLs are dropped; input order is preserved.
   */
  public synchronized List<String> filterNew(List<String> urls, @Nullable String registrant) {
    if (urls == null || urls.isEmpty()) {
      return List.of();
    }
    refresh();
    List<String> fresh = new ArrayList<>();
    for (String url : urls) {
      if (url == null || url.isBlank()) {
        continue;
      }
      RegistryEntry entry = links.get(url);
      if (entry == null || (registrant != null && registrant.equals(entry.registrant()))) {
        fresh.add(url);
      }
    }
    return fresh;
  }

  /**
   * Registers every URL not already present under {@code registrant}. Existing entries are never
   * overwritten.
   *
   * @return number of newly added URLs
   */
  public synchronized int register(List<String> urls, String registrant) {
    if (urls == null || urls.isEmpty()) {
      return 0;
    }
    refresh();
    String timestamp = now();
    int added = 0;
    for (String url : urls) {
      if (url != null && !url.isBlank() && !links.containsKey(url)) {
        links.put(url, new RegistryEntry(registrant, timestamp));
        added++;
      }
    }
    flush();
    log.info("Registered {} new links for {}", added, registrant);
    return added;
  }

  public synchronized RegistryStats stats() {
    refresh();
    Map<String, Integer> counts = new TreeMap<>();
    links
        .values()
        .forEach(
            entry ->
                counts.merge(
                    entry.registrant() != null ? entry.registrant() : UNKNOWN_REGISTRANT,
                    1,
                    Integer::sum));
    return new RegistryStats(links.size(), counts, created, lastUpdated);
  }

  /** Empties the registry and flushes the empty document. */
  public synchronized void clear() {
    links = new LinkedHashMap<>();
    created = now();
    loadError = null;
    flush();
    log.info("Link registry cleared");
  }

  /** Load error captured at construction, if the backing file was unreadable. */
  public synchronized Optional<String> loadError() {
    return Optional.ofNullable(loadError);
  }

  private void load() {
    if (!Files.exists(file)) {
      return;
    }
    try {
      adopt(read());
    } catch (IOException | RuntimeException e) {
      loadError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      log.warn("Error loading link registry {}, starting empty: {}", file, loadError);
    }
  }

  /**
   * Replaces the in-memory state with the file. Only entries left over from a failed flush are
   * merged back in, with on-disk entries winning.
   */
  private void refresh() {
    if (!Files.exists(file)) {
      return;
    }
    try {
      RegistryDocument document = read();
      if (unflushed) {
        Map<String, RegistryEntry> pending = links;
        adopt(document);
        pending.forEach(links::putIfAbsent);
      } else {
        adopt(document);
      }
    } catch (IOException | RuntimeException e) {
      log.debug("Keeping in-memory registry, file unreadable: {}", e.getMessage());
    }
  }

  private void adopt(RegistryDocument document) {
    links = document.links();
    if (document.metadata() != null) {
      created = document.metadata().created() != null ? document.metadata().created() : created;
      lastUpdated =
          document.metadata().lastUpdated() != null ? document.metadata().lastUpdated() : created;
    }
  }

  private RegistryDocument read() throws IOException {
    RegistryDocument document = objectMapper.readValue(file.toFile(), RegistryDocument.class);
    if (document == null) {
      throw new IOException("Empty registry document");
    }
    return document;
  }

  private void flush() {
    lastUpdated = now();
    RegistryDocument document =
        new RegistryDocument(links, new RegistryDocument.Metadata(created, lastUpdated, loadError));
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
      try {
        Files.move(
            temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
      unflushed = false;
    } catch (IOException e) {
      unflushed = true;
      log.error("Error saving link registry {}: {}", file, e.getMessage());
    }
  }

  private String now() {
    return clock.instant().toString();
  }
}
