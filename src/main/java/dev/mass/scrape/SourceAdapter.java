package dev.mass.scrape;

import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Uniform capability wrapping one remote content source.
 *
 * <p>Implementations must not let exceptions escape {@link #scrape}: internal failures are logged
 * and produce a partial or empty list. {@link ScrapeCoordinator} still guards against adapters that
 * break this rule.
 */
public interface SourceAdapter {

  /** Identity used as the {@code source} tag of produced items and in run metadata. */
  String name();

  /**
   * Discovers content for the given query.
   *
   * @param keywords search keywords
   * @param targetDomain optional domain to restrict or direct the search
   * @param maxPages maximum number of (real or simulated) pages to visit, at least 1
   * @return discovered items in the source's own order, never {@code null}
   */
  List<ResultItem> scrape(String keywords, @Nullable String targetDomain, int maxPages);

  /**
   * Normalizes a loosely-typed raw record into a {@link ResultItem} tagged with this adapter's
   * name, or with {@code sourceOverride} when given.
   */
  default ResultItem format(Map<String, ?> raw, @Nullable String sourceOverride) {
    return RawItems.toResultItem(raw, sourceOverride != null ? sourceOverride : name());
  }
}
