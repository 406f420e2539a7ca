package dev.mass.scrape;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Pure dedup/filter/truncate step applied to the concatenated output of all adapters.
 *
 * <p>Order of operations: drop items without a link, drop items outside the target domain (when
 * one is given), keep the first occurrence of each link, then truncate to {@link #MAX_RESULTS}.
 * Input order is the tie-break, so the adapter registered first wins a shared URL.
 *
 * <p>The function is total and idempotent: {@code merge(merge(x)) == merge(x)}.
 */
public final class ResultMerger {

  /** Upper bound on the size of a merged result set. */
  public static final int MAX_RESULTS = 50;

  private ResultMerger() {
    // utility class
  }

  public static List<ResultItem> merge(@Nullable List<ResultItem> items) {
    return merge(items, null);
  }

  /**
   * Deduplicates by link, applies the optional domain filter and truncates.
   *
   * @param items concatenated adapter output in adapter-registration order
   * @param targetDomain when non-blank, only links containing this substring are kept
   * @return the merged list, at most {@link #MAX_RESULTS} long
   */
  public static List<ResultItem> merge(
      @Nullable List<ResultItem> items, @Nullable String targetDomain) {
    if (items == null || items.isEmpty()) {
      return List.of();
    }
    String domain = targetDomain == null || targetDomain.isBlank() ? null : targetDomain.trim();

    Set<String> seen = new HashSet<>();
    List<ResultItem> merged = new ArrayList<>();
    for (ResultItem item : items) {
      if (item == null || !item.hasLink()) {
        continue;
      }
      if (domain != null && !item.link().contains(domain)) {
        continue;
      }
      if (!seen.add(item.link())) {
        continue;
      }
      merged.add(item);
      if (merged.size() == MAX_RESULTS) {
        break;
      }
    }
    return List.copyOf(merged);
  }
}
