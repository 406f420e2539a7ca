package dev.mass.scrape;

import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Settled result of one adapter task: either the items it returned or the reason it failed.
 *
 * @param source adapter name
 * @param items returned items, empty on failure
 * @param success whether the adapter task completed without throwing
 * @param errorMessage failure reason when {@code success} is false
 */
public record SourceOutcome(
    String source, List<ResultItem> items, boolean success, @Nullable String errorMessage) {

  /** Null elements returned by a misbehaving adapter are dropped. */
  public SourceOutcome {
    items = items == null ? List.of() : items.stream().filter(Objects::nonNull).toList();
  }

  public static SourceOutcome ok(String source, @Nullable List<ResultItem> items) {
    return new SourceOutcome(source, items, true, null);
  }

  public static SourceOutcome failed(String source, String errorMessage) {
    return new SourceOutcome(source, List.of(), false, errorMessage);
  }

  /** True when the adapter succeeded and contributed at least one item. */
  public boolean contributed() {
    return success && !items.isEmpty();
  }
}
