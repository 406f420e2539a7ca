package dev.mass.scrape;

import java.util.List;

/** Merged items of one coordinator run together with the run's metadata. */
public record ScrapeRun(List<ResultItem> results, RunMetadata metadata) {
  public ScrapeRun {
    results = results == null ? List.of() : List.copyOf(results);
  }
}
