package dev.mass.scrape;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Summary of one coordinator run, built once all adapters have settled.
 *
 * @param keywords the query the run was started with
 * @param targetDomain optional domain restriction, {@code null} when absent
 * @param scrapedAt when the run started
 * @param totalResults size of the merged result set
 * @param sourcesUsed adapters that returned at least one item, in registration order
 * @param executionTimeSeconds wall-clock duration of the fan-out/fan-in, rounded to 2 decimals
 */
public record RunMetadata(
    String keywords,
    @JsonProperty("target_domain") @Nullable String targetDomain,
    @JsonProperty("scraped_at") Instant scrapedAt,
    @JsonProperty("total_results") int totalResults,
    @JsonProperty("sources_used") List<String> sourcesUsed,
    @JsonProperty("execution_time") double executionTimeSeconds) {

  public RunMetadata {
    sourcesUsed = sourcesUsed == null ? List.of() : List.copyOf(sourcesUsed);
    if (executionTimeSeconds < 0) {
      throw new IllegalArgumentException("executionTimeSeconds must be >= 0");
    }
  }

  /** Copy with a different result count, used when a later stage changes the result set size. */
  public RunMetadata withTotalResults(int newTotal) {
    return new RunMetadata(
        keywords, targetDomain, scrapedAt, newTotal, sourcesUsed, executionTimeSeconds);
  }
}
