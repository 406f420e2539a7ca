package dev.mass.scrape;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fan-out/fan-in orchestrator over the active {@link SourceAdapter}s.
 *
 * <p>Every adapter runs as its own task on the shared executor. All tasks are joined
 * unconditionally; each settles into a {@link SourceOutcome}, and outcomes are consumed in
 * adapter-registration order, so completion order never affects the final ordering. A failing
 * adapter contributes no items and is left out of {@code sourcesUsed}.
 *
 * <p>There is no cancellation between sibling tasks: a slow adapter delays the run but does not
 * abort the others. Callers needing a deadline wrap {@link #run} in their own timeout.
 */
public class ScrapeCoordinator {

  private static final Logger log = LoggerFactory.getLogger(ScrapeCoordinator.class);

  private final List<SourceAdapter> adapters;
  private final ExecutorService executor;
  private final Clock clock;

  public ScrapeCoordinator(List<SourceAdapter> adapters, ExecutorService executor, Clock clock) {
    this.adapters = List.copyOf(adapters);
    this.executor = executor;
    this.clock = clock;
    log.info("Initialized coordinator with {} adapters: {}", this.adapters.size(), adapterNames());
  }

  /**
   * Runs every active adapter concurrently and merges their output.
   *
   * @param keywords search keywords, must not be blank
   * @param targetDomain optional domain restriction
   * @param maxPages pages per adapter, at least 1
   * @return merged results and run metadata
   */
  public ScrapeRun run(String keywords, @Nullable String targetDomain, int maxPages) {
    if (keywords == null || keywords.isBlank()) {
      throw new IllegalArgumentException("Keywords must not be blank");
    }
    if (maxPages < 1) {
      throw new IllegalArgumentException("maxPages must be at least 1");
    }
    String domain = targetDomain == null || targetDomain.isBlank() ? null : targetDomain.trim();

    Instant scrapedAt = clock.instant();
    long start = System.nanoTime();
    log.info("Starting coordinated scrape for keywords: {} (domain: {})", keywords, domain);

    List<CompletableFuture<SourceOutcome>> tasks = new ArrayList<>(adapters.size());
    for (SourceAdapter adapter : adapters) {
      tasks.add(submit(adapter, keywords, domain, maxPages));
    }
    CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])).join();

    List<ResultItem> combined = new ArrayList<>();
    List<String> sourcesUsed = new ArrayList<>();
    for (CompletableFuture<SourceOutcome> task : tasks) {
      SourceOutcome outcome = task.join();
      if (!outcome.success()) {
        log.error("Error from scraper {}: {}", outcome.source(), outcome.errorMessage());
        continue;
      }
      log.info("Scraper {} returned {} items", outcome.source(), outcome.items().size());
      if (outcome.contributed()) {
        sourcesUsed.add(outcome.source());
      }
      combined.addAll(outcome.items());
    }

    List<ResultItem> merged = ResultMerger.merge(combined, domain);
    double elapsed = secondsSince(start);

    log.info("Completed coordinated scrape with {} results in {}s", merged.size(), elapsed);
    return new ScrapeRun(
        merged, new RunMetadata(keywords, domain, scrapedAt, merged.size(), sourcesUsed, elapsed));
  }

  /** Names of the active adapters in registration order. */
  public List<String> adapterNames() {
    return adapters.stream().map(SourceAdapter::name).toList();
  }

  private CompletableFuture<SourceOutcome> submit(
      SourceAdapter adapter, String keywords, @Nullable String domain, int maxPages) {
    String name = adapter.name();
    try {
      return CompletableFuture.supplyAsync(
              () -> adapter.scrape(keywords, domain, maxPages), executor)
          .handle(
              (items, ex) ->
                  ex == null ? SourceOutcome.ok(name, items) : SourceOutcome.failed(name, describe(ex)));
    } catch (RejectedExecutionException e) {
      return CompletableFuture.completedFuture(SourceOutcome.failed(name, describe(e)));
    }
  }

  private static String describe(Throwable ex) {
    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    return cause.getMessage() != null
        ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
        : cause.getClass().getSimpleName();
  }

  private static double secondsSince(long startNanos) {
    double seconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
    return BigDecimal.valueOf(Math.max(0.0, seconds)).setScale(2, RoundingMode.HALF_UP).doubleValue();
  }
}
