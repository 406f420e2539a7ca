package dev.mass.scrape;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ScrapeCoordinatorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private final ExecutorService executor = Executors.newFixedThreadPool(4);
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void mergesAdaptersInRegistrationOrder() {
    SourceAdapter first = adapter("first", () -> List.of(ResultItem.of("A", "https://x.com", "first")));
    SourceAdapter second =
        adapter(
            "second",
            () ->
                List.of(
                    ResultItem.of("B", "https://x.com", "second"),
                    ResultItem.of("C", "https://y.com", "second")));

    ScrapeRun run = coordinator(first, second).run("cats", null, 3);

    assertThat(run.results()).extracting(ResultItem::link).containsExactly("https://x.com", "https://y.com");
    assertThat(run.results()).extracting(ResultItem::title).containsExactly("A", "C");
    assertThat(run.metadata().sourcesUsed()).containsExactly("first", "second");
    assertThat(run.metadata().totalResults()).isEqualTo(2);
    assertThat(run.metadata().scrapedAt()).isEqualTo(NOW);
    assertThat(run.metadata().keywords()).isEqualTo("cats");
    assertThat(run.metadata().executionTimeSeconds()).isGreaterThanOrEqualTo(0.0);
  }

  @Test
  void failingAdapterDoesNotAffectOthers() {
    SourceAdapter broken =
        adapter(
            "broken",
            () -> {
              throw new IllegalStateException("boom");
            });
    SourceAdapter healthy =
        adapter(
            "healthy",
            () ->
                List.of(
                    ResultItem.of("A", "https://a.com", "healthy"),
                    ResultItem.of("B", "https://b.com", "healthy")));

    ScrapeRun run = coordinator(broken, healthy).run("cats", null, 1);

    assertThat(run.results()).hasSize(2);
    assertThat(run.metadata().sourcesUsed()).containsExactly("healthy");
  }

  @Test
  void adapterReturningNothingIsNotListedAsUsed() {
    SourceAdapter empty = adapter("empty", List::of);
    SourceAdapter one = adapter("one", () -> List.of(ResultItem.of("A", "https://a.com", "one")));

    ScrapeRun run = coordinator(empty, one).run("cats", null, 1);

    assertThat(run.metadata().sourcesUsed()).containsExactly("one");
  }

  @Test
  void nullItemsFromAdapterAreDroppedWithoutFailingTheRun() {
    SourceAdapter sloppy =
        adapter("sloppy", () -> Arrays.asList(ResultItem.of("A", "https://a.com", "sloppy"), null));
    SourceAdapter healthy =
        adapter("healthy", () -> List.of(ResultItem.of("B", "https://b.com", "healthy")));

    ScrapeRun run = coordinator(sloppy, healthy).run("cats", null, 1);

    assertThat(run.results())
        .extracting(ResultItem::link)
        .containsExactly("https://a.com", "https://b.com");
    assertThat(run.metadata().sourcesUsed()).containsExactly("sloppy", "healthy");
  }

  @Test
  void completionOrderDoesNotChangeResultOrder() throws Exception {
    CountDownLatch secondDone = new CountDownLatch(1);
    SourceAdapter slow =
        adapter(
            "slow",
            () -> {
              try {
                secondDone.await(5, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              return List.of(ResultItem.of("slow", "https://shared.com", "slow"));
            });
    SourceAdapter fast =
        adapter(
            "fast",
            () -> {
              secondDone.countDown();
              return List.of(ResultItem.of("fast", "https://shared.com", "fast"));
            });

    ScrapeRun run = coordinator(slow, fast).run("cats", null, 1);

    assertThat(run.results()).singleElement().extracting(ResultItem::source).isEqualTo("slow");
    assertThat(run.metadata().sourcesUsed()).containsExactly("slow", "fast");
  }

  @Test
  void passesTrimmedDomainToAdaptersAndFiltersResults() {
    SourceAdapter adapter =
        new SourceAdapter() {
          @Override
          public String name() {
            return "recording";
          }

          @Override
          public List<ResultItem> scrape(String keywords, @Nullable String targetDomain, int maxPages) {
            assertThat(targetDomain).isEqualTo("example.com");
            assertThat(maxPages).isEqualTo(2);
            return List.of(
                ResultItem.of("in", "https://example.com/a", "recording"),
                ResultItem.of("out", "https://elsewhere.org/b", "recording"));
          }
        };

    ScrapeRun run = coordinator(adapter).run("cats", "  example.com ", 2);

    assertThat(run.results()).extracting(ResultItem::title).containsExactly("in");
    assertThat(run.metadata().targetDomain()).isEqualTo("example.com");
  }

  @Test
  void rejectsBlankKeywordsAndNonPositivePages() {
    ScrapeCoordinator coordinator = coordinator(adapter("a", List::of));

    assertThatThrownBy(() -> coordinator.run(" ", null, 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> coordinator.run("cats", null, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectedSubmissionBecomesFailedOutcome() {
    executor.shutdown();
    ScrapeCoordinator coordinator =
        coordinator(adapter("a", () -> List.of(ResultItem.of("A", "https://a.com", "a"))));

    ScrapeRun run = coordinator.run("cats", null, 1);

    assertThat(run.results()).isEmpty();
    assertThat(run.metadata().sourcesUsed()).isEmpty();
  }

  @Test
  void noAdaptersYieldsEmptyRun() {
    ScrapeRun run = coordinator().run("cats", null, 1);

    assertThat(run.results()).isEmpty();
    assertThat(run.metadata().totalResults()).isZero();
  }

  private ScrapeCoordinator coordinator(SourceAdapter... adapters) {
    return new ScrapeCoordinator(List.of(adapters), executor, clock);
  }

  private static SourceAdapter adapter(String name, Supplier<List<ResultItem>> behaviour) {
    return new SourceAdapter() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public List<ResultItem> scrape(String keywords, @Nullable String targetDomain, int maxPages) {
        return behaviour.get();
      }
    };
  }
}
