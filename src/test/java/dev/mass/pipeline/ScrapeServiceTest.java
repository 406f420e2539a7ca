package dev.mass.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;

import dev.mass.enrich.EnrichmentService;
import dev.mass.scrape.ResultItem;
import dev.mass.scrape.RunMetadata;
import dev.mass.scrape.ScrapeCoordinator;
import dev.mass.scrape.ScrapeProperties;
import dev.mass.scrape.ScrapeRun;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScrapeServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private ScrapeCoordinator coordinator;
  @Mock private EnrichmentService enrichmentService;

  private ScrapeService service;

  private final List<ResultItem> merged =
      List.of(
          ResultItem.of("A", "https://a.com", "google"),
          ResultItem.of("B", "https://b.com", "firecrawl"));

  @BeforeEach
  void setUp() {
    var properties = new ScrapeProperties();
    properties.setDefaultMaxPages(4);
    service = new ScrapeService(coordinator, enrichmentService, properties);
  }

  private ScrapeRun run(List<ResultItem> results) {
    return new ScrapeRun(
        results,
        new RunMetadata("cats", null, NOW, results.size(), List.of("google", "firecrawl"), 0.5));
  }

  @Test
  void runsCoordinatorThenEnrichment() {
    List<ResultItem> enriched = List.of(merged.get(0).withMetadata("processed", true), merged.get(1));
    given(coordinator.run("cats", "example.com", 2)).willReturn(run(merged));
    given(enrichmentService.enhance(merged, "cats")).willReturn(enriched);

    ScrapeResponse response = service.scrape("cats", "example.com", 2);

    assertThat(response.results()).isEqualTo(enriched);
    assertThat(response.metadata().totalResults()).isEqualTo(2);
    assertThat(response.metadata().sourcesUsed()).containsExactly("google", "firecrawl");
  }

  @Test
  void missingPageCountUsesConfiguredDefault() {
    given(coordinator.run("cats", null, 4)).willReturn(run(List.of()));
    given(enrichmentService.enhance(List.of(), "cats")).willReturn(List.of());

    ScrapeResponse response = service.scrape("cats", null, null);

    assertThat(response.results()).isEmpty();
    verify(coordinator).run("cats", null, 4);
  }

  @Test
  void totalReflectsEnrichedResultSize() {
    given(coordinator.run("cats", null, 1)).willReturn(run(merged));
    given(enrichmentService.enhance(merged, "cats")).willReturn(List.of(merged.get(0)));

    assertThat(service.scrape("cats", null, 1).metadata().totalResults()).isEqualTo(1);
  }
}
