package dev.mass.enrich;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.mass.fixture.ResultItemBuilder;
import dev.mass.scrape.ResultItem;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EnrichmentServiceTest {

  @Mock private ContentEnricher primary;

  private EnrichmentService service;

  private final List<ResultItem> items =
      List.of(
          new ResultItemBuilder().title("Cats").link("https://a.com").build(),
          new ResultItemBuilder().title("More cats").link("https://b.com").build());

  @BeforeEach
  void setUp() {
    service = new EnrichmentService(primary, new KeywordHeuristicEnricher());
  }

  @Test
  void returnsPrimaryResult() {
    List<ResultItem> enhanced = List.of(items.get(1), items.get(0));
    when(primary.enhance(items, "cats")).thenReturn(enhanced);

    assertThat(service.enhance(items, "cats")).isSameAs(enhanced);
  }

  @Test
  void fallsBackWhenPrimaryThrows() {
    when(primary.enhance(any(), anyString())).thenThrow(new IllegalStateException("quota"));

    List<ResultItem> enhanced = service.enhance(items, "cats");

    assertThat(enhanced).hasSize(2);
    assertThat(enhanced)
        .allSatisfy(item -> assertThat(item.metadata()).containsKey(KeywordHeuristicEnricher.PROCESSED_KEY));
  }

  @Test
  void fallsBackWhenPrimaryDropsItems() {
    when(primary.enhance(any(), anyString())).thenReturn(List.of(items.get(0)));

    assertThat(service.enhance(items, "cats"))
        .extracting(ResultItem::link)
        .containsExactly("https://a.com", "https://b.com");
  }

  @Test
  void emptyInputSkipsEnrichment() {
    assertThat(service.enhance(List.of(), "cats")).isEmpty();
    verifyNoInteractions(primary);
  }

  @Test
  void reportsStrategyName() {
    var heuristic = new EnrichmentService(new KeywordHeuristicEnricher(), new KeywordHeuristicEnricher());

    assertThat(heuristic.strategyName()).isEqualTo("KeywordHeuristicEnricher");
  }
}
