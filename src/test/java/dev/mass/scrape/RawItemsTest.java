package dev.mass.scrape;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RawItemsTest {

  @Test
  void missingKeysGetDefaults() {
    ResultItem item = RawItems.toResultItem(Map.of(), "google");

    assertThat(item.title()).isEqualTo(ResultItem.UNTITLED);
    assertThat(item.link()).isEmpty();
    assertThat(item.thumbnail()).isEmpty();
    assertThat(item.source()).isEqualTo("google");
    assertThat(item.description()).isNull();
    assertThat(item.pageNumber()).isNull();
    assertThat(item.metadata()).isEmpty();
  }

  @Test
  void copiesPresentFields() {
    Map<String, Object> raw = new HashMap<>();
    raw.put("title", "  Cats  ");
    raw.put("link", "https://cats.example");
    raw.put("thumbnail", "https://cats.example/t.png");
    raw.put("description", "All about cats");
    raw.put("author", "Jo");
    raw.put("published_date", "2024-01-01");
    raw.put("page_number", 2);
    raw.put("metadata", Map.of("lang", "en"));

    ResultItem item = RawItems.toResultItem(raw, "firecrawl");

    assertThat(item.title()).isEqualTo("Cats");
    assertThat(item.link()).isEqualTo("https://cats.example");
    assertThat(item.thumbnail()).isEqualTo("https://cats.example/t.png");
    assertThat(item.description()).isEqualTo("All about cats");
    assertThat(item.author()).isEqualTo("Jo");
    assertThat(item.publishedDate()).isEqualTo("2024-01-01");
    assertThat(item.pageNumber()).isEqualTo(2);
    assertThat(item.metadata()).containsEntry("lang", "en");
  }

  @Test
  void falsyOptionalValuesAreOmitted() {
    Map<String, Object> raw = new HashMap<>();
    raw.put("link", "https://x.com");
    raw.put("description", "");
    raw.put("views", 0);
    raw.put("page_number", 0);
    raw.put("metadata", Map.of());

    ResultItem item = RawItems.toResultItem(raw, "s");

    assertThat(item.description()).isNull();
    assertThat(item.views()).isNull();
    assertThat(item.pageNumber()).isNull();
    assertThat(item.metadata()).isEmpty();
  }

  @Test
  void numericViewsAreStringified() {
    ResultItem item = RawItems.toResultItem(Map.of("link", "https://v.com", "views", 1200), "s");

    assertThat(item.views()).isEqualTo("1200");
  }

  @Test
  void sourceOverrideWinsOverAdapterName() {
    SourceAdapter adapter =
        new SourceAdapter() {
          @Override
          public String name() {
            return "adapter";
          }

          @Override
          public java.util.List<ResultItem> scrape(
              String keywords, String targetDomain, int maxPages) {
            return java.util.List.of();
          }
        };

    assertThat(adapter.format(Map.of("link", "https://a.com"), null).source()).isEqualTo("adapter");
    assertThat(adapter.format(Map.of("link", "https://a.com"), "other").source())
        .isEqualTo("other");
  }
}
