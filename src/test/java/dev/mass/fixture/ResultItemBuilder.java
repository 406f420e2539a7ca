package dev.mass.fixture;

import dev.mass.scrape.ResultItem;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Test builder for {@link ResultItem} with defaults for every field.
 *
 * <pre>{@code
 * ResultItem item = new ResultItemBuilder().link("https://x.com").source("google").build();
 * }</pre>
 */
public final class ResultItemBuilder {

  private String title = "Example result";
  private String link = "https://example.com/page";
  private String thumbnail = "";
  private String source = "test";
  private @Nullable String description;
  private @Nullable Integer pageNumber;
  private final Map<String, Object> metadata = new LinkedHashMap<>();

  public ResultItemBuilder title(String title) {
    this.title = title;
    return this;
  }

  public ResultItemBuilder link(String link) {
    this.link = link;
    return this;
  }

  public ResultItemBuilder thumbnail(String thumbnail) {
    this.thumbnail = thumbnail;
    return this;
  }

  public ResultItemBuilder source(String source) {
    this.source = source;
    return this;
  }

  public ResultItemBuilder description(@Nullable String description) {
    this.description = description;
    return this;
  }

  public ResultItemBuilder pageNumber(@Nullable Integer pageNumber) {
    this.pageNumber = pageNumber;
    return this;
  }

  public ResultItemBuilder metadata(String key, Object value) {
    this.metadata.put(key, value);
    return this;
  }

  public ResultItem build() {
    return new ResultItem(
        title,
        link,
        thumbnail,
        source,
        description,
        null,
        null,
        null,
        null,
        pageNumber,
        metadata);
  }
}
