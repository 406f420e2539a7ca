package dev.mass.scrape.firecrawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/** One crawled page: Markdown body plus page metadata. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FirecrawlDocument(@Nullable String markdown, @Nullable Metadata metadata) {

  /** Page metadata reported by Firecrawl. {@code sourceURL} is the requested URL. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Metadata(
      @Nullable String title,
      @Nullable String description,
      @JsonProperty("sourceURL") @Nullable String sourceUrl,
      @Nullable String url) {}

  public @Nullable String title() {
    return metadata == null ? null : metadata.title();
  }

  public @Nullable String description() {
    return metadata == null ? null : metadata.description();
  }

  /** The page URL, preferring the requested URL over the final (redirected) one. */
  public @Nullable String pageUrl() {
    if (metadata == null) {
      return null;
    }
    return metadata.sourceUrl() != null ? metadata.sourceUrl() : metadata.url();
  }
}
