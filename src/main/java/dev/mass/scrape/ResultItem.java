package dev.mass.scrape;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * One discovered content unit. The {@code link} is the identity key used for deduplication.
 *
 * <p>Instances are immutable; the {@code with*} methods return modified copies so enrichment never
 * mutates an item another stage still holds.
 *
 * @param title display title, never blank
 * @param link absolute URL of the content (may be empty only before merging)
 * @param thumbnail thumbnail URL or empty string
 * @param source name of the adapter that produced the item
 * @param description optional summary text
 * @param author optional author or channel name
 * @param publishedDate optional publication date as reported by the source
 * @param duration optional media duration
 * @param views optional view count as reported by the source
 * @param pageNumber optional 1-based page within the source's pagination
 * @param metadata free-form annotations, e.g. {@value #AI_ANALYSIS_KEY}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultItem(
    String title,
    String link,
    String thumbnail,
    String source,
    @Nullable String description,
    @Nullable String author,
    @JsonProperty("published_date") @Nullable String publishedDate,
    @Nullable String duration,
    @Nullable String views,
    @JsonProperty("page_number") @Nullable Integer pageNumber,
    Map<String, Object> metadata) {

  /** Title used when a source supplies none. */
  public static final String UNTITLED = "Untitled Content";

  /** Metadata key holding the {@link AiAnalysis} written by the enrichment stage. */
  public static final String AI_ANALYSIS_KEY = "ai_analysis";

  public ResultItem {
    title = title == null || title.isBlank() ? UNTITLED : title.trim();
    link = link == null ? "" : link.trim();
    thumbnail = thumbnail == null ? "" : thumbnail;
    source = source == null ? "" : source;
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** Minimal item with only the required fields populated. */
  public static ResultItem of(String title, String link, String source) {
    return new ResultItem(title, link, "", source, null, null, null, null, null, null, Map.of());
  }

  public ResultItem withSource(String newSource) {
    return new ResultItem(
        title,
        link,
        thumbnail,
        newSource,
        description,
        author,
        publishedDate,
        duration,
        views,
        pageNumber,
        metadata);
  }

  public ResultItem withDescription(@Nullable String newDescription) {
    return new ResultItem(
        title,
        link,
        thumbnail,
        source,
        newDescription,
        author,
        publishedDate,
        duration,
        views,
        pageNumber,
        metadata);
  }

  public ResultItem withPageNumber(@Nullable Integer newPageNumber) {
    return new ResultItem(
        title,
        link,
        thumbnail,
        source,
        description,
        author,
        publishedDate,
        duration,
        views,
        newPageNumber,
        metadata);
  }

  /** Returns a copy with {@code key} set in the metadata map, replacing any previous value. */
  public ResultItem withMetadata(String key, Object value) {
    Map<String, Object> updated = new LinkedHashMap<>(metadata);
    updated.put(key, value);
    return new ResultItem(
        title,
        link,
        thumbnail,
        source,
        description,
        author,
        publishedDate,
        duration,
        views,
        pageNumber,
        updated);
  }

  /** The enrichment annotation, if the item went through the enrichment stage. */
  public Optional<AiAnalysis> aiAnalysis() {
    Object value = metadata.get(AI_ANALYSIS_KEY);
    return value instanceof AiAnalysis analysis ? Optional.of(analysis) : Optional.empty();
  }

  boolean hasLink() {
    return !link.isEmpty();
  }
}
