package dev.mass.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Combined artifact of one batch run. */
public record BatchReport(
    String keyword,
    String domain,
    Instant timestamp,
    List<Map<String, Object>> references,
    List<Map<String, Object>> videos,
    List<Map<String, Object>> links,
    Stats stats) {

  public record Stats(
      @JsonProperty("total_references") int totalReferences,
      @JsonProperty("total_videos") int totalVideos,
      @JsonProperty("total_links") int totalLinks,
      @JsonProperty("total_results") int totalResults) {}

  static BatchReport of(
      String keyword,
      String domain,
      Instant timestamp,
      CategoryResult references,
      CategoryResult videos,
      CategoryResult links) {
    int r = references.items().size();
    int v = videos.items().size();
    int l = links.items().size();
    return new BatchReport(
        keyword,
        domain,
        timestamp,
        references.items(),
        videos.items(),
        links.items(),
        new Stats(r, v, l, r + v + l));
  }
}
