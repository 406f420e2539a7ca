package dev.mass.pipeline;

import dev.mass.scrape.ResultItem;
import dev.mass.scrape.RunMetadata;
import java.util.List;

public record ScrapeResponse(List<ResultItem> results, RunMetadata metadata) {

  public ScrapeResponse {
    results = List.copyOf(results);
  }
}
