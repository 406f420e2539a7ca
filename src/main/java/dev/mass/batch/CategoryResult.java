package dev.mass.batch;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one extraction category after registry filtering.
 *
 * @param category {@code references}, {@code videos} or {@code links}
 * @param extracted records returned by the service before filtering
 * @param items records whose URL was new to the registry (or already this registrant's)
 */
public record CategoryResult(
    String category,
    @JsonProperty("total_extracted") int extracted,
    List<Map<String, Object>> items) {

  public CategoryResult {
    items = List.copyOf(items);
  }

  @JsonProperty("filtered_out")
  public int filteredOut() {
    return Math.max(0, extracted - items.size());
  }
}
