package dev.mass.registry;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Snapshot of registry contents.
 *
 * @param totalLinks number of registered links
 * @param countsByRegistrant link count per registrant
 * @param createdAt when the registry was created (ISO-8601)
 * @param lastUpdatedAt when it was last flushed (ISO-8601)
 */
public record RegistryStats(
    @JsonProperty("total_links") int totalLinks,
    @JsonProperty("by_registrant") Map<String, Integer> countsByRegistrant,
    @JsonProperty("created") String createdAt,
    @JsonProperty("last_updated") String lastUpdatedAt) {

  public RegistryStats {
    countsByRegistrant = Map.copyOf(countsByRegistrant);
  }
}
