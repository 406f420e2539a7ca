package dev.mass.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * On-disk layout of the registry: links keyed by URL plus a metadata block. Unknown fields are
 * ignored so files written by newer versions stay readable; null entries are skipped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record RegistryDocument(Map<String, RegistryEntry> links, Metadata metadata) {

  RegistryDocument {
    Map<String, RegistryEntry> copy = new LinkedHashMap<>();
    if (links != null) {
      links.forEach(
          (url, entry) -> {
            if (url != null && entry != null) {
              copy.put(url, entry);
            }
          });
    }
    links = copy;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonInclude(JsonInclude.Include.NON_NULL)
  record Metadata(
      String created,
      @JsonProperty("last_updated") String lastUpdated,
      @Nullable String error) {}
}
