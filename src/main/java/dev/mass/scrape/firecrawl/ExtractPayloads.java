package dev.mass.scrape.firecrawl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes the loosely-shaped {@code data} of an extract job into raw item records.
 *
 * <p>Accepted shapes are a top-level array of objects, or an object holding such an array under a
 * named field ({@value #RESULTS_FIELD} by default). Anything else yields no records. Array elements
 * that are not objects or carry no link are dropped.
 */
public final class ExtractPayloads {

  private static final Logger log = LoggerFactory.getLogger(ExtractPayloads.class);

  public static final String RESULTS_FIELD = "results";

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, Object>> RECORD = new TypeReference<>() {};

  private ExtractPayloads() {
    // utility class
  }

  /** Schema sent by the search adapter: a {@value #RESULTS_FIELD} array of content items. */
  static Map<String, Object> schema() {
    Map<String, String> properties = new LinkedHashMap<>();
    properties.put("title", "The title of the content");
    properties.put("link", "URL of the content");
    properties.put("thumbnail", "URL of thumbnail image if available");
    properties.put("description", "Brief description of the content");
    properties.put("author", "Author or creator name");
    properties.put("published_date", "Publication date if available");
    return arraySchema(RESULTS_FIELD, properties, List.of("title", "link"));
  }

  static List<Map<String, Object>> toRecords(JsonNode data) {
    return records(data, RESULTS_FIELD, "link");
  }

  /**
   * Extracts object records from {@code data}.
   *
   * @param data the extract job's data tree
   * @param field name of the array field when {@code data} is an object
   * @param linkKey key every kept record must carry with a non-null value
   * @return mutable records in payload order
   */
  public static List<Map<String, Object>> records(JsonNode data, String field, String linkKey) {
    JsonNode array = data.isArray() ? data : data.path(field);
    if (!array.isArray()) {
      if (!data.isMissingNode()) {
        log.warn("Unexpected extract payload shape: {}", data.getNodeType());
      }
      return new ArrayList<>();
    }
    List<Map<String, Object>> records = new ArrayList<>();
    for (JsonNode element : array) {
      if (!element.isObject() || !element.hasNonNull(linkKey)) {
        continue;
      }
      records.add(MAPPER.convertValue(element, RECORD));
    }
    return records;
  }

  /**
   * Schema for an object holding one array of items under {@code field}.
   *
   * @param field array field name
   * @param itemProperties property name to description; every property is a string
   * @param required required item properties
   */
  public static Map<String, Object> arraySchema(
      String field, Map<String, String> itemProperties, List<String> required) {
    Map<String, Object> properties = new LinkedHashMap<>();
    itemProperties.forEach((name, description) -> properties.put(name, field(description)));
    Map<String, Object> item =
        Map.of("type", "object", "properties", properties, "required", required);
    return Map.of(
        "type", "object",
        "properties", Map.of(field, Map.of("type", "array", "items", item)),
        "required", List.of(field));
  }

  private static Map<String, String> field(String description) {
    return Map.of("type", "string", "description", description);
  }
}
