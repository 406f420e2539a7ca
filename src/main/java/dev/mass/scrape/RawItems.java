package dev.mass.scrape;

import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Normalization of loosely-typed records (parsed JSON, scraped DOM fields) into {@link
 * ResultItem}s. Missing keys get defaults; optional keys are copied only when truthy, i.e. non-null,
 * non-blank strings, non-zero numbers and non-empty maps.
 */
public final class RawItems {

  private RawItems() {
    // utility class
  }

  /**
   * Builds a {@link ResultItem} from a raw key/value record.
   *
   * @param raw the raw record; keys follow the snake_case wire names ({@code published_date},
   *     {@code page_number})
   * @param source the provenance tag to stamp on the item
   * @return the normalized item
   */
  public static ResultItem toResultItem(Map<String, ?> raw, String source) {
    String title = stringOrNull(raw.get("title"));
    return new ResultItem(
        title != null ? title : ResultItem.UNTITLED,
        stringOrEmpty(raw.get("link")),
        stringOrEmpty(raw.get("thumbnail")),
        source,
        optionalString(raw.get("description")),
        optionalString(raw.get("author")),
        optionalString(raw.get("published_date")),
        optionalString(raw.get("duration")),
        optionalString(raw.get("views")),
        optionalInteger(raw.get("page_number")),
        optionalMetadata(raw.get("metadata")));
  }

  private static String stringOrEmpty(@Nullable Object value) {
    String s = stringOrNull(value);
    return s != null ? s : "";
  }

  private static @Nullable String stringOrNull(@Nullable Object value) {
    return value == null ? null : value.toString();
  }

  private static @Nullable String optionalString(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number && number.doubleValue() == 0.0) {
      return null;
    }
    String s = value.toString();
    return s.isBlank() ? null : s;
  }

  private static @Nullable Integer optionalInteger(@Nullable Object value) {
    if (value instanceof Number number) {
      return number.intValue() == 0 ? null : number.intValue();
    }
    if (value instanceof String s && !s.isBlank()) {
      try {
        int parsed = Integer.parseInt(s.trim());
        return parsed == 0 ? null : parsed;
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static Map<String, Object> optionalMetadata(@Nullable Object value) {
    if (!(value instanceof Map<?, ?> map) || map.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    map.forEach(
        (k, v) -> {
          if (k != null && v != null) {
            copy.put(k.toString(), v);
          }
        });
    return copy;
  }
}
