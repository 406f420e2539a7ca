package dev.mass.enrich;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;
import java.util.Locale;

/**
 * Coarse content classification derived from a URL. Constants are declared in match priority
 * order; {@link #WEBPAGE} is the catch-all.
 */
public enum ContentKind {
    VIDEO("video", List.of("youtube")),
    ARTICLE("article", List.of("wikipedia")),
    IMAGE("image", List.of(".jpg", ".png", ".gif")),
    DOCUMENT("document", List.of(".pdf", ".doc")),
    WEBPAGE("webpage", List.of());

    private final String value;
    private final List<String> markers;

    ContentKind(String value, List<String> markers) {
        this.value = value;
        this.markers = markers;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Classifies a link by case-insensitive substring match against each kind's markers.
     *
     * @param url the item link, may be empty
     * @return the first matching kind, or {@link #WEBPAGE}
     */
    public static ContentKind classify(String url) {
        String lower = url == null ? "" : url.toLowerCase(Locale.ROOT);
        for (ContentKind kind : values()) {
            if (kind.markers.stream().anyMatch(lower::contains)) {
                return kind;
            }
        }
        return WEBPAGE;
    }
}
