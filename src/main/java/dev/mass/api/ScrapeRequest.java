package dev.mass.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/scrape}. Snake-case aliases are accepted for the optional fields.
 *
 * @param keywords search keywords, required
 * @param targetDomain optional domain to restrict results to
 * @param maxPages pages per source; the configured default when absent
 */
public record ScrapeRequest(
    @NotBlank String keywords,
    @JsonAlias("target_domain") @Nullable String targetDomain,
    @JsonAlias("max_pages") @Min(1) @Nullable Integer maxPages) {}
