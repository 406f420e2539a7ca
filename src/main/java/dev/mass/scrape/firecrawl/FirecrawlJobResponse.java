package dev.mass.scrape.firecrawl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/** Acknowledgement returned when a crawl or extract job is submitted. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FirecrawlJobResponse(boolean success, @Nullable String id, @Nullable String error) {}
