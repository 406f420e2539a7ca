package dev.mass.scrape.firecrawl;

import java.util.Map;

/** Request body for the Firecrawl {@code /v1/crawl} endpoint. */
public record FirecrawlCrawlRequest(
    String url, int limit, boolean allowBackwardLinks, Map<String, Object> scrapeOptions) {}
