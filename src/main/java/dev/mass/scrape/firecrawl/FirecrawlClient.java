package dev.mass.scrape.firecrawl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Thin client for the Firecrawl v1 API. Crawl and extract are asynchronous jobs on the service
 * side: each call submits a job, then polls its status until it completes, fails, or the poll
 * budget runs out.
 *
 * <p>Transient {@link RestClientException}s are retried with exponential backoff; once retries are
 * exhausted the {@code @Recover} methods return an empty result instead of throwing.
 */
@Service
public class FirecrawlClient {

  private static final Logger log = LoggerFactory.getLogger(FirecrawlClient.class);

  private final RestClient restClient;
  private final FirecrawlProperties properties;

  public FirecrawlClient(
      @Qualifier("firecrawlRestClient") RestClient restClient, FirecrawlProperties properties) {
    this.restClient = restClient;
    this.properties = properties;
  }

  /**
   * Crawls a site starting from {@code url} and returns the crawled pages.
   *
   * @param url absolute start URL
   * @param limit maximum number of pages the service should crawl
   * @return crawled pages, empty if the job failed or returned nothing
   */
  @Retryable(
      retryFor = RestClientException.class,
      maxAttemptsExpression = "${mass.firecrawl.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${mass.firecrawl.retry.delay-ms}",
              multiplierExpression = "${mass.firecrawl.retry.multiplier}"))
  public List<FirecrawlDocument> crawl(String url, int limit) {
    FirecrawlCrawlRequest request =
        new FirecrawlCrawlRequest(
            url,
            limit,
            true,
            Map.of("formats", List.of("markdown"), "onlyMainContent", true));

    FirecrawlJobResponse job =
        restClient
            .post()
            .uri("/v1/crawl")
            .body(request)
            .retrieve()
            .body(FirecrawlJobResponse.class);
    if (job == null || !job.success() || job.id() == null) {
      log.warn("Firecrawl refused crawl of {}: {}", url, job == null ? "no response" : job.error());
      return List.of();
    }

    FirecrawlCrawlStatus status = null;
    for (int poll = 0; poll < properties.maxPolls(); poll++) {
      status =
          restClient
              .get()
              .uri("/v1/crawl/{id}", job.id())
              .retrieve()
              .body(FirecrawlCrawlStatus.class);
      if (status == null || status.isFailed()) {
        log.warn(
            "Firecrawl crawl {} of {} failed: {}",
            job.id(),
            url,
            status == null ? "no status" : status.error());
        return List.of();
      }
      if (status.isCompleted() || !pause()) {
        break;
      }
    }
    if (status != null && !status.isCompleted()) {
      log.warn(
          "Firecrawl crawl {} still {} after {} polls, using partial data",
          job.id(),
          status.status(),
          properties.maxPolls());
    }
    return status == null ? List.of() : status.data();
  }

  @Recover
  List<FirecrawlDocument> recoverCrawl(RestClientException e, String url, int limit) {
    log.warn("Firecrawl crawl failed after retries for {}: {}", url, e.getMessage());
    return List.of();
  }

  /**
   * Runs a structured extraction and returns the raw {@code data} tree of the completed job.
   *
   * @param urls pages to extract from; empty to let the extraction agent choose
   * @param prompt natural-language extraction instruction
   * @param schema JSON schema describing the expected output
   * @param useAgent whether to request the FIRE-1 agent for page discovery
   * @return the job's data, or a {@link MissingNode} when nothing usable came back
   */
  @Retryable(
      retryFor = RestClientException.class,
      maxAttemptsExpression = "${mass.firecrawl.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${mass.firecrawl.retry.delay-ms}",
              multiplierExpression = "${mass.firecrawl.retry.multiplier}"))
  public JsonNode extract(
      List<String> urls, String prompt, Map<String, Object> schema, boolean useAgent) {
    FirecrawlExtractRequest request =
        new FirecrawlExtractRequest(
            urls, prompt, schema, useAgent ? Map.of("model", "FIRE-1") : null);

    FirecrawlJobResponse job =
        restClient
            .post()
            .uri("/v1/extract")
            .body(request)
            .retrieve()
            .body(FirecrawlJobResponse.class);
    if (job == null || !job.success() || job.id() == null) {
      log.warn("Firecrawl refused extraction: {}", job == null ? "no response" : job.error());
      return MissingNode.getInstance();
    }

    for (int poll = 0; poll < properties.maxPolls(); poll++) {
      FirecrawlExtractStatus status =
          restClient
              .get()
              .uri("/v1/extract/{id}", job.id())
              .retrieve()
              .body(FirecrawlExtractStatus.class);
      if (status == null || status.isFailed()) {
        log.warn(
            "Firecrawl extraction {} failed: {}",
            job.id(),
            status == null ? "no status" : status.error());
        return MissingNode.getInstance();
      }
      if (status.isCompleted()) {
        return dataOrMissing(status.data());
      }
      if (!pause()) {
        break;
      }
    }
    log.warn("Firecrawl extraction {} did not complete after {} polls", job.id(), properties.maxPolls());
    return MissingNode.getInstance();
  }

  @Recover
  JsonNode recoverExtract(
      RestClientException e,
      List<String> urls,
      String prompt,
      Map<String, Object> schema,
      boolean useAgent) {
    log.warn("Firecrawl extraction failed after retries for prompt '{}': {}", prompt, e.getMessage());
    return MissingNode.getInstance();
  }

  private static JsonNode dataOrMissing(@Nullable JsonNode data) {
    return data == null ? MissingNode.getInstance() : data;
  }

  /** Sleeps one poll interval. Returns false if the thread was interrupted. */
  private boolean pause() {
    if (properties.pollIntervalMs() <= 0) {
      return true;
    }
    try {
      Thread.sleep(properties.pollIntervalMs());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
