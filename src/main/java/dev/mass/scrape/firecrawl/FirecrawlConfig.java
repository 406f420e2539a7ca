package dev.mass.scrape.firecrawl;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to talk to the Firecrawl extraction API.
 *
 * <p>Base URL, credentials and timeouts come from {@code mass.firecrawl.*}. The client defaults to
 * JSON content type, carries the bearer token when one is configured, and is qualified as {@code
 * "firecrawlRestClient"}.
 */
@Configuration
@EnableRetry
public class FirecrawlConfig {

  /**
   * Creates a pre-configured {@link RestClient} targeting the Firecrawl API.
   *
   * @param builder Spring-provided builder with common defaults
   * @param properties Firecrawl settings
   * @return a named REST client bean for injection into {@link FirecrawlClient}
   */
  @Bean
  public RestClient firecrawlRestClient(
      RestClient.Builder builder, FirecrawlProperties properties) {

    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
    requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

    RestClient.Builder configured =
        builder
            .baseUrl(properties.baseUrl())
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
    if (properties.hasApiKey()) {
      configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey());
    }
    return configured.build();
  }
}
