package dev.mass.scrape;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UrlNormalizerTest {

  @Nested
  class WithScheme {

    @Test
    void prefixes_https_when_missing() {
      assertThat(UrlNormalizer.withScheme("example.com")).isEqualTo("https://example.com");
    }

    @Test
    void keeps_existing_scheme() {
      assertThat(UrlNormalizer.withScheme("http://example.com")).isEqualTo("http://example.com");
    }

    @Test
    void trims_whitespace() {
      assertThat(UrlNormalizer.withScheme("  example.com ")).isEqualTo("https://example.com");
    }
  }

  @Nested
  class HostOf {

    @Test
    void lowercases_host() {
      assertThat(UrlNormalizer.hostOf("https://WWW.Google.com/search?q=x"))
          .isEqualTo("www.google.com");
    }

    @Test
    void malformed_url_returns_empty() {
      assertThat(UrlNormalizer.hostOf("https://exa mple.com")).isEmpty();
    }
  }

  @Nested
  class NormalizeToBase {

    @Test
    void drops_path_and_default_port() {
      assertThat(UrlNormalizer.normalizeToBase("https://Example.com:443/a/b?c=d"))
          .isEqualTo("https://example.com");
    }

    @Test
    void keeps_non_default_port() {
      assertThat(UrlNormalizer.normalizeToBase("http://localhost:8080/x"))
          .isEqualTo("http://localhost:8080");
    }
  }

  @Nested
  class Absolutize {

    @Test
    void resolves_root_relative_href() {
      assertThat(UrlNormalizer.absolutize("https://example.com/blog/post", "/about"))
          .isEqualTo("https://example.com/about");
    }

    @Test
    void leaves_absolute_href_unchanged() {
      assertThat(UrlNormalizer.absolutize("https://example.com", "https://other.org/x"))
          .isEqualTo("https://other.org/x");
    }

    @Test
    void leaves_protocol_relative_href_unchanged() {
      assertThat(UrlNormalizer.absolutize("https://example.com", "//cdn.example.com/x"))
          .isEqualTo("//cdn.example.com/x");
    }
  }

  @Nested
  class SearchUrl {

    @Test
    void appends_encoded_keywords_to_query_prefix() {
      assertThat(UrlNormalizer.searchUrl("https://www.google.com/search?q=", "cat videos & more"))
          .isEqualTo("https://www.google.com/search?q=cat%20videos%20%26%20more");
    }

    @Test
    void adds_query_parameter_when_base_has_none() {
      assertThat(UrlNormalizer.searchUrl("https://search.example.com/find", "cats"))
          .isEqualTo("https://search.example.com/find?q=cats");
    }
  }
}
