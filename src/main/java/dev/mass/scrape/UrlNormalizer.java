package dev.mass.scrape;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * URL helpers shared by the adapters: scheme defaulting, host extraction, search URL building and
 * resolution of root-relative links.
 */
public final class UrlNormalizer {

  private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

  private UrlNormalizer() {
    // utility class
  }

  /**
   * Prefixes {@code https://} when the input carries no HTTP(S) scheme.
   *
   * @param url a URL or bare domain
   * @return the URL with an explicit scheme
   */
  public static String withScheme(String url) {
    String trimmed = url.trim();
    if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
      return trimmed;
    }
    return "https://" + trimmed;
  }

  /**
   * Lowercased host of a URL.
   *
   * @return the host, or an empty string if the URL cannot be parsed
   */
  public static String hostOf(String url) {
    try {
      String host = new URI(withScheme(url)).getHost();
      return host == null ? "" : host.toLowerCase();
    } catch (URISyntaxException e) {
      log.debug("Malformed URL, no host: {}", url);
      return "";
    }
  }

  /**
   * Extract the base URL (scheme://host[:port]) from a full URL. Default ports are omitted.
   *
   * @param url the URL to extract the base from
   * @return the base URL, or the input unchanged if malformed
   */
  public static String normalizeToBase(String url) {
    try {
      URI uri = new URI(url);
      if (uri.getScheme() == null || uri.getHost() == null) {
        log.warn("URL missing scheme or host, returning unchanged: {}", url);
        return url;
      }
      String scheme = uri.getScheme().toLowerCase();
      String host = uri.getHost().toLowerCase();
      int port = uri.getPort();
      if (port == -1 || isDefaultPort(scheme, port)) {
        return scheme + "://" + host;
      }
      return scheme + "://" + host + ":" + port;
    } catch (URISyntaxException e) {
      log.warn("Malformed URL, returning unchanged: {}", url);
      return url;
    }
  }

  /**
   * Resolves a root-relative href ({@code /path}) against the page it was found on. Other hrefs are
   * returned unchanged.
   */
  public static String absolutize(String pageUrl, String href) {
    if (href.startsWith("/") && !href.startsWith("//")) {
      return normalizeToBase(pageUrl) + href;
    }
    return href;
  }

  /** Appends URL-encoded keywords to a search base URL such as {@code https://host/search?q=}. */
  public static String searchUrl(String searchBaseUrl, String keywords) {
    String encoded = URLEncoder.encode(keywords, StandardCharsets.UTF_8).replace("+", "%20");
    if (searchBaseUrl.endsWith("=")) {
      return searchBaseUrl + encoded;
    }
    return searchBaseUrl + (searchBaseUrl.contains("?") ? "&q=" : "?q=") + encoded;
  }

  private static boolean isDefaultPort(String scheme, int port) {
    return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
  }
}
