package dev.mass.api;

import dev.mass.pipeline.ScrapeResponse;
import dev.mass.pipeline.ScrapeService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface: one scrape operation and a liveness probe. Failures are rendered by {@link
 * dev.mass.config.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
public class ScrapeController {

  private final ScrapeService scrapeService;
  private final Clock clock;

  public ScrapeController(ScrapeService scrapeService, Clock clock) {
    this.scrapeService = scrapeService;
    this.clock = clock;
  }

  @PostMapping("/scrape")
  public ScrapeResponse scrape(@Valid @RequestBody ScrapeRequest request) {
    return scrapeService.scrape(request.keywords(), request.targetDomain(), request.maxPages());
  }

  @GetMapping("/health")
  public Map<String, String> health() {
    return Map.of("status", "healthy", "timestamp", clock.instant().toString());
  }
}
