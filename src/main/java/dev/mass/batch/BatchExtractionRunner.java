package dev.mass.batch;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point, active with the {@code batch} profile:
 *
 * <pre>
 * java -jar mass.jar --spring.profiles.active=batch "keyword" example.com --pages=5
 * </pre>
 */
@Component
@Profile("batch")
public class BatchExtractionRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(BatchExtractionRunner.class);

  static final String PAGES_OPTION = "pages";

  private final BatchExtractionService service;
  private final BatchProperties properties;

  public BatchExtractionRunner(BatchExtractionService service, BatchProperties properties) {
    this.service = service;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> positional = args.getNonOptionArgs();
    if (positional.size() < 2) {
      throw new IllegalArgumentException(
          "Usage: <keyword> <domain> [--pages=N]; got " + positional);
    }
    int pages = pages(args);
    BatchReport report = service.extractAll(positional.get(0), positional.get(1), pages);
    log.info(
        "Extraction complete for '{}' on {}: {} results in total",
        report.keyword(),
        report.domain(),
        report.stats().totalResults());
  }

  int pages(ApplicationArguments args) {
    List<String> values = args.getOptionValues(PAGES_OPTION);
    if (values == null || values.isEmpty()) {
      return properties.defaultPages();
    }
    try {
      return Integer.parseInt(values.get(values.size() - 1).trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--pages must be an integer, got " + values, e);
    }
  }
}
