package dev.mass.config;

import dev.mass.scrape.ScrapeCoordinator;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Assembles the coordinator once, at startup, from the configured sources. */
@Configuration
public class ScrapeConfig {

  @Bean
  public ScrapeCoordinator scrapeCoordinator(
      SourceAdapterFactory factory,
      @Qualifier("adapterExecutor") ExecutorService adapterExecutor,
      Clock clock) {
    return new ScrapeCoordinator(factory.createAdapters(), adapterExecutor, clock);
  }
}
