package dev.mass.config;

import dev.mass.scrape.ScrapeProperties;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Process-wide time source and the worker pool adapters run on. */
@Configuration
public class RuntimeConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Fixed pool sized by {@code mass.scrape.adapter-threads}. Shared by every run, so concurrent
   * requests queue behind each other's adapters rather than spawning unbounded threads.
   */
  @Bean(destroyMethod = "shutdown")
  public ExecutorService adapterExecutor(ScrapeProperties properties) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threads =
        runnable -> {
          Thread thread = new Thread(runnable, "scrape-adapter-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(properties.getAdapterThreads(), threads);
  }
}
