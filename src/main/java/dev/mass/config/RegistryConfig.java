package dev.mass.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mass.registry.LinkRegistry;
import dev.mass.registry.RegistryProperties;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** One explicitly constructed registry instance, injected wherever cross-run dedup is needed. */
@Configuration
public class RegistryConfig {

  @Bean
  public LinkRegistry linkRegistry(
      RegistryProperties properties, ObjectMapper objectMapper, Clock clock) {
    return new LinkRegistry(properties.file(), objectMapper, clock);
  }
}
