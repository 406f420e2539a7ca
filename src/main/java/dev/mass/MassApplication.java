package dev.mass;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Multi-Agent Scraping System.
 *
 * <p>Runs as a web service by default (REST + MCP on port 8080). The {@code batch} profile runs a
 * single domain extraction from the command line and exits.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MassApplication {
    public static void main(String[] args) {
        SpringApplication.run(MassApplication.class, args);
    }
}
