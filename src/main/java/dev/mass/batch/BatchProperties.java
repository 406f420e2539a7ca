package dev.mass.batch;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param outputDir directory receiving the JSON artifacts
 * @param registrant name stamped on links this pipeline registers
 * @param defaultPages link pages to extract when the command line does not say
 * @param pageDelayMs pause between link pages
 */
@ConfigurationProperties(prefix = "mass.batch")
public record BatchProperties(
    String outputDir, String registrant, int defaultPages, long pageDelayMs) {}
