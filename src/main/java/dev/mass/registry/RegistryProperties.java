package dev.mass.registry;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** @param file location of the registry JSON document */
@ConfigurationProperties(prefix = "mass.registry")
public record RegistryProperties(Path file) {}
