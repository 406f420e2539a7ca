package dev.mass.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Who registered a link and when. {@code script} is the on-disk name of the registrant field.
 *
 * @param registrant name of the pipeline that first registered the link
 * @param timestamp ISO-8601 registration time
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistryEntry(
    @JsonProperty("script") String registrant, @JsonProperty("timestamp") String timestamp) {}
