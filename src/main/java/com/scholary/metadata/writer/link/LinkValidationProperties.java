package com.scholary.metadata.writer.link;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for fetching submitted links.
 *
 * <p>{@code unavailableMarkers} are matched case-insensitively against the fetched page body.
 */
@ConfigurationProperties(prefix = "links")
@Validated
public record LinkValidationProperties(
    @Positive int timeoutSeconds,
    @NotBlank String userAgent,
    @NotNull List<String> unavailableMarkers) {}
