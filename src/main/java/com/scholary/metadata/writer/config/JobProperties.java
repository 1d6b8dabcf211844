package com.scholary.metadata.writer.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for metadata jobs.
 *
 * <p>Controls where uploads and per-job scratch files live, which uploads are accepted, and how
 * many jobs run at once.
 */
@ConfigurationProperties(prefix = "jobs")
@Validated
public record JobProperties(
    @NotBlank String uploadDir,
    @NotBlank String workDir,
    @NotEmpty List<String> allowedExtensions,
    @NotBlank String languageHint,
    @Positive int executorThreads,
    @Positive int executorQueueSize) {}
