package com.scholary.metadata.writer.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for Whisper API client.
 *
 * <p>These control how we connect to the Whisper service and which decoding options it runs with.
 * VAD stays off by default because the service's VAD model is an optional download.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int beamSize,
    boolean vadFilter) {}
