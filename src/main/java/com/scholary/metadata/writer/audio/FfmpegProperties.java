package com.scholary.metadata.writer.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>The binaries are resolved on the PATH unless an absolute path is given. The output format
 * defaults to what the speech engine expects: mono, 16 kHz, 16-bit PCM.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int sampleRate,
    @Positive int channels,
    @NotBlank String audioCodec) {}
