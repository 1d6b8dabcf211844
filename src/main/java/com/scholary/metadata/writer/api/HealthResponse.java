package com.scholary.metadata.writer.api;

import java.util.List;

/** Availability of the native tools and the generation settings in effect. */
public record HealthResponse(
    boolean ffmpeg,
    boolean ffprobe,
    String ffmpegPath,
    String ffprobePath,
    boolean apiKeyConfigured,
    String model,
    List<String> fallbackModels,
    String reasoningEffort,
    long jobs) {}
