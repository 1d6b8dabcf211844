package com.scholary.metadata.writer.generation;

/**
 * Payload shared by every attempt of one generation.
 *
 * @param systemPrompt fixed instruction text
 * @param userPayload per-job link mode, validated links and transcript
 * @param reasoningEffort {@code low}, {@code medium} or {@code high}
 */
public record GenerationRequest(String systemPrompt, String userPayload, String reasoningEffort) {}
