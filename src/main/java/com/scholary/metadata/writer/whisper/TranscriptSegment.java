package com.scholary.metadata.writer.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Represents a single segment of transcribed audio.
 *
 * <p>This matches the structure returned by the Whisper service. Times are in seconds from the
 * start of the audio.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(double start, double end, String text) {}
