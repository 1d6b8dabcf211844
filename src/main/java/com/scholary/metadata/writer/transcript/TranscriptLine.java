package com.scholary.metadata.writer.transcript;

/**
 * One transcript line, rendered as {@code MM:SS text}.
 *
 * <p>Minutes and seconds are truncated from the segment start. Minutes are not capped at 59, so a
 * two-hour recording produces {@code 120:05}.
 */
public record TranscriptLine(double startSeconds, String text) {

  public int timestampSeconds() {
    return (int) startSeconds;
  }

  public String timestamp() {
    int total = timestampSeconds();
    return String.format("%02d:%02d", total / 60, total % 60);
  }

  public String render() {
    return timestamp() + " " + text;
  }
}
