package com.scholary.metadata.writer.transcript;

import com.scholary.metadata.writer.whisper.TranscriptSegment;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the timestamped transcript from engine segments and tracks transcription progress.
 *
 * <p>Progress runs from {@value #START_PROGRESS} to {@value #END_PROGRESS} in proportion to the
 * audio covered by the latest segment end. It only moves forward. With an unknown total duration it
 * stays at the start value.
 *
 * <p>Not thread-safe; one assembler belongs to one job.
 */
public class TranscriptAssembler {

  static final int START_PROGRESS = 20;
  static final int END_PROGRESS = 75;

  private final double totalDurationSeconds;
  private final List<TranscriptLine> lines = new ArrayList<>();
  private int progress = START_PROGRESS;

  public TranscriptAssembler(double totalDurationSeconds) {
    this.totalDurationSeconds = totalDurationSeconds;
  }

  /**
   * Add one segment.
   *
   * @return true if progress advanced
   */
  public boolean append(TranscriptSegment segment) {
    String text = segment.text() == null ? "" : segment.text().strip();
    lines.add(new TranscriptLine(segment.start(), text));

    if (totalDurationSeconds <= 0) {
      return false;
    }
    double covered = Math.min(1.0, segment.end() / totalDurationSeconds);
    int candidate = START_PROGRESS + (int) Math.floor((END_PROGRESS - START_PROGRESS) * covered);
    if (candidate > progress) {
      progress = candidate;
      return true;
    }
    return false;
  }

  public int progress() {
    return progress;
  }

  public List<TranscriptLine> lines() {
    return List.copyOf(lines);
  }

  /** The transcript text, one rendered line per segment; empty when nothing was said. */
  public String text() {
    return lines.stream().map(TranscriptLine::render).collect(Collectors.joining("\n")).strip();
  }
}
