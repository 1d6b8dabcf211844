package com.scholary.metadata.writer.job;

/**
 * Named steps of the per-job pipeline.
 *
 * <p>Each stage carries the label shown to polling clients and the progress value written when the
 * stage is entered. Transcribing advances further on its own, up to 75.
 */
public enum JobStage {
  QUEUED("Queued...", 1, false),
  EXTRACTING_AUDIO("Extracting audio...", 5, false),
  LOADING_TRANSCRIPTION_ENGINE("Loading speech model... (first run may take time)", 15, false),
  TRANSCRIBING("Transcribing audio...", 20, false),
  VALIDATING_LINKS("Validating links...", 80, false),
  GENERATING_METADATA("Generating metadata...", 88, false),
  CHECKING_QA("Final process check...", 96, false),
  COMPLETED("Done.", 100, true),
  HARD_STOPPED("Stopped (Hard Stop).", 100, true),
  FAILED("Error", 100, true);

  private final String label;
  private final int progress;
  private final boolean terminal;

  JobStage(String label, int progress, boolean terminal) {
    this.label = label;
    this.progress = progress;
    this.terminal = terminal;
  }

  public String label() {
    return label;
  }

  public int progress() {
    return progress;
  }

  public boolean isTerminal() {
    return terminal;
  }
}
