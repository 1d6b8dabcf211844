package com.scholary.metadata.writer.audio;

import java.nio.file.Path;
import java.util.Optional;

/** Native audio tooling the pipeline depends on. */
public interface AudioExtractor {

  /**
   * Extract the audio track of a media file as mono, 16 kHz, uncompressed PCM.
   *
   * @throws AudioExtractionException if the tool exits non-zero or cannot be run
   */
  void extract(Path source, Path destination);

  /**
   * Duration of an audio file in seconds.
   *
   * @return the duration, or 0 if it cannot be determined
   */
  double probeDurationSeconds(Path audioFile);

  /** Resolved location of the extraction binary, empty if it is not installed. */
  Optional<Path> extractorLocation();

  /** Resolved location of the probe binary, empty if it is not installed. */
  Optional<Path> probeLocation();

  default boolean isAvailable() {
    return extractorLocation().isPresent() && probeLocation().isPresent();
  }
}
