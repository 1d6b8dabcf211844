package com.scholary.metadata.writer.whisper;

import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Speech-to-text engine used by the pipeline.
 *
 * <p>This abstraction allows us to swap transcription providers without changing the orchestrator.
 */
public interface TranscriptionEngine {

  /**
   * Make the engine ready. Called once per job before {@link #transcribe}; implementations only do
   * real work the first time.
   *
   * @throws WhisperException if the engine cannot be loaded
   */
  void load();

  /**
   * Transcribe an audio file.
   *
   * @param audioFile mono 16 kHz PCM audio
   * @param languageHint language code passed to the engine
   * @return segments in audio order; single-pass, and must be closed by the caller
   * @throws WhisperException if transcription fails
   */
  Stream<TranscriptSegment> transcribe(Path audioFile, String languageHint);
}
