package com.scholary.metadata.writer.audio;

/**
 * Exception thrown when ffmpeg cannot produce the audio track.
 *
 * <p>The message carries ffmpeg's stderr, which is usually the only useful diagnosis for a broken
 * upload.
 */
public class AudioExtractionException extends RuntimeException {

  public AudioExtractionException(String message) {
    super(message);
  }

  public AudioExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
