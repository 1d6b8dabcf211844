package com.scholary.metadata.writer.service;

/** Thrown when transcription finishes without any speech. Silent audio fails the job. */
public class EmptyTranscriptException extends RuntimeException {

  public EmptyTranscriptException() {
    super("Transcript is empty. Check the audio track in your file.");
  }
}
