package com.scholary.metadata.writer.api;

/**
 * Exception thrown when a submission is refused before any job exists.
 *
 * <p>The message is shown to the user as is.
 */
public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }
}
