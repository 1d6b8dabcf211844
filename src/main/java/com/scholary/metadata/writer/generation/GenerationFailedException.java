package com.scholary.metadata.writer.generation;

/** Thrown when every model on every protocol has failed. */
public class GenerationFailedException extends RuntimeException {

  static final String REMEDIATION_HINT =
      "If you see missing scopes (example: api.responses.write), create a Project API key with All"
          + " permissions or enable Write access for the Responses API in your key permissions.";

  private final String lastError;

  public GenerationFailedException(String lastError) {
    super("OpenAI request failed.\n\nLast error: " + lastError + "\n\n" + REMEDIATION_HINT);
    this.lastError = lastError;
  }

  public String getLastError() {
    return lastError;
  }
}
