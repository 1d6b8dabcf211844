package com.scholary.metadata.writer.generation;

/**
 * Exception thrown when a single generation call fails.
 *
 * <p>Carries the HTTP status (0 when the service was never reached) and the raw error body so the
 * fallback policy can classify the failure.
 */
public class GenerationTransportException extends RuntimeException {

  private final int statusCode;
  private final String body;

  public GenerationTransportException(int statusCode, String body) {
    super(String.format("Error code: %d - %s", statusCode, body));
    this.statusCode = statusCode;
    this.body = body == null ? "" : body;
  }

  public GenerationTransportException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
    this.body = "";
  }

  public int getStatusCode() {
    return statusCode;
  }

  public String getBody() {
    return body;
  }

  /**
   * Whether the service refused the call because the credential lacks a permission scope.
   *
   * @param scope the scope name as the service reports it, e.g. {@code api.responses.write}
   */
  public boolean isMissingScope(String scope) {
    return (statusCode == 401 || statusCode == 403) && body.contains(scope);
  }
}
