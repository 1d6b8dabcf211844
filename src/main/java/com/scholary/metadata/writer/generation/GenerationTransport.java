package com.scholary.metadata.writer.generation;

/**
 * Low-level access to the text-generation service.
 *
 * <p>One call per attempt, no retries; retrying across models is {@link MetadataGenerator}'s job.
 */
public interface GenerationTransport {

  /**
   * Run one attempt.
   *
   * @return the generated text, possibly empty
   * @throws GenerationTransportException if the service rejects the call or cannot be reached
   */
  String complete(GenerationAttempt attempt, GenerationRequest request);
}
