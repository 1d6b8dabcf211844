package com.scholary.metadata.writer.generation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered attempt plan for one generation.
 *
 * <p>The plan runs in two passes over the same model list: first every model on {@link
 * GenerationProtocol#RESPONSES}, then every model on {@link GenerationProtocol#CHAT_COMPLETIONS}.
 * Two rules shape how the plan is walked:
 *
 * <ul>
 *   <li>A responses failure caused by a missing {@value #RESPONSES_WRITE_SCOPE} scope abandons the
 *       rest of the first pass, since every model would fail the same way with that credential.
 *   <li>The responses protocol accepts any output, the chat protocol only non-blank output.
 * </ul>
 */
public final class ModelFallbackPolicy {

  static final String RESPONSES_WRITE_SCOPE = "api.responses.write";

  private final List<String> models;

  private ModelFallbackPolicy(List<String> models) {
    this.models = models;
  }

  /**
   * Build the policy from the configured models.
   *
   * @param primary the preferred model
   * @param fallbacks further models in order; blanks, repeats and the primary are dropped
   */
  public static ModelFallbackPolicy of(String primary, List<String> fallbacks) {
    Set<String> ordered = new LinkedHashSet<>();
    if (primary != null && !primary.isBlank()) {
      ordered.add(primary.strip());
    }
    if (fallbacks != null) {
      for (String fallback : fallbacks) {
        if (fallback != null && !fallback.isBlank()) {
          ordered.add(fallback.strip());
        }
      }
    }
    if (ordered.isEmpty()) {
      throw new IllegalArgumentException("At least one model must be configured");
    }
    return new ModelFallbackPolicy(List.copyOf(ordered));
  }

  public List<String> models() {
    return models;
  }

  /** Every attempt of both passes, in the order they are tried. */
  public List<GenerationAttempt> attempts() {
    List<GenerationAttempt> attempts = new ArrayList<>();
    for (GenerationProtocol protocol : GenerationProtocol.values()) {
      for (String model : models) {
        attempts.add(new GenerationAttempt(model, protocol));
      }
    }
    return Collections.unmodifiableList(attempts);
  }

  /** True if this failure makes the remaining attempts on the same protocol pointless. */
  public boolean abandonsProtocol(GenerationAttempt attempt, RuntimeException failure) {
    if (attempt.protocol() != GenerationProtocol.RESPONSES) {
      return false;
    }
    if (failure instanceof GenerationTransportException) {
      return ((GenerationTransportException) failure).isMissingScope(RESPONSES_WRITE_SCOPE);
    }
    String message = failure.getMessage();
    return message != null && message.contains(RESPONSES_WRITE_SCOPE);
  }

  /** True if the output of a successful call ends the generation. */
  public boolean acceptsOutput(GenerationAttempt attempt, String output) {
    if (attempt.protocol() == GenerationProtocol.RESPONSES) {
      return true;
    }
    return output != null && !output.isBlank();
  }
}
