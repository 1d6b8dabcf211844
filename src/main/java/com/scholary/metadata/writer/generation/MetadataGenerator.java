package com.scholary.metadata.writer.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.metadata.writer.job.LinkMode;
import com.scholary.metadata.writer.link.ValidatedLink;
import com.scholary.metadata.writer.logging.StructuredLogger;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Produces the metadata text for one job.
 *
 * <p>Walks the attempts of a {@link ModelFallbackPolicy} until one yields acceptable output. Every
 * failure is logged and remembered; only the last one is reported if nothing succeeds.
 */
@Service
public class MetadataGenerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataGenerator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final GenerationTransport transport;
  private final GenerationProperties properties;
  private final SystemPrompt systemPrompt;
  private final ObjectMapper objectMapper;

  public MetadataGenerator(
      GenerationTransport transport,
      GenerationProperties properties,
      SystemPrompt systemPrompt,
      ObjectMapper objectMapper) {
    this.transport = transport;
    this.properties = properties;
    this.systemPrompt = systemPrompt;
    this.objectMapper = objectMapper;
  }

  /**
   * Generate metadata.
   *
   * @param transcript timestamped transcript lines
   * @param linkMode the caller's link mode
   * @param validatedLinks link verdicts, empty when links were not provided
   * @return the generated text, trimmed
   * @throws GenerationFailedException if every attempt fails
   * @throws IllegalStateException if no API key is configured
   */
  public String generate(String transcript, LinkMode linkMode, List<ValidatedLink> validatedLinks) {
    if (!properties.hasApiKey()) {
      throw new IllegalStateException(
          "OPENAI_API_KEY is missing. Set it in the service configuration.");
    }

    GenerationRequest request =
        new GenerationRequest(
            systemPrompt.text(),
            buildUserPayload(transcript, linkMode, validatedLinks),
            properties.effectiveReasoningEffort());

    ModelFallbackPolicy policy = properties.fallbackPolicy();
    List<GenerationAttempt> attempts = policy.attempts();
    LOGGER.info("Generating metadata: models={}, attempts={}", policy.models(), attempts.size());

    String lastError = "";
    GenerationProtocol abandoned = null;
    int attemptNumber = 0;

    for (GenerationAttempt attempt : attempts) {
      attemptNumber++;
      if (attempt.protocol() == abandoned) {
        continue;
      }
      try {
        String raw = transport.complete(attempt, request);
        String output = raw == null ? "" : raw.strip();
        if (policy.acceptsOutput(attempt, output)) {
          structuredLogger.logGenerationSucceeded(
              attempt.model(), attempt.protocol().label(), attemptNumber, output.length());
          return output;
        }
        lastError = "Empty response from " + attempt.protocol().label() + ".";
        structuredLogger.logGenerationAttemptFailed(
            attempt.model(), attempt.protocol().label(), attemptNumber, attempts.size(), lastError);
      } catch (RuntimeException e) {
        lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        structuredLogger.logGenerationAttemptFailed(
            attempt.model(), attempt.protocol().label(), attemptNumber, attempts.size(), lastError);
        if (policy.abandonsProtocol(attempt, e)) {
          LOGGER.warn(
              "Credential lacks scope {}, skipping remaining {} attempts",
              ModelFallbackPolicy.RESPONSES_WRITE_SCOPE,
              attempt.protocol().label());
          abandoned = attempt.protocol();
        }
      }
    }

    throw new GenerationFailedException(lastError);
  }

  String buildUserPayload(
      String transcript, LinkMode linkMode, List<ValidatedLink> validatedLinks) {
    String links;
    try {
      links = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(validatedLinks);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize validated links", e);
    }
    return "LINKS_MODE: "
        + linkMode.value()
        + "\n\nVALIDATED_LINKS:\n"
        + links
        + "\n\nTRANSCRIPT:\n"
        + transcript
        + "\n";
  }
}
