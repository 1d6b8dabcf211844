package com.scholary.metadata.writer.generation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the generation service.
 *
 * <p>The API key may be blank at startup; submissions are refused until it is set.
 */
@ConfigurationProperties(prefix = "generation")
@Validated
public record GenerationProperties(
    String apiKey,
    @NotBlank String baseUrl,
    @NotBlank String model,
    List<String> fallbackModels,
    String reasoningEffort,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @NotBlank String systemPromptLocation) {

  private static final Set<String> EFFORTS = Set.of("low", "medium", "high");

  public GenerationProperties {
    fallbackModels = fallbackModels == null ? List.of() : List.copyOf(fallbackModels);
  }

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }

  /** The configured effort, or {@code high} when unset or unknown. */
  public String effectiveReasoningEffort() {
    String effort =
        reasoningEffort == null ? "" : reasoningEffort.strip().toLowerCase(Locale.ROOT);
    return EFFORTS.contains(effort) ? effort : "high";
  }

  public ModelFallbackPolicy fallbackPolicy() {
    return ModelFallbackPolicy.of(model, fallbackModels);
  }
}
