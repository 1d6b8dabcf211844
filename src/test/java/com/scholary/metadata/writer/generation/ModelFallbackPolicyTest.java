package com.scholary.metadata.writer.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ModelFallbackPolicyTest {

  private static final GenerationAttempt RESPONSES_ATTEMPT =
      new GenerationAttempt("gpt-5-mini", GenerationProtocol.RESPONSES);
  private static final GenerationAttempt CHAT_ATTEMPT =
      new GenerationAttempt("gpt-5-mini", GenerationProtocol.CHAT_COMPLETIONS);

  @Test
  void of_shouldDropBlanksAndDuplicatesKeepingOrder() {
    ModelFallbackPolicy policy =
        ModelFallbackPolicy.of(
            "gpt-5.2-thinking",
            Arrays.asList("gpt-5-mini", " ", null, "gpt-5.2-thinking", "gpt-4o"));

    assertThat(policy.models()).containsExactly("gpt-5.2-thinking", "gpt-5-mini", "gpt-4o");
  }

  @Test
  void of_shouldRejectEmptyModelList() {
    assertThatThrownBy(() -> ModelFallbackPolicy.of(" ", List.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void attempts_shouldRunResponsesPassBeforeChatPass() {
    ModelFallbackPolicy policy = ModelFallbackPolicy.of("a", List.of("b"));

    assertThat(policy.attempts())
        .containsExactly(
            new GenerationAttempt("a", GenerationProtocol.RESPONSES),
            new GenerationAttempt("b", GenerationProtocol.RESPONSES),
            new GenerationAttempt("a", GenerationProtocol.CHAT_COMPLETIONS),
            new GenerationAttempt("b", GenerationProtocol.CHAT_COMPLETIONS));
  }

  @Test
  void abandonsProtocol_shouldTriggerOnMissingResponsesScope() {
    ModelFallbackPolicy policy = ModelFallbackPolicy.of("a", List.of());
    GenerationTransportException scopeError =
        new GenerationTransportException(
            401, "{\"error\":{\"message\":\"Missing scopes: api.responses.write\"}}");

    assertThat(policy.abandonsProtocol(RESPONSES_ATTEMPT, scopeError)).isTrue();
    assertThat(policy.abandonsProtocol(CHAT_ATTEMPT, scopeError)).isFalse();
  }

  @Test
  void abandonsProtocol_shouldIgnoreOtherFailures() {
    ModelFallbackPolicy policy = ModelFallbackPolicy.of("a", List.of());

    assertThat(
            policy.abandonsProtocol(
                RESPONSES_ATTEMPT, new GenerationTransportException(500, "api.responses.write")))
        .isFalse();
    assertThat(
            policy.abandonsProtocol(
                RESPONSES_ATTEMPT, new GenerationTransportException(404, "model not found")))
        .isFalse();
  }

  @Test
  void abandonsProtocol_shouldFallBackToMessageForOtherExceptions() {
    ModelFallbackPolicy policy = ModelFallbackPolicy.of("a", List.of());

    assertThat(
            policy.abandonsProtocol(
                RESPONSES_ATTEMPT, new IllegalStateException("lacks api.responses.write")))
        .isTrue();
  }

  @Test
  void acceptsOutput_shouldRequireTextOnlyForChat() {
    ModelFallbackPolicy policy = ModelFallbackPolicy.of("a", List.of());

    assertThat(policy.acceptsOutput(RESPONSES_ATTEMPT, "")).isTrue();
    assertThat(policy.acceptsOutput(CHAT_ATTEMPT, "")).isFalse();
    assertThat(policy.acceptsOutput(CHAT_ATTEMPT, "text")).isTrue();
  }
}
