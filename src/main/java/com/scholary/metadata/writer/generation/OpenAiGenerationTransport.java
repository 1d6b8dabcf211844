package com.scholary.metadata.writer.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the OpenAI responses and chat completions endpoints.
 *
 * <p>Builds the JSON bodies with Jackson and extracts the generated text from either response
 * shape. Any non-2xx answer is turned into a {@link GenerationTransportException} carrying the raw
 * error body.
 */
@Component
public class OpenAiGenerationTransport implements GenerationTransport {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiGenerationTransport.class);

  private final HttpClient httpClient;
  private final GenerationProperties properties;
  private final ObjectMapper objectMapper;

  public OpenAiGenerationTransport(GenerationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized generation client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String complete(GenerationAttempt attempt, GenerationRequest request) {
    String path = attempt.protocol().path();
    if (attempt.protocol() == GenerationProtocol.RESPONSES) {
      return responsesText(post(path, responsesBody(attempt.model(), request)));
    }
    return chatText(post(path, chatBody(attempt.model(), request)));
  }

  private ObjectNode responsesBody(String model, GenerationRequest request) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", model);
    ArrayNode input = body.putArray("input");
    input.addObject().put("role", "system").put("content", request.systemPrompt());
    input.addObject().put("role", "user").put("content", request.userPayload());
    body.putObject("reasoning").put("effort", request.reasoningEffort());
    body.put("store", false);
    return body;
  }

  private ObjectNode chatBody(String model, GenerationRequest request) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", model);
    ArrayNode messages = body.putArray("messages");
    messages.addObject().put("role", "system").put("content", request.systemPrompt());
    messages.addObject().put("role", "user").put("content", request.userPayload());
    return body;
  }

  private JsonNode post(String path, ObjectNode body) {
    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + path))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Authorization", "Bearer " + properties.apiKey())
              .header("Content-Type", "application/json")
              .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
              .build();

      LOGGER.debug("Sending generation request to {}", request.uri());

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        throw new GenerationTransportException(response.statusCode(), response.body());
      }
      return objectMapper.readTree(response.body());

    } catch (IOException e) {
      throw new GenerationTransportException("Connection error: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GenerationTransportException("Generation request interrupted", e);
    }
  }

  /** Prefer the aggregated {@code output_text}; otherwise join the message text parts. */
  static String responsesText(JsonNode root) {
    JsonNode aggregated = root.path("output_text");
    if (aggregated.isTextual()) {
      return aggregated.asText();
    }

    StringBuilder text = new StringBuilder();
    for (JsonNode item : root.path("output")) {
      for (JsonNode part : item.path("content")) {
        if ("output_text".equals(part.path("type").asText())) {
          text.append(part.path("text").asText(""));
        }
      }
    }
    return text.toString();
  }

  static String chatText(JsonNode root) {
    return root.path("choices").path(0).path("message").path("content").asText("");
  }
}
