package com.scholary.metadata.writer.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiGenerationTransportTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final AtomicReference<String> requestBody = new AtomicReference<>();
  private final AtomicReference<String> authorization = new AtomicReference<>();

  private HttpServer server;
  private OpenAiGenerationTransport transport;
  private final GenerationRequest request =
      new GenerationRequest("system text", "user text", "medium");

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(
        "/v1/responses",
        exchange -> respond(exchange, 200, "{\"output_text\":\"from responses\"}"));
    server.createContext(
        "/v1/chat/completions",
        exchange ->
            respond(
                exchange,
                200,
                "{\"choices\":[{\"message\":"
                    + "{\"role\":\"assistant\",\"content\":\"from chat\"}}]}"));
    server.start();

    GenerationProperties properties =
        new GenerationProperties(
            "sk-test",
            "http://127.0.0.1:" + server.getAddress().getPort(),
            "gpt-5-mini",
            List.of(),
            "medium",
            5,
            5,
            "classpath:prompts/metadata-writer.txt");
    transport = new OpenAiGenerationTransport(properties, objectMapper);
  }

  @AfterEach
  void tearDown() {
    server.stop(0);
  }

  @Test
  void complete_shouldPostResponsesRequest() throws IOException {
    String text =
        transport.complete(
            new GenerationAttempt("gpt-5-mini", GenerationProtocol.RESPONSES), request);

    assertThat(text).isEqualTo("from responses");
    assertThat(authorization.get()).isEqualTo("Bearer sk-test");

    JsonNode body = objectMapper.readTree(requestBody.get());
    assertThat(body.path("model").asText()).isEqualTo("gpt-5-mini");
    assertThat(body.path("input").get(0).path("role").asText()).isEqualTo("system");
    assertThat(body.path("input").get(0).path("content").asText()).isEqualTo("system text");
    assertThat(body.path("input").get(1).path("content").asText()).isEqualTo("user text");
    assertThat(body.path("reasoning").path("effort").asText()).isEqualTo("medium");
    assertThat(body.path("store").asBoolean(true)).isFalse();
  }

  @Test
  void complete_shouldPostChatRequest() throws IOException {
    String text =
        transport.complete(
            new GenerationAttempt("gpt-4o", GenerationProtocol.CHAT_COMPLETIONS), request);

    assertThat(text).isEqualTo("from chat");
    JsonNode body = objectMapper.readTree(requestBody.get());
    assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
    assertThat(body.path("messages")).hasSize(2);
    assertThat(body.has("reasoning")).isFalse();
  }

  @Test
  void complete_shouldRaiseStatusAndBodyOnError() {
    server.removeContext("/v1/responses");
    server.createContext(
        "/v1/responses",
        exchange -> respond(exchange, 401, "{\"error\":\"Missing scopes: api.responses.write\"}"));

    assertThatThrownBy(
            () ->
                transport.complete(
                    new GenerationAttempt("gpt-5-mini", GenerationProtocol.RESPONSES), request))
        .isInstanceOf(GenerationTransportException.class)
        .hasMessageStartingWith("Error code: 401 - ")
        .satisfies(
            e ->
                assertThat(((GenerationTransportException) e).isMissingScope("api.responses.write"))
                    .isTrue());
  }

  @Test
  void responsesText_shouldJoinOutputPartsWithoutAggregate() throws IOException {
    JsonNode root =
        objectMapper.readTree(
            "{\"output\":["
                + "{\"type\":\"reasoning\",\"summary\":[]},"
                + "{\"type\":\"message\",\"content\":["
                + "{\"type\":\"output_text\",\"text\":\"Hello \"},"
                + "{\"type\":\"refusal\",\"refusal\":\"no\"},"
                + "{\"type\":\"output_text\",\"text\":\"world\"}]}]}");

    assertThat(OpenAiGenerationTransport.responsesText(root)).isEqualTo("Hello world");
  }

  @Test
  void chatText_shouldBeEmptyWhenNoChoices() throws IOException {
    assertThat(OpenAiGenerationTransport.chatText(objectMapper.readTree("{\"choices\":[]}")))
        .isEmpty();
  }

  private void respond(HttpExchange exchange, int status, String body) throws IOException {
    requestBody.set(
        new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
    authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
