package com.scholary.metadata.writer.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the faster-whisper transcription service.
 *
 * <p>This handles the low-level HTTP communication: building the multipart request, sending the
 * extracted audio and parsing the segment list.
 *
 * <p>No retries here. A failed transcription fails the job and the user resubmits.
 */
@Component
public class WhisperClient implements TranscriptionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;
  private final AtomicBoolean loaded = new AtomicBoolean(false);

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  /**
   * Wait for the service to report healthy.
   *
   * <p>The service loads its model on first use, so the first health call of a process can take a
   * while. Later calls return at once.
   */
  @Override
  public void load() {
    if (loaded.get()) {
      return;
    }

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/health"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .GET()
            .build();
    try {
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        throw new WhisperException(
            String.format(
                "Whisper service not ready: status %d: %s",
                response.statusCode(), response.body()));
      }
      loaded.set(true);
      LOGGER.info("Whisper service ready");
    } catch (IOException e) {
      throw new WhisperException("Whisper service unreachable: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WhisperException("Whisper readiness check interrupted", e);
    }
  }

  /**
   * Transcribe an audio file.
   *
   * <p>Sends the audio file to the Whisper API as multipart/form-data and streams the segments of
   * the parsed response.
   */
  @Override
  public Stream<TranscriptSegment> transcribe(Path audioFile, String languageHint) {
    LOGGER.info("Transcribing: file={}, language={}", audioFile.getFileName(), languageHint);

    try {
      String boundary = UUID.randomUUID().toString();
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "multipart/form-data; boundary=" + boundary)
              .POST(buildMultipartBody(audioFile, languageHint, boundary))
              .build();

      LOGGER.debug("Sending transcription request to {}", request.uri());

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() != 200) {
        throw new WhisperException(
            String.format(
                "Whisper API returned status %d: %s", response.statusCode(), response.body()));
      }

      WhisperResponse whisperResponse =
          objectMapper.readValue(response.body(), WhisperResponse.class);

      LOGGER.info(
          "Transcription successful: {} segments, language={}",
          whisperResponse.segments().size(),
          whisperResponse.language());

      return whisperResponse.segments().stream();

    } catch (IOException e) {
      throw new WhisperException("Transcription request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WhisperException("Transcription interrupted", e);
    }
  }

  /**
   * Build a multipart/form-data body for the transcription request.
   *
   * <p>Java's HttpClient has no multipart support, so the format is assembled by hand:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="audio.wav"
   * Content-Type: audio/wav
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="language"
   *
   * en
   * ...
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(Path audioFile, String languageHint, String boundary)
      throws IOException {

    String filename = audioFile.getFileName().toString();

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    sb.append("Content-Type: audio/wav\r\n\r\n");

    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    appendField(sb, boundary, "language", languageHint);
    appendField(sb, boundary, "beamSize", String.valueOf(properties.beamSize()));
    appendField(sb, boundary, "vadFilter", String.valueOf(properties.vadFilter()));
    sb.append("--").append(boundary).append("--\r\n");

    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    // The audio is streamed from disk; long recordings do not fit in memory twice.
    return BodyPublishers.concat(
        BodyPublishers.ofByteArray(prefix),
        BodyPublishers.ofFile(audioFile),
        BodyPublishers.ofByteArray(suffix));
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }
}
