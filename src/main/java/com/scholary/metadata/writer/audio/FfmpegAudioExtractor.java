package com.scholary.metadata.writer.audio;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs ffmpeg and ffprobe as child processes.
 *
 * <p>Extraction is fail-fast: a non-zero exit fails the job with ffmpeg's stderr as the message.
 * Probing is lenient and reports 0 when the duration cannot be read; the only consequence is that
 * transcription progress does not advance.
 */
@Component
public class FfmpegAudioExtractor implements AudioExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioExtractor.class);

  private final FfmpegProperties properties;

  public FfmpegAudioExtractor(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public void extract(Path source, Path destination) {
    // -vn: drop video, -ac/-ar: channels and sample rate, -c:a: PCM codec
    List<String> command =
        List.of(
            properties.ffmpegPath(),
            "-y",
            "-i",
            source.toString(),
            "-vn",
            "-ac",
            String.valueOf(properties.channels()),
            "-ar",
            String.valueOf(properties.sampleRate()),
            "-c:a",
            properties.audioCodec(),
            destination.toString());

    LOGGER.info("Extracting audio: source={}, destination={}", source.getFileName(), destination);
    LOGGER.debug("Executing: {}", String.join(" ", command));

    ProcessResult result;
    try {
      result = run(command, true);
    } catch (IOException e) {
      throw new AudioExtractionException("Failed to run ffmpeg: " + e.getMessage(), e);
    }

    if (result.exitCode() != 0) {
      String stderr = result.output().strip();
      throw new AudioExtractionException(stderr.isEmpty() ? "Command failed" : stderr);
    }
  }

  @Override
  public double probeDurationSeconds(Path audioFile) {
    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v",
            "error",
            "-show_entries",
            "format=duration",
            "-of",
            "default=noprint_wrappers=1:nokey=1",
            audioFile.toString());
    try {
      ProcessResult result = run(command, false);
      if (result.exitCode() != 0) {
        LOGGER.warn("ffprobe exited with code {} for {}", result.exitCode(), audioFile);
        return 0.0;
      }
      return Double.parseDouble(result.output().strip());
    } catch (IOException | NumberFormatException e) {
      LOGGER.warn("Could not read duration of {}: {}", audioFile, e.getMessage());
      return 0.0;
    }
  }

  @Override
  public Optional<Path> extractorLocation() {
    return locate(properties.ffmpegPath());
  }

  @Override
  public Optional<Path> probeLocation() {
    return locate(properties.ffprobePath());
  }

  /**
   * Run a command and collect one of its output streams. The other one is discarded.
   *
   * @param collectStderr true to collect stderr, false for stdout
   */
  private ProcessResult run(List<String> command, boolean collectStderr) throws IOException {
    ProcessBuilder builder = new ProcessBuilder(command);
    if (collectStderr) {
      builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
    } else {
      builder.redirectError(ProcessBuilder.Redirect.DISCARD);
    }

    Process process = builder.start();
    String output;
    try (InputStream stream =
        collectStderr ? process.getErrorStream() : process.getInputStream()) {
      output = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    }

    try {
      return new ProcessResult(process.waitFor(), output);
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while waiting for " + command.get(0), e);
    }
  }

  static Optional<Path> locate(String binary) {
    Path candidate = Paths.get(binary);
    if (candidate.isAbsolute() || binary.contains(File.separator)) {
      return Files.isExecutable(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    String path = System.getenv("PATH");
    if (path == null || path.isBlank()) {
      return Optional.empty();
    }
    for (String dir : path.split(File.pathSeparator)) {
      if (dir.isBlank()) {
        continue;
      }
      Path resolved = Paths.get(dir).resolve(binary);
      if (Files.isRegularFile(resolved) && Files.isExecutable(resolved)) {
        return Optional.of(resolved);
      }
    }
    return Optional.empty();
  }

  private record ProcessResult(int exitCode, String output) {}
}
