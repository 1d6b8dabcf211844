package com.scholary.metadata.writer.api;

import com.scholary.metadata.writer.audio.AudioExtractor;
import com.scholary.metadata.writer.config.JobProperties;
import com.scholary.metadata.writer.generation.GenerationProperties;
import com.scholary.metadata.writer.job.LinkMode;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

/**
 * Checks a submission before a job is created.
 *
 * <p>Environment problems (missing ffmpeg, missing API key) are reported before problems with the
 * upload itself.
 */
@Component
public class SubmissionValidator {

  static final String FFMPEG_MISSING =
      "ffmpeg/ffprobe not found. Install: sudo apt update && sudo apt install -y ffmpeg";
  static final String API_KEY_MISSING =
      "OPENAI_API_KEY missing. Set it in the service configuration.";

  private final AudioExtractor audioExtractor;
  private final GenerationProperties generationProperties;
  private final Set<String> allowedExtensions;

  public SubmissionValidator(
      AudioExtractor audioExtractor,
      GenerationProperties generationProperties,
      JobProperties jobProperties) {
    this.audioExtractor = audioExtractor;
    this.generationProperties = generationProperties;
    this.allowedExtensions =
        jobProperties.allowedExtensions().stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /**
   * Validate a submission.
   *
   * @return the parsed link mode
   * @throws ValidationException describing the first problem found
   */
  public LinkMode validate(MultipartFile file, String linkMode) {
    if (!audioExtractor.isAvailable()) {
      throw new ValidationException(FFMPEG_MISSING);
    }
    if (!generationProperties.hasApiKey()) {
      throw new ValidationException(API_KEY_MISSING);
    }
    if (file == null || file.isEmpty()) {
      throw new ValidationException("No file uploaded");
    }
    String filename = file.getOriginalFilename();
    if (filename == null || filename.isBlank()) {
      throw new ValidationException("Empty filename");
    }

    String extension = extensionOf(filename);
    if (!allowedExtensions.contains(extension)) {
      String allowed =
          allowedExtensions.stream().map(ext -> ext.substring(1)).collect(Collectors.joining(", "));
      throw new ValidationException(
          "Unsupported file type: " + extension + ". Use " + allowed + ".");
    }

    try {
      return LinkMode.fromValue(linkMode);
    } catch (IllegalArgumentException e) {
      throw new ValidationException(e.getMessage());
    }
  }

  /** Lower-case extension including the dot, or empty if there is none. */
  static String extensionOf(String filename) {
    String name = filename.replace('\\', '/');
    name = name.substring(name.lastIndexOf('/') + 1);
    int dot = name.lastIndexOf('.');
    return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
  }
}
