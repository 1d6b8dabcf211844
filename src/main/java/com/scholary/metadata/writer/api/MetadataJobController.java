package com.scholary.metadata.writer.api;

import com.scholary.metadata.writer.audio.AudioExtractor;
import com.scholary.metadata.writer.config.JobProperties;
import com.scholary.metadata.writer.generation.GenerationProperties;
import com.scholary.metadata.writer.job.JobStore;
import com.scholary.metadata.writer.job.LinkMode;
import com.scholary.metadata.writer.service.MetadataJobOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for metadata jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting an upload (returns a job ID immediately)
 *   <li>Job status polling
 *   <li>Checking the native tools and generation settings
 * </ul>
 */
@RestController
@Tag(name = "Metadata jobs", description = "Video to publishing metadata API")
public class MetadataJobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataJobController.class);

  private final MetadataJobOrchestrator orchestrator;
  private final SubmissionValidator submissionValidator;
  private final AudioExtractor audioExtractor;
  private final GenerationProperties generationProperties;
  private final JobStore jobStore;
  private final Path uploadDir;

  public MetadataJobController(
      MetadataJobOrchestrator orchestrator,
      SubmissionValidator submissionValidator,
      AudioExtractor audioExtractor,
      GenerationProperties generationProperties,
      JobStore jobStore,
      JobProperties jobProperties) {
    this.orchestrator = orchestrator;
    this.submissionValidator = submissionValidator;
    this.audioExtractor = audioExtractor;
    this.generationProperties = generationProperties;
    this.jobStore = jobStore;
    this.uploadDir = Paths.get(jobProperties.uploadDir());

    try {
      Files.createDirectories(this.uploadDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create upload directory: " + uploadDir, e);
    }
  }

  /** Start a metadata job for an uploaded video or audio file. */
  @PostMapping(value = "/api/jobs", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Submit upload",
      description = "Validate the upload, start a metadata job and return its ID for polling")
  public ResponseEntity<JobSubmittedResponse> submit(
      @RequestParam(value = "file", required = false) MultipartFile file,
      @RequestParam(value = "linkMode", defaultValue = "checked_no_links") String linkMode,
      @RequestParam(value = "links", defaultValue = "") String links)
      throws IOException {

    LinkMode mode = submissionValidator.validate(file, linkMode);

    String extension = SubmissionValidator.extensionOf(file.getOriginalFilename());
    Path saved = uploadDir.resolve(UUID.randomUUID() + extension);
    file.transferTo(saved);

    String jobId = orchestrator.submit(saved, mode, links);
    LOGGER.info(
        "Accepted upload: jobId={}, file={}, bytes={}",
        jobId,
        file.getOriginalFilename(),
        file.getSize());

    return ResponseEntity.accepted().body(new JobSubmittedResponse(jobId));
  }

  /** Current state of a job; once done it includes the metadata and QA result. */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Poll the state of a metadata job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return ResponseEntity.ok(JobStatusResponse.from(orchestrator.poll(id)));
  }

  @GetMapping("/api/health")
  @Operation(summary = "Health", description = "Native tool availability and generation settings")
  public ResponseEntity<HealthResponse> health() {
    String ffmpegPath = audioExtractor.extractorLocation().map(Path::toString).orElse("");
    String ffprobePath = audioExtractor.probeLocation().map(Path::toString).orElse("");
    return ResponseEntity.ok(
        new HealthResponse(
            !ffmpegPath.isEmpty(),
            !ffprobePath.isEmpty(),
            ffmpegPath,
            ffprobePath,
            generationProperties.hasApiKey(),
            generationProperties.model(),
            generationProperties.fallbackModels(),
            generationProperties.effectiveReasoningEffort(),
            jobStore.size()));
  }
}
