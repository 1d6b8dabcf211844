package com.scholary.metadata.writer.service;

import com.scholary.metadata.writer.audio.AudioExtractor;
import com.scholary.metadata.writer.config.JobProperties;
import com.scholary.metadata.writer.generation.MetadataGenerator;
import com.scholary.metadata.writer.job.JobNotFoundException;
import com.scholary.metadata.writer.job.JobStage;
import com.scholary.metadata.writer.job.JobStore;
import com.scholary.metadata.writer.job.LinkMode;
import com.scholary.metadata.writer.job.MetadataJob;
import com.scholary.metadata.writer.link.LinkParser;
import com.scholary.metadata.writer.link.LinkValidator;
import com.scholary.metadata.writer.link.ValidatedLink;
import com.scholary.metadata.writer.logging.StructuredLogger;
import com.scholary.metadata.writer.qa.QaValidator;
import com.scholary.metadata.writer.transcript.TranscriptAssembler;
import com.scholary.metadata.writer.whisper.TranscriptSegment;
import com.scholary.metadata.writer.whisper.TranscriptionEngine;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives metadata jobs through the pipeline.
 *
 * <p>Stages, in order:
 *
 * <ol>
 *   <li>Extract the audio track with ffmpeg
 *   <li>Load the speech engine
 *   <li>Transcribe, advancing progress from 20 to 75 with the audio covered
 *   <li>Validate links (only when links were provided)
 *   <li>Generate metadata with model fallback
 *   <li>Run the QA rules
 * </ol>
 *
 * <p>A job whose link mode is {@code not_provided} stops before any of this with a fixed message.
 * Any fault fails the job with the fault's message; nothing is retried here. The uploaded file is
 * deleted however the job ends.
 *
 * <p>Each job runs on its own executor thread, which is the only writer of that job's record.
 */
@Service
public class MetadataJobOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(MetadataJobOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String HARD_STOP_MESSAGE =
      "I can see the uploaded video file.\n"
          + "Have you checked the sheet for uploaded video links?\n"
          + "Please check the reporting sheet. You can find the uploaded video links from the"
          + " reporting sheet. Use YouTube channel filters. Then copy and paste all the YouTube"
          + " links from the sheet.";

  static final String QUEUE_FULL_MESSAGE = "Too many jobs in progress. Try again later.";

  private final JobStore jobStore;
  private final AudioExtractor audioExtractor;
  private final TranscriptionEngine transcriptionEngine;
  private final LinkValidator linkValidator;
  private final MetadataGenerator metadataGenerator;
  private final QaValidator qaValidator;
  private final Executor executor;
  private final String languageHint;
  private final Path workDir;

  public MetadataJobOrchestrator(
      JobStore jobStore,
      AudioExtractor audioExtractor,
      TranscriptionEngine transcriptionEngine,
      LinkValidator linkValidator,
      MetadataGenerator metadataGenerator,
      QaValidator qaValidator,
      @Qualifier("metadataJobExecutor") Executor executor,
      JobProperties properties) {

    this.jobStore = jobStore;
    this.audioExtractor = audioExtractor;
    this.transcriptionEngine = transcriptionEngine;
    this.linkValidator = linkValidator;
    this.metadataGenerator = metadataGenerator;
    this.qaValidator = qaValidator;
    this.executor = executor;
    this.languageHint = properties.languageHint();
    this.workDir = Paths.get(properties.workDir());

    try {
      Files.createDirectories(this.workDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create work directory: " + workDir, e);
    }
  }

  /**
   * Create a job for an uploaded file and start it.
   *
   * <p>Returns as soon as the job is registered. If the executor refuses the job, the job is
   * recorded as failed right away.
   *
   * @param uploadedFile the upload, owned by the job from here on
   * @param linkMode the caller's link mode
   * @param linksText free text with one link per line
   * @return the new job id
   */
  public String submit(Path uploadedFile, LinkMode linkMode, String linksText) {
    String jobId = UUID.randomUUID().toString();
    jobStore.create(jobId);
    LOGGER.info(
        "Created metadata job: jobId={}, file={}, linkMode={}",
        jobId,
        uploadedFile.getFileName(),
        linkMode);

    try {
      executor.execute(() -> run(jobId, uploadedFile, linkMode, linksText));
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Job executor rejected job {}: {}", jobId, e.getMessage());
      jobStore.update(jobId, job -> job.failed(QUEUE_FULL_MESSAGE));
      deleteQuietly(uploadedFile);
    }
    return jobId;
  }

  /**
   * Current snapshot of a job.
   *
   * @throws JobNotFoundException if the id is unknown
   */
  public MetadataJob poll(String jobId) {
    return jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  void run(String jobId, Path uploadedFile, LinkMode linkMode, String linksText) {
    StructuredLogger.setJobContext(jobId, uploadedFile.getFileName().toString(), linkMode.value());
    long startedAt = System.currentTimeMillis();

    try {
      if (linkMode == LinkMode.NOT_PROVIDED) {
        jobStore.update(jobId, job -> job.hardStopped(HARD_STOP_MESSAGE));
        structuredLogger.logJobFinished(
            jobId, JobStage.HARD_STOPPED.name(), Boolean.TRUE, 0, elapsedSince(startedAt));
        return;
      }

      MetadataJob finished = process(jobId, uploadedFile, linkMode, linksText);
      structuredLogger.logJobFinished(
          jobId,
          finished.stage().name(),
          finished.qaPass(),
          finished.qaIssues().size(),
          elapsedSince(startedAt));

    } catch (Exception | Error e) {
      String description = describe(e);
      String stage = jobStore.findById(jobId).map(job -> job.stage().name()).orElse("UNKNOWN");
      structuredLogger.logJobFailed(jobId, stage, e.getClass().getSimpleName(), description);
      LOGGER.debug("Failure detail for job {}", jobId, e);
      jobStore.update(jobId, job -> job.failed(description));
    } finally {
      deleteQuietly(uploadedFile);
      StructuredLogger.clearJobContext();
    }
  }

  private MetadataJob process(
      String jobId, Path uploadedFile, LinkMode linkMode, String linksText) throws IOException {

    Path workspace = Files.createTempDirectory(workDir, "job-");
    try {
      enter(jobId, JobStage.EXTRACTING_AUDIO);
      Path audio = workspace.resolve("audio.wav");
      audioExtractor.extract(uploadedFile, audio);
      double durationSeconds = audioExtractor.probeDurationSeconds(audio);
      LOGGER.info("Extracted audio: duration={}s", durationSeconds);

      enter(jobId, JobStage.LOADING_TRANSCRIPTION_ENGINE);
      transcriptionEngine.load();

      enter(jobId, JobStage.TRANSCRIBING);
      String transcript = transcribe(jobId, audio, durationSeconds);
      jobStore.update(jobId, job -> job.withTranscript(transcript));

      enter(jobId, JobStage.VALIDATING_LINKS);
      List<String> urls = LinkParser.parse(linksText);
      List<ValidatedLink> validatedLinks =
          linkMode == LinkMode.PROVIDED && !urls.isEmpty()
              ? linkValidator.validate(urls)
              : List.of();

      enter(jobId, JobStage.GENERATING_METADATA);
      String metadata = metadataGenerator.generate(transcript, linkMode, validatedLinks);

      enter(jobId, JobStage.CHECKING_QA);
      List<String> issues = qaValidator.check(metadata, linkMode, validatedLinks);
      if (!issues.isEmpty()) {
        LOGGER.info("QA found {} issues: {}", issues.size(), issues);
      }
      jobStore.update(jobId, job -> job.withQaResult(issues));

      return jobStore
          .update(jobId, job -> job.completed(metadata))
          .orElseThrow(() -> new JobNotFoundException(jobId));
    } finally {
      deleteRecursively(workspace);
    }
  }

  private String transcribe(String jobId, Path audio, double durationSeconds) {
    TranscriptAssembler assembler = new TranscriptAssembler(durationSeconds);
    int segmentCount = 0;

    try (Stream<TranscriptSegment> segments = transcriptionEngine.transcribe(audio, languageHint)) {
      Iterator<TranscriptSegment> iterator = segments.iterator();
      while (iterator.hasNext()) {
        segmentCount++;
        if (assembler.append(iterator.next())) {
          int progress = assembler.progress();
          jobStore.update(jobId, job -> job.withProgress(progress));
        }
      }
    }

    String transcript = assembler.text();
    if (transcript.isEmpty()) {
      throw new EmptyTranscriptException();
    }
    LOGGER.info("Transcribed {} segments ({} chars)", segmentCount, transcript.length());
    return transcript;
  }

  private void enter(String jobId, JobStage stage) {
    jobStore.update(jobId, job -> job.enter(stage));
    structuredLogger.logStageEntered(jobId, stage.name(), stage.progress());
  }

  private static String describe(Throwable e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getName() : message;
  }

  private static long elapsedSince(long startedAt) {
    return System.currentTimeMillis() - startedAt;
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.debug("Could not delete {}: {}", file, e.getMessage());
    }
  }

  private static void deleteRecursively(Path dir) {
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(MetadataJobOrchestrator::deleteQuietly);
    } catch (IOException e) {
      LOGGER.debug("Could not clean up {}: {}", dir, e.getMessage());
    }
  }
}
