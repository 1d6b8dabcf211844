package com.scholary.metadata.writer.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of one log call, so the JSON encoder
 * emits them as top-level fields that can be queried in the log store.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a stage transition. */
  public void logStageEntered(String jobId, String stage, int progress) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("phase", stage);
      MDC.put("percentComplete", String.valueOf(progress));

      logger.info("Job progress: jobId={}, phase={}, progress={}%", jobId, stage, progress);
    } finally {
      clearEventFields();
    }
  }

  /** Log the verdict for one submitted link. */
  public void logLinkValidated(String url, boolean ok, String reason) {
    try {
      MDC.put("event_type", "link_validated");
      MDC.put("url", url);
      MDC.put("ok", String.valueOf(ok));
      MDC.put("reason", reason);

      logger.info("Link validated: url={}, ok={}, reason={}", url, ok, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a failed generation attempt before moving to the next one. */
  public void logGenerationAttemptFailed(
      String model, String protocol, int attempt, int totalAttempts, String message) {
    try {
      MDC.put("event_type", "generation_attempt_failed");
      MDC.put("model", model);
      MDC.put("protocol", protocol);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("totalAttempts", String.valueOf(totalAttempts));

      logger.warn(
          "Generation attempt failed: model={}, protocol={}, attempt={}/{}, message={}",
          model,
          protocol,
          attempt,
          totalAttempts,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log the attempt that produced the metadata. */
  public void logGenerationSucceeded(String model, String protocol, int attempt, int chars) {
    try {
      MDC.put("event_type", "generation_succeeded");
      MDC.put("model", model);
      MDC.put("protocol", protocol);
      MDC.put("attempt", String.valueOf(attempt));

      logger.info(
          "Generation succeeded: model={}, protocol={}, attempt={}, chars={}",
          model,
          protocol,
          attempt,
          chars);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job reaching a successful terminal stage. */
  public void logJobFinished(
      String jobId, String stage, Boolean qaPass, int qaIssues, long tookMs) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("phase", stage);
      MDC.put("qaPass", String.valueOf(qaPass));
      MDC.put("qaIssues", String.valueOf(qaIssues));
      MDC.put("tookMs", String.valueOf(tookMs));

      logger.info(
          "Job finished: jobId={}, phase={}, qaPass={}, qaIssues={}, took={}ms",
          jobId,
          stage,
          qaPass,
          qaIssues,
          tookMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job failing in some stage. */
  public void logJobFailed(String jobId, String stage, String errorType, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("phase", stage);
      MDC.put("errorType", errorType);

      logger.error(
          "Job failed: jobId={}, phase={}, error={}, message={}", jobId, stage, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String fileName, String linkMode) {
    MDC.put("jobId", jobId);
    MDC.put("fileName", fileName);
    MDC.put("linkMode", linkMode);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("fileName");
    MDC.remove("linkMode");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("phase");
    MDC.remove("percentComplete");
    MDC.remove("url");
    MDC.remove("ok");
    MDC.remove("reason");
    MDC.remove("model");
    MDC.remove("protocol");
    MDC.remove("attempt");
    MDC.remove("totalAttempts");
    MDC.remove("qaPass");
    MDC.remove("qaIssues");
    MDC.remove("tookMs");
    MDC.remove("errorType");
  }
}
