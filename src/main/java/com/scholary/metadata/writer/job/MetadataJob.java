package com.scholary.metadata.writer.job;

import java.util.List;

/**
 * Snapshot of one metadata job.
 *
 * <p>Snapshots are immutable; the orchestrator derives a new one for every change and hands it to
 * {@link JobStore#update}. {@code qaPass} is {@code null} until the QA check has run.
 */
public record MetadataJob(
    String jobId,
    JobStage stage,
    int progress,
    boolean done,
    String error,
    String transcript,
    String metadata,
    List<String> qaIssues,
    Boolean qaPass) {

  public MetadataJob {
    qaIssues = qaIssues == null ? List.of() : List.copyOf(qaIssues);
    transcript = transcript == null ? "" : transcript;
    metadata = metadata == null ? "" : metadata;
  }

  /** A freshly submitted job. */
  public static MetadataJob queued(String jobId) {
    return new MetadataJob(
        jobId, JobStage.QUEUED, JobStage.QUEUED.progress(), false, null, "", "", List.of(), null);
  }

  /** Enter a non-terminal stage at its nominal progress. */
  public MetadataJob enter(JobStage next) {
    return new MetadataJob(
        jobId, next, next.progress(), false, error, transcript, metadata, qaIssues, qaPass);
  }

  public MetadataJob withProgress(int value) {
    return new MetadataJob(
        jobId, stage, value, done, error, transcript, metadata, qaIssues, qaPass);
  }

  public MetadataJob withTranscript(String value) {
    return new MetadataJob(jobId, stage, progress, done, error, value, metadata, qaIssues, qaPass);
  }

  public MetadataJob withQaResult(List<String> issues) {
    return new MetadataJob(
        jobId, stage, progress, done, error, transcript, metadata, issues, issues.isEmpty());
  }

  public MetadataJob completed(String finalMetadata) {
    return new MetadataJob(
        jobId, JobStage.COMPLETED, 100, true, null, transcript, finalMetadata, qaIssues, qaPass);
  }

  public MetadataJob hardStopped(String message) {
    return new MetadataJob(
        jobId, JobStage.HARD_STOPPED, 100, true, null, "", message, List.of(), Boolean.TRUE);
  }

  public MetadataJob failed(String description) {
    return new MetadataJob(
        jobId, JobStage.FAILED, 100, true, description, transcript, metadata, qaIssues, qaPass);
  }
}
