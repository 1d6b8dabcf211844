package com.scholary.metadata.writer.api;

import com.scholary.metadata.writer.job.JobStage;
import com.scholary.metadata.writer.job.MetadataJob;
import java.util.List;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a job. {@code metadata} and the QA fields are filled once the job
 * is done; {@code qaPass} stays null until QA has run.
 */
public record JobStatusResponse(
    String jobId,
    JobStage stage,
    String stageLabel,
    int progress,
    boolean done,
    String error,
    String transcript,
    String metadata,
    List<String> qaIssues,
    Boolean qaPass) {

  public static JobStatusResponse from(MetadataJob job) {
    return new JobStatusResponse(
        job.jobId(),
        job.stage(),
        job.stage().label(),
        job.progress(),
        job.done(),
        job.error(),
        job.transcript(),
        job.metadata(),
        job.qaIssues(),
        job.qaPass());
  }
}
