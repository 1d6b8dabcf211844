package com.scholary.metadata.writer.job;

/** Thrown when a job id is polled that the store has never seen. */
public class JobNotFoundException extends RuntimeException {

  private final String jobId;

  public JobNotFoundException(String jobId) {
    super("Unknown job id: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
