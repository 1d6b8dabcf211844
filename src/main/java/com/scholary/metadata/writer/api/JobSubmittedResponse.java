package com.scholary.metadata.writer.api;

/** Response for a job submission: the id to poll. */
public record JobSubmittedResponse(String jobId) {}
