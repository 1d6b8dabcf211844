package com.scholary.metadata.writer.api;

/** Error body returned by the API. */
public record ErrorResponse(String error) {}
