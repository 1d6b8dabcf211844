package com.scholary.metadata.writer.generation;

/** One (model, protocol) pair to try. */
public record GenerationAttempt(String model, GenerationProtocol protocol) {

  @Override
  public String toString() {
    return protocol.label() + ":" + model;
  }
}
