package com.scholary.metadata.writer.generation;

/** The two call protocols of the generation service, in order of preference. */
public enum GenerationProtocol {
  RESPONSES("responses", "/v1/responses"),
  CHAT_COMPLETIONS("chat.completions", "/v1/chat/completions");

  private final String label;
  private final String path;

  GenerationProtocol(String label, String path) {
    this.label = label;
    this.path = path;
  }

  public String label() {
    return label;
  }

  public String path() {
    return path;
  }
}
