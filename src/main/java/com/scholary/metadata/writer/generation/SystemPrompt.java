package com.scholary.metadata.writer.generation;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/** The fixed instruction text sent as the system message of every generation. */
@Component
public class SystemPrompt {

  private static final Logger LOGGER = LoggerFactory.getLogger(SystemPrompt.class);

  private final String text;

  @Autowired
  public SystemPrompt(GenerationProperties properties, ResourceLoader resourceLoader) {
    Resource resource = resourceLoader.getResource(properties.systemPromptLocation());
    try (InputStream in = resource.getInputStream()) {
      this.text = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
    } catch (IOException e) {
      throw new IllegalStateException(
          "Failed to load system prompt: " + properties.systemPromptLocation(), e);
    }
    LOGGER.info(
        "Loaded system prompt: location={}, chars={}",
        properties.systemPromptLocation(),
        text.length());
  }

  SystemPrompt(String text) {
    this.text = text;
  }

  public String text() {
    return text;
  }
}
