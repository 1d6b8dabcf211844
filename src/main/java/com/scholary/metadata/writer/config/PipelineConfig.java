package com.scholary.metadata.writer.config;

import com.scholary.metadata.writer.audio.FfmpegProperties;
import com.scholary.metadata.writer.generation.GenerationProperties;
import com.scholary.metadata.writer.link.LinkValidationProperties;
import com.scholary.metadata.writer.whisper.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the pipeline collaborators.
 *
 * <p>Enables the properties records to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  JobProperties.class,
  FfmpegProperties.class,
  WhisperProperties.class,
  LinkValidationProperties.class,
  GenerationProperties.class
})
public class PipelineConfig {}
