package com.scholary.metadata.writer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MetadataWriterApplication {

  public static void main(String[] args) {
    SpringApplication.run(MetadataWriterApplication.class, args);
  }
}
