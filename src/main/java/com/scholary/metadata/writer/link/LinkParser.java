package com.scholary.metadata.writer.link;

import java.util.List;
import java.util.stream.Collectors;

/** Extracts URLs from the free-text links field: one per line, http(s) only. */
public final class LinkParser {

  private LinkParser() {}

  public static List<String> parse(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return text.lines()
        .map(String::strip)
        .filter(line -> line.startsWith("http://") || line.startsWith("https://"))
        .collect(Collectors.toList());
  }
}
