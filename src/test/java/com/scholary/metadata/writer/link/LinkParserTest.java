package com.scholary.metadata.writer.link;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LinkParserTest {

  @Test
  void parse_shouldKeepHttpLinesInOrder() {
    String text = "https://youtu.be/a\n  http://example.com/b  \r\nhttps://youtu.be/c";

    assertThat(LinkParser.parse(text))
        .containsExactly("https://youtu.be/a", "http://example.com/b", "https://youtu.be/c");
  }

  @Test
  void parse_shouldDropBlankAndNonHttpLines() {
    String text = "\n\nwatch this: https://youtu.be/a\nftp://example.com\nyoutu.be/b\n";

    assertThat(LinkParser.parse(text)).isEmpty();
  }

  @Test
  void parse_shouldReturnEmptyForNullOrBlank() {
    assertThat(LinkParser.parse(null)).isEmpty();
    assertThat(LinkParser.parse("   ")).isEmpty();
  }
}
