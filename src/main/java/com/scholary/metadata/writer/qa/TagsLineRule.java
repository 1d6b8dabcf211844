package com.scholary.metadata.writer.qa;

import java.util.List;

/** The last non-blank line is the comma-separated tags line, at most 500 characters. */
public class TagsLineRule implements QaRule {

  static final int MAX_LENGTH = 500;

  @Override
  public void evaluate(QaDocument document, List<String> violations) {
    List<String> nonBlank = document.nonBlankLines();
    if (nonBlank.isEmpty()) {
      return;
    }

    String last = nonBlank.get(nonBlank.size() - 1);
    int length = last.codePointCount(0, last.length());
    if (!last.contains(",")) {
      violations.add("Tags line not detected (expected one comma-separated line at the end).");
    } else if (length > MAX_LENGTH) {
      violations.add(String.format("Tags line is %d chars (must be <= %d).", length, MAX_LENGTH));
    }
  }
}
