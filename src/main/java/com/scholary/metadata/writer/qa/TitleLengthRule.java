package com.scholary.metadata.writer.qa;

import java.util.List;

/**
 * The title under each label must be 60 to 75 characters.
 *
 * <p>The title is the first non-blank line after the line that holds only the label. Labels that
 * never appear on a line of their own are skipped here; {@link TitleLabelRule} reports the ones
 * missing altogether.
 */
public class TitleLengthRule implements QaRule {

  static final int MIN_LENGTH = 60;
  static final int MAX_LENGTH = 75;

  @Override
  public void evaluate(QaDocument document, List<String> violations) {
    List<String> lines = document.lines();
    for (TitleOption option : TitleOption.values()) {
      int labelIndex = indexOfStandalone(lines, option.label());
      if (labelIndex < 0) {
        continue;
      }

      int titleIndex = labelIndex + 1;
      while (titleIndex < lines.size() && lines.get(titleIndex).isBlank()) {
        titleIndex++;
      }
      if (titleIndex >= lines.size()) {
        violations.add("No title text found after " + option.label());
        continue;
      }

      String title = lines.get(titleIndex).strip();
      int length = title.codePointCount(0, title.length());
      if (length < MIN_LENGTH || length > MAX_LENGTH) {
        violations.add(
            String.format(
                "Title length %d after %s (must be %d-%d).",
                length, option.label(), MIN_LENGTH, MAX_LENGTH));
      }
    }
  }

  private static int indexOfStandalone(List<String> lines, String label) {
    for (int i = 0; i < lines.size(); i++) {
      if (lines.get(i).strip().equals(label)) {
        return i;
      }
    }
    return -1;
  }
}
