package com.scholary.metadata.writer.qa;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Education Problems timestamps must be strictly increasing, and there may be at most eight.
 *
 * <p>The problems follow the first line starting with "Type". Every later line of the form {@code
 * MM:SS text} counts; other lines are skipped, not treated as the end of the section.
 */
public class EducationTimestampRule implements QaRule {

  static final int MAX_PROBLEMS = 8;

  private static final Pattern TIMESTAMP_LINE = Pattern.compile("^(\\d{2}):(\\d{2})\\s+.+");

  @Override
  public void evaluate(QaDocument document, List<String> violations) {
    List<Integer> seconds = timestamps(document.lines());
    if (seconds.isEmpty()) {
      return;
    }

    for (int i = 0; i + 1 < seconds.size(); i++) {
      if (seconds.get(i) >= seconds.get(i + 1)) {
        violations.add(
            "Education Problems timestamps are not strictly increasing or contain duplicates.");
        break;
      }
    }
    if (seconds.size() > MAX_PROBLEMS) {
      violations.add(
          String.format(
              "Education Problems has %d lines (must be up to %d when justified).",
              seconds.size(), MAX_PROBLEMS));
    }
  }

  static List<Integer> timestamps(List<String> lines) {
    int typeIndex = -1;
    for (int i = 0; i < lines.size(); i++) {
      if (lines.get(i).strip().toLowerCase(Locale.ROOT).startsWith("type")) {
        typeIndex = i;
        break;
      }
    }

    List<Integer> seconds = new ArrayList<>();
    if (typeIndex < 0) {
      return seconds;
    }
    for (String line : lines.subList(typeIndex + 1, lines.size())) {
      Matcher matcher = TIMESTAMP_LINE.matcher(line.strip());
      if (matcher.matches()) {
        seconds.add(Integer.parseInt(matcher.group(1)) * 60 + Integer.parseInt(matcher.group(2)));
      }
    }
    return seconds;
  }
}
