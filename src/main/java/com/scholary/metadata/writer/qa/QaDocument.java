package com.scholary.metadata.writer.qa;

import com.scholary.metadata.writer.job.LinkMode;
import com.scholary.metadata.writer.link.ValidatedLink;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Generated metadata prepared for the QA rules.
 *
 * @param text the full output text
 * @param lines the text split into lines, line terminators removed
 * @param linkMode the caller's link mode
 * @param validatedLinks link verdicts for the job
 */
public record QaDocument(
    String text, List<String> lines, LinkMode linkMode, List<ValidatedLink> validatedLinks) {

  public static QaDocument of(
      String text, LinkMode linkMode, List<ValidatedLink> validatedLinks) {
    String safeText = text == null ? "" : text;
    List<String> lines = safeText.lines().collect(Collectors.toList());
    return new QaDocument(
        safeText,
        List.copyOf(lines),
        linkMode,
        validatedLinks == null ? List.of() : List.copyOf(validatedLinks));
  }

  /** Lines with content, trimmed. */
  public List<String> nonBlankLines() {
    return lines.stream().map(String::strip).filter(line -> !line.isEmpty()).toList();
  }
}
