package com.scholary.metadata.writer.qa;

import java.util.List;

/** Each title option label must appear somewhere in the output. */
public class TitleLabelRule implements QaRule {

  @Override
  public void evaluate(QaDocument document, List<String> violations) {
    for (TitleOption option : TitleOption.values()) {
      if (!document.text().contains(option.label())) {
        violations.add("Missing title label: " + option.label());
      }
    }
  }
}
