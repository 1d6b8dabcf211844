package com.scholary.metadata.writer.qa;

import com.scholary.metadata.writer.job.LinkMode;
import com.scholary.metadata.writer.link.ValidatedLink;
import java.util.List;
import java.util.Locale;

/** A Watch Next section is only allowed when links were provided and at least one is usable. */
public class WatchNextRule implements QaRule {

  private static final String HEADING_PREFIX = "watch next";

  @Override
  public void evaluate(QaDocument document, List<String> violations) {
    boolean hasWatchNext =
        document.lines().stream()
            .anyMatch(line -> line.strip().toLowerCase(Locale.ROOT).startsWith(HEADING_PREFIX));
    if (!hasWatchNext) {
      return;
    }

    if (document.linkMode() != LinkMode.PROVIDED) {
      violations.add("Watch Next present but links were not provided.");
      return;
    }
    long usable = document.validatedLinks().stream().filter(ValidatedLink::ok).count();
    if (usable == 0) {
      violations.add("Watch Next present but no valid links remained.");
    }
  }
}
