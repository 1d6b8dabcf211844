package com.scholary.metadata.writer.qa;

import com.scholary.metadata.writer.job.LinkMode;
import com.scholary.metadata.writer.link.ValidatedLink;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Deterministic policy check of generated metadata.
 *
 * <p>Runs every rule in a fixed order and collects all violations; nothing short-circuits. A clean
 * result is an empty list. Violations are advisory and never fail a job.
 */
@Component
public class QaValidator {

  private final List<QaRule> rules;

  public QaValidator() {
    this(
        List.of(
            new DashRule(),
            new TitleLabelRule(),
            new TitleLengthRule(),
            new WatchNextRule(),
            new TagsLineRule(),
            new EducationTimestampRule()));
  }

  QaValidator(List<QaRule> rules) {
    this.rules = List.copyOf(rules);
  }

  public List<String> check(
      String outputText, LinkMode linkMode, List<ValidatedLink> validatedLinks) {
    QaDocument document = QaDocument.of(outputText, linkMode, validatedLinks);
    List<String> violations = new ArrayList<>();
    for (QaRule rule : rules) {
      rule.evaluate(document, violations);
    }
    return Collections.unmodifiableList(violations);
  }
}
