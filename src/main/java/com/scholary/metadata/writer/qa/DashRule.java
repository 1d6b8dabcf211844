package com.scholary.metadata.writer.qa;

import java.util.List;

/** Em dashes and en dashes are banned anywhere in the output. */
public class DashRule implements QaRule {

  private static final String EM_DASH = "—";
  private static final String EN_DASH = "–";

  @Override
  public void evaluate(QaDocument document, List<String> violations) {
    if (document.text().contains(EM_DASH) || document.text().contains(EN_DASH)) {
      violations.add("Contains an em dash/en dash (" + EM_DASH + "/" + EN_DASH + ").");
    }
  }
}
