package com.scholary.metadata.writer.qa;

import java.util.List;

/**
 * One independent check over generated metadata.
 *
 * <p>Rules are pure: they read the document and append zero or more violation descriptions.
 */
public interface QaRule {

  void evaluate(QaDocument document, List<String> violations);
}
