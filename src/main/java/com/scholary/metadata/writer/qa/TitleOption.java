package com.scholary.metadata.writer.qa;

/** The three title options every output must offer, with their exact labels. */
public enum TitleOption {
  HIGHEST_SEO_REACH("Option 1 (Highest SEO Reach)"),
  PARENT_HIGH_INTENT("Option 2 (Parent High-Intent)"),
  AUTHORITY_EXPLAINER("Option 3 (Authority Explainer)");

  private final String label;

  TitleOption(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
