package com.scholary.metadata.writer.link;

/**
 * Verdict on one submitted URL.
 *
 * <p>{@code title} and {@code reason} are empty strings when absent, which is also how they are
 * serialized into the generation payload.
 */
public record ValidatedLink(String url, boolean ok, String title, String reason) {

  public ValidatedLink {
    title = title == null ? "" : title;
    reason = reason == null ? "" : reason;
  }

  public static ValidatedLink usable(String url, String title) {
    return new ValidatedLink(url, true, title, "");
  }

  public static ValidatedLink rejected(String url, String reason) {
    return new ValidatedLink(url, false, "", reason);
  }
}
