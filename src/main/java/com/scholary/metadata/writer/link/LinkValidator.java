package com.scholary.metadata.writer.link;

import com.scholary.metadata.writer.logging.StructuredLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Fetches submitted links and decides which ones may be recommended.
 *
 * <p>Links are fetched one after another. A link is usable when it answers 200 and the page does
 * not carry one of the configured unavailable markers. Failures of any single link end up in its
 * {@link ValidatedLink#reason()}; they never abort the rest of the list.
 */
@Component
public class LinkValidator {

  private static final Logger LOGGER = LoggerFactory.getLogger(LinkValidator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String UNAVAILABLE_REASON = "Unavailable/private";

  private static final Pattern META_PATTERN = Pattern.compile("(?i)<meta\\s+[^>]*>");
  private static final Pattern ATTR_PATTERN =
      Pattern.compile("(?i)([a-z0-9:-]+)\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)')");

  private final HttpClient httpClient;
  private final LinkValidationProperties properties;
  private final List<String> markers;

  public LinkValidator(LinkValidationProperties properties) {
    this.properties = properties;
    this.markers =
        properties.unavailableMarkers().stream()
            .map(marker -> marker.toLowerCase(Locale.ROOT))
            .toList();
    // Follows every redirect, https to http included.
    this.httpClient =
        HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.ALWAYS)
            .connectTimeout(Duration.ofSeconds(properties.timeoutSeconds()))
            .build();
  }

  /**
   * Validate each URL in order.
   *
   * @param urls the URLs to check; may be empty, in which case nothing is fetched
   * @return one verdict per URL, in input order
   */
  public List<ValidatedLink> validate(List<String> urls) {
    List<ValidatedLink> results = new ArrayList<>();
    if (urls == null || urls.isEmpty()) {
      return results;
    }

    LOGGER.info("Validating {} links", urls.size());
    for (String url : urls) {
      ValidatedLink link = validateOne(url);
      structuredLogger.logLinkValidated(url, link.ok(), link.reason());
      results.add(link);
    }
    return results;
  }

  HttpClient.Redirect redirectPolicy() {
    return httpClient.followRedirects();
  }

  private ValidatedLink validateOne(String url) {
    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(url))
              .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
              .header("User-Agent", properties.userAgent())
              .GET()
              .build();

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() != 200) {
        return ValidatedLink.rejected(url, "HTTP " + response.statusCode());
      }

      String body = response.body() == null ? "" : response.body();
      String lower = body.toLowerCase(Locale.ROOT);
      for (String marker : markers) {
        if (lower.contains(marker)) {
          return ValidatedLink.rejected(url, UNAVAILABLE_REASON);
        }
      }
      return ValidatedLink.usable(url, extractTitle(body));

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ValidatedLink.rejected(url, describe(e));
    } catch (IOException | IllegalArgumentException e) {
      return ValidatedLink.rejected(url, describe(e));
    }
  }

  /** Best-effort og:title lookup; empty when the page has none. */
  static String extractTitle(String html) {
    Matcher matcher = META_PATTERN.matcher(html);
    while (matcher.find()) {
      Matcher attrMatcher = ATTR_PATTERN.matcher(matcher.group());
      String property = null;
      String content = null;
      while (attrMatcher.find()) {
        String name = attrMatcher.group(1).toLowerCase(Locale.ROOT);
        String value = attrMatcher.group(2) != null ? attrMatcher.group(2) : attrMatcher.group(3);
        if ("property".equals(name) || "name".equals(name)) {
          property = value;
        } else if ("content".equals(name)) {
          content = value;
        }
      }
      if ("og:title".equalsIgnoreCase(property) && content != null && !content.isBlank()) {
        return HtmlUtils.htmlUnescape(content.strip());
      }
    }
    return "";
  }

  private static String describe(Exception e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }
}
