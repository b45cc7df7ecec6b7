package com.flamingo.ai.edigrammar.service.extraction;

import java.util.regex.Pattern;

/**
 * Cleans free-text descriptions taken from guideline tables.
 *
 * <p>Removes a trailing status pair such as {@code " M an..3"} or {@code " C N"} (the
 * mandatory/conditional columns bleeding into the description cell), then a trailing {@code NOT
 * USED}, then surrounding whitespace. The steps repeat until the text is stable, so the result is
 * always a fixed point.
 */
public final class DescriptionNormalizer {

  private static final Pattern TRAILING_STATUS =
      Pattern.compile("\\s+[MC]\\s+[MCN](\\s+.*)?$", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern TRAILING_NOT_USED =
      Pattern.compile("\\s+NOT\\s+USED$", Pattern.UNICODE_CHARACTER_CLASS);

  private DescriptionNormalizer() {}

  /**
   * Normalizes a description.
   *
   * @param text raw description, may be null
   * @return normalized description, empty for null or blank input
   */
  public static String normalize(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String current = text;
    while (true) {
      String next = normalizeOnce(current);
      if (next.equals(current)) {
        return next;
      }
      current = next;
    }
  }

  private static String normalizeOnce(String text) {
    String cleaned = TRAILING_STATUS.matcher(text).replaceFirst("");
    cleaned = TRAILING_NOT_USED.matcher(cleaned).replaceFirst("");
    return TableRows.trim(cleaned);
  }
}
