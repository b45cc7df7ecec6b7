package com.flamingo.ai.edigrammar.service.extraction;

import java.util.regex.Pattern;

/**
 * Decides whether a usage cell on a follow-up row continues the usage text of the element above.
 *
 * <p>The two conventions use different rules and must stay distinct: merging them would change
 * which follow-up lines get folded in for one of the formats.
 */
public enum ContinuationRule {

  /** Coded-value definition only, e.g. {@code ZZZ = Mutually defined} or {@code '123' = Other}. */
  CODED_VALUE(codedValue()),

  /** Coded-value definition, or a phrase starting with two capitalized words. */
  CODED_VALUE_OR_PHRASE(
      codedValue(), Pattern.compile("^[A-Z][a-z]+\\s+[A-Z]", Pattern.UNICODE_CHARACTER_CLASS));

  private final Pattern[] patterns;

  ContinuationRule(Pattern... patterns) {
    this.patterns = patterns;
  }

  public boolean continues(String usage) {
    if (usage == null || usage.isBlank()) {
      return false;
    }
    String text = TableRows.trim(usage);
    for (Pattern pattern : patterns) {
      if (pattern.matcher(text).find()) {
        return true;
      }
    }
    return false;
  }

  private static Pattern codedValue() {
    return Pattern.compile("^['\"]?[A-Z0-9]+['\"]?\\s*=", Pattern.UNICODE_CHARACTER_CLASS);
  }
}
