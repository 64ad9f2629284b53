package io.b2mash.opsdesk.store;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits free text into lower-case word tokens the way the search index's standard analyzer does
 * for plain words: letters, digits and underscores form a token, anything else separates tokens.
 */
public final class TextTerms {

  private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}_]+");

  private TextTerms() {}

  public static List<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    return Arrays.stream(SEPARATORS.split(text.toLowerCase(Locale.ROOT)))
        .filter(token -> !token.isEmpty())
        .toList();
  }

  /** Canonical form of a status value, shared by stored records and status filters. */
  public static String normalizeStatus(String status) {
    return status != null ? status.trim().toLowerCase(Locale.ROOT) : null;
  }
}
