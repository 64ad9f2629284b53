package io.b2mash.opsdesk.store;

public enum KeywordOperator {
  /** Every keyword must appear. */
  AND,
  /** At least one keyword must appear. */
  ANY;

  public static KeywordOperator parse(String value) {
    if (value == null || value.isBlank()) {
      return AND;
    }
    return "any".equalsIgnoreCase(value.trim()) || "or".equalsIgnoreCase(value.trim()) ? ANY : AND;
  }
}
