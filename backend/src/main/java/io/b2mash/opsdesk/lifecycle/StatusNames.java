package io.b2mash.opsdesk.lifecycle;

import java.util.Locale;

/** Lower-case wire names of the lifecycle status enums, e.g. {@code in_progress}. */
public final class StatusNames {

  private StatusNames() {}

  public static String wireName(Enum<?> status) {
    return status.name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a wire name case-insensitively. Returns null for a blank value so bean validation
   * reports the missing field.
   *
   * @throws IllegalArgumentException if {@code value} names no constant of {@code type}
   */
  public static <E extends Enum<E>> E parse(Class<E> type, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    var name = value.trim().toUpperCase(Locale.ROOT);
    for (var constant : type.getEnumConstants()) {
      if (constant.name().equals(name)) {
        return constant;
      }
    }
    throw new IllegalArgumentException(
        "Unknown " + type.getSimpleName() + " '" + value.trim() + "'");
  }
}
