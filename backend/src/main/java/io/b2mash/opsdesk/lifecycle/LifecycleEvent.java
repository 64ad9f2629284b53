package io.b2mash.opsdesk.lifecycle;

import io.b2mash.opsdesk.exception.IllegalTransitionException;
import java.util.Set;

/**
 * One row of a state machine's transition table, implemented by the per-entity event enums.
 *
 * @param <S> the entity's status enum
 */
public interface LifecycleEvent<S extends Enum<S>> {

  /** Lower-case name used in URLs and error messages. */
  String action();

  Set<S> sources();

  S target();

  Audience audience();

  /** False for events only the server fires, such as deadline sweeps. */
  default boolean clientInvocable() {
    return true;
  }

  /**
   * Returns the status reached by firing this event from {@code current}.
   *
   * @throws IllegalTransitionException if {@code current} is not a legal source
   */
  default S fire(S current, String entityType) {
    if (!sources().contains(current)) {
      throw new IllegalTransitionException(entityType, current, action());
    }
    return target();
  }

  /**
   * Finds the client-invocable event that moves an entity from {@code current} to {@code target}.
   *
   * @throws IllegalTransitionException if no such event exists
   */
  static <S extends Enum<S>, E extends Enum<E> & LifecycleEvent<S>> E resolve(
      Class<E> eventType, S current, S target, String entityType) {
    for (var event : eventType.getEnumConstants()) {
      if (event.clientInvocable()
          && event.target() == target
          && event.sources().contains(current)) {
        return event;
      }
    }
    throw new IllegalTransitionException(
        entityType,
        current,
        "move to " + target,
        "No transition from " + current + " to " + target + " for " + entityType.toLowerCase());
  }
}
