package io.b2mash.opsdesk.store;

public enum Availability {
  AVAILABLE,
  UNAVAILABLE;

  public boolean isAvailable() {
    return this == AVAILABLE;
  }
}
