package io.b2mash.opsdesk.installation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.opsdesk.lifecycle.StatusNames;

public enum InstallationStatus {
  PENDING,
  SCHEDULED,
  IN_PROGRESS,
  DONE,
  UNDONE;

  @JsonCreator
  public static InstallationStatus fromWire(String value) {
    return StatusNames.parse(InstallationStatus.class, value);
  }

  @JsonValue
  @Override
  public String toString() {
    return StatusNames.wireName(this);
  }
}
