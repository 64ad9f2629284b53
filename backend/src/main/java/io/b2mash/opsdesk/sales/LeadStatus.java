package io.b2mash.opsdesk.sales;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.opsdesk.lifecycle.StatusNames;

public enum LeadStatus {
  NEW,
  CONTACTED,
  QUALIFIED,
  LOST,
  CONVERTED;

  @JsonCreator
  public static LeadStatus fromWire(String value) {
    return StatusNames.parse(LeadStatus.class, value);
  }

  @JsonValue
  @Override
  public String toString() {
    return StatusNames.wireName(this);
  }
}
