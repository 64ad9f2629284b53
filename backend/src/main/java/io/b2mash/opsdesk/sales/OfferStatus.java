package io.b2mash.opsdesk.sales;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.opsdesk.lifecycle.StatusNames;

public enum OfferStatus {
  DRAFT,
  SENT,
  ACCEPTED,
  REJECTED,
  EXPIRED;

  @JsonCreator
  public static OfferStatus fromWire(String value) {
    return StatusNames.parse(OfferStatus.class, value);
  }

  @JsonValue
  @Override
  public String toString() {
    return StatusNames.wireName(this);
  }
}
