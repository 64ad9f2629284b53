package io.b2mash.opsdesk.sales;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.opsdesk.lifecycle.StatusNames;

/** Kind of entry in a lead's activity log. Lower case on the wire, e.g. {@code email_out}. */
public enum ActivityType {
  NOTE,
  CALL,
  EMAIL_OUT,
  EMAIL_IN,
  MEETING,
  DEMO,
  OFFER_SENT,
  OFFER_VIEWED,
  STATUS_CHANGE,
  FIELD_CHANGE,
  TASK_COMPLETED;

  @JsonCreator
  public static ActivityType fromWire(String value) {
    return StatusNames.parse(ActivityType.class, value);
  }

  @JsonValue
  @Override
  public String toString() {
    return StatusNames.wireName(this);
  }
}
