package io.b2mash.opsdesk.lifecycle;

/** Who is notified when a lifecycle event fires. */
public enum Audience {
  NONE,
  /** The lead's owner. */
  OWNER,
  /** The customer company the lead belongs to. */
  COMPANY,
  /** The technician assigned to the installation. */
  TECHNICIAN,
  /** The lead's owner and the assigned technician. */
  STAKEHOLDERS
}
