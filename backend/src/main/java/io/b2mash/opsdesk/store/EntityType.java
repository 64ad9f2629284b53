package io.b2mash.opsdesk.store;

/** Entities mirrored into the search index. */
public enum EntityType {
  LEAD,
  OFFER,
  INSTALLATION,
  DOCUMENT
}
