package io.b2mash.opsdesk.store.search;

public enum SearchOrder {
  RELEVANCE,
  NEWEST
}
