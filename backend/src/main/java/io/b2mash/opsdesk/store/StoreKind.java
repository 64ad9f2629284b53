package io.b2mash.opsdesk.store;

public enum StoreKind {
  RELATIONAL("relational"),
  SEARCH("search"),
  CACHE("cache");

  private final String key;

  StoreKind(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }
}
