package io.b2mash.opsdesk.docs;

/** Levels of the troubleshooting tree, top-down. Each level may only hang under the one above. */
public enum DocumentLevel {
  CATEGORY("Category", null),
  SUBCATEGORY("Subcategory", CATEGORY),
  SUBSUBCATEGORY("Subsubcategory", SUBCATEGORY),
  STEP("Step", SUBSUBCATEGORY);

  private final String label;
  private final DocumentLevel parentLevel;

  DocumentLevel(String label, DocumentLevel parentLevel) {
    this.label = label;
    this.parentLevel = parentLevel;
  }

  public String label() {
    return label;
  }

  /** The level a node of this level must hang under, or null for the root level. */
  public DocumentLevel parentLevel() {
    return parentLevel;
  }

  public boolean isRoot() {
    return parentLevel == null;
  }
}
