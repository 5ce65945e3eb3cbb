package com.paperdex.app.model;

/** Discriminator stored in {@code item_type} on every derived item. */
public enum ItemType {
  PAPER_DETAIL("Paper ID items"),
  CATEGORY_ITEM("Category items"),
  AUTHOR_ITEM("Author items"),
  KEYWORD_ITEM("Keyword items");

  private final String label;

  ItemType(String label) {
    this.label = label;
  }

  /** Human-readable label used in the loader report. */
  public String label() {
    return label;
  }
}
