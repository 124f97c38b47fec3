/*
 * Where: app/catalog/src/main/java/com/example/catalog/model/ListingState.java
 * What: lifecycle states of a listing
 * Why: DISCARDED and PURGED are terminal and never persisted; the row is deleted instead
 */
package com.example.catalog.model;

public enum ListingState {
  DRAFT,
  ACTIVE,
  REMOVED,
  DISCARDED,
  PURGED;

  public boolean isTerminal() {
    return this == DISCARDED || this == PURGED;
  }
}
