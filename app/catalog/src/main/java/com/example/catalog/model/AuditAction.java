/*
 * Where: app/catalog/src/main/java/com/example/catalog/model/AuditAction.java
 * What: closed set of audit record kinds
 * Why: every lifecycle transition maps to exactly one of these values
 */
package com.example.catalog.model;

public enum AuditAction {
  ACCOUNT_REGISTERED,
  PRODUCT_UPLOADED,
  PRODUCT_CONFIRMED,
  PRODUCT_CANCELLED,
  PRODUCT_REMOVED,
  PRODUCT_RESTORED,
  PRODUCT_PURGED,
  INTEREST_SIGNALED,
  CATALOG_VIEWED,
  MESSAGE_SENT,
  MESSAGE_RECEIVED,
  ERROR
}
