package com.example.catalog.service;

import com.example.catalog.model.AuditRecord;

/**
 * Outcome of an audit write. A failed write never propagates as an exception; callers that
 * care can inspect {@link #failed()}.
 */
public record AuditWriteResult(Status status, AuditRecord record, String failureMessage) {

  public enum Status {
    WRITTEN,
    AUDIT_WRITE_FAILED
  }

  public static AuditWriteResult written(AuditRecord record) {
    return new AuditWriteResult(Status.WRITTEN, record, null);
  }

  public static AuditWriteResult failed(AuditRecord record, String failureMessage) {
    return new AuditWriteResult(Status.AUDIT_WRITE_FAILED, record, failureMessage);
  }

  public boolean failed() {
    return status == Status.AUDIT_WRITE_FAILED;
  }
}
