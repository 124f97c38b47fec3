package com.example.catalog.api.response;

import com.example.catalog.model.AuditRecord;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditRecordResponse(
    UUID id,
    String action,
    UUID sellerId,
    UUID listingId,
    UUID interestId,
    @JsonRawValue String payload,
    String ipAddress,
    String userAgent,
    String externalMessageId,
    Instant createdAt) {

  public static AuditRecordResponse from(AuditRecord auditRecord) {
    return new AuditRecordResponse(
        auditRecord.auditId(),
        auditRecord.action().name(),
        auditRecord.sellerId(),
        auditRecord.listingId(),
        auditRecord.interestId(),
        auditRecord.payloadJson(),
        auditRecord.ipAddress(),
        auditRecord.userAgent(),
        auditRecord.externalMessageId(),
        auditRecord.createdAt());
  }
}
