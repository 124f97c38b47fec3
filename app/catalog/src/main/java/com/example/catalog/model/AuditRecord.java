/*
 * Where: app/catalog/src/main/java/com/example/catalog/model/AuditRecord.java
 * What: row of the append-only audit_records table
 * Why: any subset of the entity references may be null, e.g. platform level errors
 */
package com.example.catalog.model;

import java.time.Instant;
import java.util.UUID;

public record AuditRecord(
    UUID auditId,
    AuditAction action,
    UUID sellerId,
    UUID listingId,
    UUID interestId,
    String payloadJson,
    String ipAddress,
    String userAgent,
    String externalMessageId,
    Instant createdAt) {}
