/*
 * Where: catalog service layer
 * What: appends audit records for lifecycle transitions, messages and errors
 * Why: records back dispute resolution, but a failed write must not undo the business change
 */
package com.example.catalog.service;

import com.example.catalog.model.AuditAction;
import com.example.catalog.model.AuditRecord;
import com.example.catalog.model.NetworkMetadata;
import com.example.catalog.repository.AuditRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class AuditTrailRecorder {

  private static final Logger logger = LoggerFactory.getLogger(AuditTrailRecorder.class);

  private final AuditRecordRepository auditRecordRepository;
  private final ObjectMapper objectMapper;
  private final CatalogMetrics metrics;
  private final Clock clock;
  private final TransactionTemplate savepointTemplate;

  public AuditTrailRecorder(
      AuditRecordRepository auditRecordRepository,
      ObjectMapper objectMapper,
      CatalogMetrics metrics,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this.auditRecordRepository = auditRecordRepository;
    this.objectMapper = objectMapper;
    this.metrics = metrics;
    this.clock = clock;
    // inside a business transaction the insert runs under a savepoint; otherwise in its own
    this.savepointTemplate = new TransactionTemplate(transactionManager);
    this.savepointTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
  }

  public AuditWriteResult record(AuditEntry entry) {
    final AuditRecord auditRecord =
        new AuditRecord(
            UUID.randomUUID(),
            entry.action(),
            entry.sellerId(),
            entry.listingId(),
            entry.interestId(),
            serializePayload(entry),
            entry.metadata().ipAddress(),
            entry.metadata().userAgent(),
            entry.externalMessageId(),
            Instant.now(clock));
    try {
      savepointTemplate.executeWithoutResult(status -> auditRecordRepository.insert(auditRecord));
    } catch (RuntimeException ex) {
      metrics.recordAuditWrite("failed");
      logger.error(
          "audit write failed action={} sellerId={} listingId={} interestId={} payload={}",
          auditRecord.action(),
          auditRecord.sellerId(),
          auditRecord.listingId(),
          auditRecord.interestId(),
          auditRecord.payloadJson(),
          ex);
      return AuditWriteResult.failed(auditRecord, ex.getMessage());
    }
    metrics.recordAuditWrite("written");
    return AuditWriteResult.written(auditRecord);
  }

  private String serializePayload(AuditEntry entry) {
    try {
      return objectMapper.writeValueAsString(entry.payload());
    } catch (JsonProcessingException ex) {
      logger.warn("audit payload not serializable action={}", entry.action(), ex);
      return "{\"payload_error\":\"not serializable\"}";
    }
  }

  /** Everything an audit record is written from; builders keep call sites short. */
  public record AuditEntry(
      AuditAction action,
      UUID sellerId,
      UUID listingId,
      UUID interestId,
      Map<String, ?> payload,
      NetworkMetadata metadata,
      String externalMessageId) {

    public AuditEntry {
      payload = payload == null ? Map.of() : payload;
      metadata = metadata == null ? NetworkMetadata.NONE : metadata;
    }

    public static AuditEntry of(AuditAction action, Map<String, ?> payload) {
      return new AuditEntry(action, null, null, null, payload, null, null);
    }

    public AuditEntry seller(UUID id) {
      return new AuditEntry(
          action, id, listingId, interestId, payload, metadata, externalMessageId);
    }

    public AuditEntry listing(UUID id) {
      return new AuditEntry(
          action, sellerId, id, interestId, payload, metadata, externalMessageId);
    }

    public AuditEntry interest(UUID id) {
      return new AuditEntry(action, sellerId, listingId, id, payload, metadata, externalMessageId);
    }

    public AuditEntry network(NetworkMetadata networkMetadata) {
      return new AuditEntry(
          action, sellerId, listingId, interestId, payload, networkMetadata, externalMessageId);
    }

    public AuditEntry externalMessageId(String id) {
      return new AuditEntry(action, sellerId, listingId, interestId, payload, metadata, id);
    }
  }
}
