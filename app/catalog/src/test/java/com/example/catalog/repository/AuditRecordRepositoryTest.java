package com.example.catalog.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.catalog.AbstractPostgresContainerTest;
import com.example.catalog.model.AuditAction;
import com.example.catalog.model.AuditRecord;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class AuditRecordRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final UUID SELLER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
  private static final UUID LISTING_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b1");

  @Autowired private AuditRecordRepository auditRecordRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM audit_records", new MapSqlParameterSource());
  }

  @Test
  void recordsSurviveWithoutReferencedRows() {
    auditRecordRepository.insert(
        record(AuditAction.PRODUCT_PURGED, SELLER_ID, LISTING_ID, "{\"name\":\"Scarf\"}", NOW));

    final List<AuditRecord> found =
        auditRecordRepository.find(null, LISTING_ID, AuditAction.PRODUCT_PURGED, 10);

    assertThat(found).hasSize(1);
    assertThat(found.get(0).payloadJson()).contains("\"name\"").contains("Scarf");
    assertThat(found.get(0).createdAt()).isEqualTo(NOW);
  }

  @Test
  void findAppliesFiltersNewestFirst() {
    auditRecordRepository.insert(record(AuditAction.CATALOG_VIEWED, SELLER_ID, null, "{}", NOW));
    auditRecordRepository.insert(
        record(AuditAction.CATALOG_VIEWED, SELLER_ID, null, "{}", NOW.plusSeconds(5)));
    auditRecordRepository.insert(
        record(AuditAction.PRODUCT_REMOVED, SELLER_ID, LISTING_ID, "{}", NOW.plusSeconds(10)));
    auditRecordRepository.insert(record(AuditAction.ERROR, null, null, "{}", NOW.plusSeconds(15)));

    assertThat(auditRecordRepository.find(null, null, null, 10)).hasSize(4);
    assertThat(auditRecordRepository.find(SELLER_ID, null, null, 10))
        .extracting(AuditRecord::action)
        .containsExactly(
            AuditAction.PRODUCT_REMOVED, AuditAction.CATALOG_VIEWED, AuditAction.CATALOG_VIEWED);
    assertThat(auditRecordRepository.find(SELLER_ID, null, AuditAction.CATALOG_VIEWED, 1))
        .extracting(AuditRecord::createdAt)
        .containsExactly(NOW.plusSeconds(5));
    assertThat(auditRecordRepository.countBySellerAndAction(SELLER_ID, AuditAction.CATALOG_VIEWED))
        .isEqualTo(2);
  }

  private static AuditRecord record(
      AuditAction action, UUID sellerId, UUID listingId, String payload, Instant createdAt) {
    return new AuditRecord(
        UUID.randomUUID(),
        action,
        sellerId,
        listingId,
        null,
        payload,
        "203.0.113.7",
        "test-agent",
        null,
        createdAt);
  }
}
