package com.example.catalog.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.catalog.model.AuditAction;
import com.example.catalog.model.AuditRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Append-only access to audit_records: there is deliberately no update or delete. */
@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class AuditRecordRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(AuditRecord auditRecord) {
    final String sql =
        """
        INSERT INTO audit_records (audit_id, action, seller_id, listing_id, interest_id,
                                   payload_json, ip_address, user_agent, external_message_id,
                                   created_at)
        VALUES (:auditId, :action, :sellerId, :listingId, :interestId,
                CAST(:payloadJson AS jsonb), :ipAddress, :userAgent, :externalMessageId,
                :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditId", auditRecord.auditId())
            .addValue("action", auditRecord.action().name())
            .addValue("sellerId", auditRecord.sellerId())
            .addValue("listingId", auditRecord.listingId())
            .addValue("interestId", auditRecord.interestId())
            .addValue("payloadJson", auditRecord.payloadJson())
            .addValue("ipAddress", auditRecord.ipAddress())
            .addValue("userAgent", auditRecord.userAgent())
            .addValue("externalMessageId", auditRecord.externalMessageId())
            .addValue("createdAt", toTimestamp(auditRecord.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  /** Newest first; null filters are ignored. */
  public List<AuditRecord> find(UUID sellerId, UUID listingId, AuditAction action, int limit) {
    final String sql =
        """
        SELECT audit_id, action, seller_id, listing_id, interest_id, payload_json::text AS payload_json,
               ip_address, user_agent, external_message_id, created_at
        FROM audit_records
        WHERE (CAST(:sellerId AS UUID) IS NULL OR seller_id = :sellerId)
          AND (CAST(:listingId AS UUID) IS NULL OR listing_id = :listingId)
          AND (CAST(:action AS VARCHAR) IS NULL OR action = :action)
        ORDER BY created_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sellerId", sellerId)
            .addValue("listingId", listingId)
            .addValue("action", action == null ? null : action.name())
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countBySellerAndAction(UUID sellerId, AuditAction action) {
    final String sql =
        "SELECT COUNT(*) FROM audit_records WHERE seller_id = :sellerId AND action = :action";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("sellerId", sellerId).addValue("action", action.name());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private AuditRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new AuditRecord(
        rs.getObject("audit_id", UUID.class),
        AuditAction.valueOf(rs.getString("action")),
        rs.getObject("seller_id", UUID.class),
        rs.getObject("listing_id", UUID.class),
        rs.getObject("interest_id", UUID.class),
        rs.getString("payload_json"),
        rs.getString("ip_address"),
        rs.getString("user_agent"),
        rs.getString("external_message_id"),
        getInstant(rs, "created_at"));
  }
}
