package com.example.catalog.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.catalog.model.InterestRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class InterestRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public InterestRecord insert(InterestRecord interest) {
    final String sql =
        """
        INSERT INTO interests (interest_id, listing_id, buyer_phone, buyer_name, buyer_ip,
                               user_agent, message_sent, created_at)
        VALUES (:interestId, :listingId, :buyerPhone, :buyerName, :buyerIp,
                :userAgent, :messageSent, :createdAt)
        RETURNING interest_id, listing_id, buyer_phone, buyer_name, buyer_ip, user_agent,
                  message_sent, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("interestId", interest.interestId())
            .addValue("listingId", interest.listingId())
            .addValue("buyerPhone", interest.buyerPhone())
            .addValue("buyerName", interest.buyerName())
            .addValue("buyerIp", interest.buyerIp())
            .addValue("userAgent", interest.userAgent())
            .addValue("messageSent", interest.messageSent())
            .addValue("createdAt", toTimestamp(interest.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public int markMessageSent(UUID interestId, boolean messageSent) {
    final String sql =
        "UPDATE interests SET message_sent = :messageSent WHERE interest_id = :interestId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("interestId", interestId)
            .addValue("messageSent", messageSent);
    return jdbcTemplate.update(sql, params);
  }

  /** Counts interests on the seller's listings, optionally only those created at or after {@code since}. */
  public int countBySeller(UUID sellerId, Instant since) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM interests i
        JOIN listings l ON l.listing_id = i.listing_id
        WHERE l.seller_id = :sellerId
          AND (CAST(:since AS TIMESTAMPTZ) IS NULL OR i.created_at >= :since)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sellerId", sellerId)
            .addValue("since", toTimestamp(since));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private InterestRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new InterestRecord(
        rs.getObject("interest_id", UUID.class),
        rs.getObject("listing_id", UUID.class),
        rs.getString("buyer_phone"),
        rs.getString("buyer_name"),
        rs.getString("buyer_ip"),
        rs.getString("user_agent"),
        rs.getBoolean("message_sent"),
        getInstant(rs, "created_at"));
  }
}
