package com.example.catalog.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.catalog.model.SellerRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class SellerRepository {

  private static final String COLUMNS =
      "seller_id, phone_number, display_name, catalog_slug, active, created_at, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<SellerRecord> findByPhoneNumber(String phoneNumber) {
    final String sql = "SELECT " + COLUMNS + " FROM sellers WHERE phone_number = :phoneNumber";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("phoneNumber", phoneNumber);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<SellerRecord> findById(UUID sellerId) {
    final String sql = "SELECT " + COLUMNS + " FROM sellers WHERE seller_id = :sellerId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("sellerId", sellerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<SellerRecord> findActiveBySlug(String catalogSlug) {
    final String sql =
        "SELECT " + COLUMNS + " FROM sellers WHERE catalog_slug = :catalogSlug AND active = TRUE";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("catalogSlug", catalogSlug);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public boolean existsBySlug(String catalogSlug) {
    final String sql = "SELECT EXISTS (SELECT 1 FROM sellers WHERE catalog_slug = :catalogSlug)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("catalogSlug", catalogSlug);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  /**
   * Inserts the seller unless a row with the same phone number exists.
   *
   * @return the inserted row, or empty when another writer already owns the phone number
   * @throws org.springframework.dao.DuplicateKeyException when the catalog slug collides
   */
  public Optional<SellerRecord> insertIfAbsent(SellerRecord seller) {
    final String sql =
        """
        INSERT INTO sellers (seller_id, phone_number, display_name, catalog_slug, active,
                             created_at, updated_at)
        VALUES (:sellerId, :phoneNumber, :displayName, :catalogSlug, :active,
                :createdAt, :updatedAt)
        ON CONFLICT (phone_number) DO NOTHING
        RETURNING seller_id, phone_number, display_name, catalog_slug, active, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sellerId", seller.sellerId())
            .addValue("phoneNumber", seller.phoneNumber())
            .addValue("displayName", seller.displayName())
            .addValue("catalogSlug", seller.catalogSlug())
            .addValue("active", seller.active())
            .addValue("createdAt", toTimestamp(seller.createdAt()))
            .addValue("updatedAt", toTimestamp(seller.updatedAt()));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<SellerRecord> updateProfile(
      UUID sellerId, String displayName, Boolean active, Instant now) {
    final String sql =
        """
        UPDATE sellers
        SET display_name = COALESCE(:displayName, display_name),
            active = COALESCE(:active, active),
            updated_at = :updatedAt
        WHERE seller_id = :sellerId
        RETURNING seller_id, phone_number, display_name, catalog_slug, active, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sellerId", sellerId)
            .addValue("displayName", displayName)
            .addValue("active", active)
            .addValue("updatedAt", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private SellerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SellerRecord(
        rs.getObject("seller_id", UUID.class),
        rs.getString("phone_number"),
        rs.getString("display_name"),
        rs.getString("catalog_slug"),
        rs.getBoolean("active"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
