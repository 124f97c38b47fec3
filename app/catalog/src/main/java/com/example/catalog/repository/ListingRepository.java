package com.example.catalog.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.catalog.model.ListingRecord;
import com.example.catalog.model.ListingState;
import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class ListingRepository {

  private static final String COLUMNS =
      """
      listing_id, seller_id, name, description, price, currency, image_url, image_path,
      state, removed_at, undo_deadline, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public ListingRecord insert(ListingRecord listing) {
    final String sql =
        """
        INSERT INTO listings (listing_id, seller_id, name, description, price, currency,
                              image_url, image_path, state, removed_at, undo_deadline,
                              created_at, updated_at)
        VALUES (:listingId, :sellerId, :name, :description, :price, :currency,
                :imageUrl, :imagePath, :state, :removedAt, :undoDeadline,
                :createdAt, :updatedAt)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("listingId", listing.listingId())
            .addValue("sellerId", listing.sellerId())
            .addValue("name", listing.name())
            .addValue("description", listing.description())
            .addValue("price", listing.price())
            .addValue("currency", listing.currency())
            .addValue("imageUrl", listing.imageUrl())
            .addValue("imagePath", listing.imagePath())
            .addValue("state", listing.state().name())
            .addValue("removedAt", toTimestamp(listing.removedAt()))
            .addValue("undoDeadline", toTimestamp(listing.undoDeadline()))
            .addValue("createdAt", toTimestamp(listing.createdAt()))
            .addValue("updatedAt", toTimestamp(listing.updatedAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  public Optional<ListingRecord> findById(UUID listingId) {
    final String sql = "SELECT " + COLUMNS + " FROM listings WHERE listing_id = :listingId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("listingId", listingId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Row-locks the listing until the surrounding transaction ends. */
  public Optional<ListingRecord> findByIdForUpdate(UUID listingId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM listings WHERE listing_id = :listingId FOR UPDATE";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("listingId", listingId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Row-locks all listed rows in id order so concurrent batches cannot deadlock. */
  public List<ListingRecord> findByIdsForUpdate(Collection<UUID> listingIds) {
    if (listingIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        "SELECT "
            + COLUMNS
            + " FROM listings WHERE listing_id IN (:listingIds) ORDER BY listing_id FOR UPDATE";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("listingIds", listingIds);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<ListingRecord> findBySeller(UUID sellerId, boolean includeInactive) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM listings
            WHERE seller_id = :sellerId
              AND (:includeInactive OR state = 'ACTIVE')
            ORDER BY created_at DESC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sellerId", sellerId)
            .addValue("includeInactive", includeInactive);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Optional<ListingRecord> findActiveBySellerAndId(UUID sellerId, UUID listingId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM listings
            WHERE seller_id = :sellerId AND listing_id = :listingId AND state = 'ACTIVE'
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("sellerId", sellerId).addValue("listingId", listingId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Writes the state columns of {@code listing} only if the row is still in {@code
   * expectedState}.
   *
   * @return number of updated rows (0 when a concurrent transition won)
   */
  public int updateState(ListingRecord listing, ListingState expectedState) {
    final String sql =
        """
        UPDATE listings
        SET state = :state,
            removed_at = :removedAt,
            undo_deadline = :undoDeadline,
            updated_at = :updatedAt
        WHERE listing_id = :listingId AND state = :expectedState
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("listingId", listing.listingId())
            .addValue("state", listing.state().name())
            .addValue("removedAt", toTimestamp(listing.removedAt()))
            .addValue("undoDeadline", toTimestamp(listing.undoDeadline()))
            .addValue("updatedAt", toTimestamp(listing.updatedAt()))
            .addValue("expectedState", expectedState.name());
    return jdbcTemplate.update(sql, params);
  }

  public Optional<ListingRecord> updateDetails(
      UUID listingId,
      String name,
      String description,
      BigDecimal price,
      String currency,
      Instant now) {
    final String sql =
        """
        UPDATE listings
        SET name = COALESCE(:name, name),
            description = COALESCE(:description, description),
            price = COALESCE(:price, price),
            currency = COALESCE(:currency, currency),
            updated_at = :updatedAt
        WHERE listing_id = :listingId
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("listingId", listingId)
            .addValue("name", name)
            .addValue("description", description)
            .addValue("price", price)
            .addValue("currency", currency)
            .addValue("updatedAt", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int delete(UUID listingId) {
    final String sql = "DELETE FROM listings WHERE listing_id = :listingId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("listingId", listingId));
  }

  /** REMOVED listings whose undo deadline is older than {@code threshold} and still own an asset. */
  public List<ListingRecord> findReclaimableRemoved(Instant threshold, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
             FROM listings
            WHERE state = 'REMOVED'
              AND undo_deadline < :threshold
              AND asset_reclaimed_at IS NULL
            ORDER BY undo_deadline
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("threshold", toTimestamp(threshold))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markAssetReclaimed(UUID listingId, Instant now) {
    final String sql =
        """
        UPDATE listings
        SET asset_reclaimed_at = :now
        WHERE listing_id = :listingId AND state = 'REMOVED' AND asset_reclaimed_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("listingId", listingId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int countBySellerAndState(UUID sellerId, ListingState state) {
    final String sql =
        "SELECT COUNT(*) FROM listings WHERE seller_id = :sellerId AND state = :state";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("sellerId", sellerId).addValue("state", state.name());
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private ListingRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ListingRecord(
        rs.getObject("listing_id", UUID.class),
        rs.getObject("seller_id", UUID.class),
        rs.getString("name"),
        rs.getString("description"),
        rs.getBigDecimal("price"),
        rs.getString("currency"),
        rs.getString("image_url"),
        rs.getString("image_path"),
        ListingState.valueOf(rs.getString("state")),
        getInstant(rs, "removed_at"),
        getInstant(rs, "undo_deadline"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
