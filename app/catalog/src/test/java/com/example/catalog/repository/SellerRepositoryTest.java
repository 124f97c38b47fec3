/*
 * Where: catalog repository tests
 * What: seller inserts against Postgres
 * Why: ON CONFLICT on the phone number and the slug constraint are Postgres behaviour
 */
package com.example.catalog.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.catalog.AbstractPostgresContainerTest;
import com.example.catalog.model.SellerRecord;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SellerRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private SellerRepository sellerRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM audit_records", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM sellers", new MapSqlParameterSource());
  }

  @Test
  void insertIfAbsentReturnsInsertedRow() {
    final Optional<SellerRecord> inserted =
        sellerRepository.insertIfAbsent(seller("15551230001", "ana-shop-aaaa"));

    assertThat(inserted).isPresent();
    assertThat(inserted.get().catalogSlug()).isEqualTo("ana-shop-aaaa");
    assertThat(inserted.get().createdAt()).isEqualTo(NOW);
    assertThat(sellerRepository.findByPhoneNumber("15551230001")).isPresent();
  }

  @Test
  void insertIfAbsentIsEmptyWhenPhoneNumberTaken() {
    sellerRepository.insertIfAbsent(seller("15551230001", "ana-shop-aaaa"));

    final Optional<SellerRecord> second =
        sellerRepository.insertIfAbsent(seller("15551230001", "ana-shop-bbbb"));

    assertThat(second).isEmpty();
    assertThat(sellerRepository.existsBySlug("ana-shop-bbbb")).isFalse();
  }

  @Test
  void insertIfAbsentThrowsWhenSlugTaken() {
    sellerRepository.insertIfAbsent(seller("15551230001", "ana-shop-aaaa"));

    assertThatThrownBy(
            () -> sellerRepository.insertIfAbsent(seller("15551230002", "ana-shop-aaaa")))
        .isInstanceOf(DuplicateKeyException.class);
  }

  @Test
  void findActiveBySlugSkipsDeactivatedSellers() {
    final SellerRecord seller =
        sellerRepository.insertIfAbsent(seller("15551230001", "ana-shop-aaaa")).orElseThrow();

    assertThat(sellerRepository.findActiveBySlug("ana-shop-aaaa")).isPresent();

    sellerRepository.updateProfile(seller.sellerId(), null, false, NOW.plusSeconds(60));

    assertThat(sellerRepository.findActiveBySlug("ana-shop-aaaa")).isEmpty();
    assertThat(sellerRepository.findById(seller.sellerId()).orElseThrow().displayName())
        .isEqualTo("Ana Shop");
  }

  @Test
  void updateProfileIsEmptyForUnknownSeller() {
    assertThat(sellerRepository.updateProfile(UUID.randomUUID(), "x", null, NOW)).isEmpty();
  }

  private static SellerRecord seller(String phoneNumber, String slug) {
    return new SellerRecord(UUID.randomUUID(), phoneNumber, "Ana Shop", slug, true, NOW, NOW);
  }
}
