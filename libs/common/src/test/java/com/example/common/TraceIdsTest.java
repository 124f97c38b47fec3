package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void orNewKeepsProvidedId() {
    assertThat(TraceIds.orNew("req-123")).isEqualTo("req-123");
  }

  @Test
  void orNewGeneratesUuidForBlankInput() {
    final String generated = TraceIds.orNew("  ");

    assertThat(UUID.fromString(generated).toString()).isEqualTo(generated);
    assertThat(TraceIds.orNew(null)).isNotEqualTo(generated);
  }
}
