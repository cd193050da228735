package com.changefeed.integration.postgres;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.changefeed.domain.changes.CapturePosition;
import com.changefeed.testsupport.containers.PostgresContainerBaseIT;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

class JdbcCapturePositionStoreIntegrationTest extends PostgresContainerBaseIT {
  private JdbcCapturePositionStore store;

  @BeforeEach
  void setUp() {
    store = new JdbcCapturePositionStore(new JdbcTemplate(freshlyMigratedDataSource()));
  }

  @Test
  void shouldUpsertAndLoadPosition() {
    assertTrue(store.load("pg").isEmpty());

    store.save("pg", CapturePosition.of(700L, 3L));
    store.save("pg", CapturePosition.of(701L, 1L));

    assertEquals(CapturePosition.of(701L, 1L), store.load("pg").orElseThrow());
  }

  @Test
  void shouldIgnoreOlderPositions() {
    store.save("pg", CapturePosition.of(701L, 1L));
    store.save("pg", CapturePosition.of(700L, 9L));

    assertEquals(CapturePosition.of(701L, 1L), store.load("pg").orElseThrow());
  }
}
