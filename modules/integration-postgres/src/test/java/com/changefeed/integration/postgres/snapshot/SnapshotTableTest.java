package com.changefeed.integration.postgres.snapshot;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SnapshotTableTest {
  @Test
  void shouldAcceptPlainIdentifiers() {
    assertDoesNotThrow(() -> new SnapshotTable("tasks", "id"));
    assertDoesNotThrow(() -> new SnapshotTable("user_tasks_2", "task_id"));
  }

  @Test
  void shouldRejectIdentifiersThatNeedQuoting() {
    assertThrows(IllegalArgumentException.class, () -> new SnapshotTable("tasks; drop", "id"));
    assertThrows(IllegalArgumentException.class, () -> new SnapshotTable("tasks", "\"id\""));
    assertThrows(IllegalArgumentException.class, () -> new SnapshotTable("1tasks", "id"));
  }
}
