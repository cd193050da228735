package com.changefeed.integration.postgres;

import com.changefeed.domain.changes.CapturePosition;
import com.changefeed.domain.changes.capture.CapturePositionStore;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;

public class JdbcCapturePositionStore implements CapturePositionStore {
  private final JdbcTemplate jdbcTemplate;
  private final Clock clock;

  public JdbcCapturePositionStore(JdbcTemplate jdbcTemplate) {
    this(jdbcTemplate, Clock.systemUTC());
  }

  JdbcCapturePositionStore(JdbcTemplate jdbcTemplate, Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.clock = clock;
  }

  @Override
  public Optional<CapturePosition> load(String sourceName) {
    String sql =
        """
        SELECT position_primary, position_secondary
        FROM capture_position
        WHERE source_name = ?
        """;
    List<CapturePosition> rows =
        jdbcTemplate.query(
            sql,
            (rs, rowNum) ->
                CapturePosition.of(rs.getLong("position_primary"), rs.getLong("position_secondary")),
            sourceName);
    if (rows.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(rows.get(0));
  }

  @Override
  public void save(String sourceName, CapturePosition position) {
    if (position.isLatest()) {
      throw new IllegalArgumentException("latest() marker cannot be stored");
    }
    String sql =
        """
        INSERT INTO capture_position (source_name, position_primary, position_secondary, updated_at)
        VALUES (?, ?, ?, ?)
        ON CONFLICT (source_name) DO UPDATE SET
            position_primary = EXCLUDED.position_primary,
            position_secondary = EXCLUDED.position_secondary,
            updated_at = EXCLUDED.updated_at
        WHERE (capture_position.position_primary, capture_position.position_secondary)
              < (EXCLUDED.position_primary, EXCLUDED.position_secondary)
        """;
    jdbcTemplate.update(
        sql,
        sourceName,
        position.primary(),
        position.secondary(),
        Timestamp.from(clock.instant()));
  }
}
