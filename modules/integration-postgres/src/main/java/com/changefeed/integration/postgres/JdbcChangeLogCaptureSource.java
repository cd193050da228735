package com.changefeed.integration.postgres;

import com.changefeed.domain.changes.CapturePosition;
import com.changefeed.domain.changes.ChangeOperation;
import com.changefeed.domain.changes.RawChangeRecord;
import com.changefeed.domain.changes.capture.CaptureException;
import com.changefeed.domain.changes.capture.ChangeCaptureSource;
import com.changefeed.domain.changes.capture.ResyncRequiredException;
import com.changefeed.domain.changes.capture.SourceDisconnectedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Reads the trigger-maintained {@code change_log} table.
 *
 * <p>Rows are ordered by {@code (txid, id)} and only read once their transaction id is below the
 * snapshot xmin, so every transaction that could still insert a smaller cursor value has finished.
 * Acknowledged rows can be purged; the purge watermark lets {@link #open} detect resume positions
 * whose rows are gone.
 */
public class JdbcChangeLogCaptureSource implements ChangeCaptureSource {
  private static final Logger log = LoggerFactory.getLogger(JdbcChangeLogCaptureSource.class);
  private static final TypeReference<Map<String, Object>> IMAGE_TYPE = new TypeReference<>() {};

  private final String name;
  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final int batchSize;
  private final Set<String> watchedTables;
  private final boolean purgeAcknowledged;
  private final Sleeper sleeper;

  private CapturePosition cursor;

  public JdbcChangeLogCaptureSource(
      String name,
      JdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper,
      int batchSize,
      Set<String> watchedTables,
      boolean purgeAcknowledged) {
    this(
        name,
        jdbcTemplate,
        objectMapper,
        batchSize,
        watchedTables,
        purgeAcknowledged,
        duration -> Thread.sleep(duration.toMillis()));
  }

  JdbcChangeLogCaptureSource(
      String name,
      JdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper,
      int batchSize,
      Set<String> watchedTables,
      boolean purgeAcknowledged,
      Sleeper sleeper) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    this.name = name;
    this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.batchSize = Math.max(1, batchSize);
    this.watchedTables = watchedTables == null ? Set.of() : Set.copyOf(watchedTables);
    this.purgeAcknowledged = purgeAcknowledged;
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void open(CapturePosition resumeAfter) {
    Objects.requireNonNull(resumeAfter, "resumeAfter must not be null");
    cursor =
        translate(
            () -> {
              CapturePosition watermark = purgeWatermark();
              if (resumeAfter.isLatest()) {
                CapturePosition stableTail = stableTail();
                return stableTail.isAfter(watermark) ? stableTail : watermark;
              }
              if (watermark.isAfter(resumeAfter)) {
                throw new ResyncRequiredException(name, resumeAfter, watermark);
              }
              return resumeAfter;
            });
    log.info("Change log capture opened source={} cursor={}", name, cursor.encode());
  }

  @Override
  public List<RawChangeRecord> poll(Duration maxWait) {
    if (cursor == null) {
      throw new IllegalStateException("source " + name + " is not open");
    }
    List<ChangeLogRow> rows = translate(this::fetchStableBatch);
    if (rows.isEmpty()) {
      waitFor(maxWait);
      return List.of();
    }
    List<RawChangeRecord> records = new ArrayList<>(rows.size());
    for (ChangeLogRow row : rows) {
      if (watchedTables.isEmpty() || watchedTables.contains(row.tableName())) {
        records.add(toRecord(row));
      }
    }
    ChangeLogRow last = rows.get(rows.size() - 1);
    cursor = CapturePosition.of(last.txid(), last.id());
    return records;
  }

  @Override
  public void acknowledge(CapturePosition position) {
    if (!purgeAcknowledged || position == null || position.isLatest()) {
      return;
    }
    translate(
        () -> {
          String watermarkSql =
              """
              UPDATE change_log_watermark
              SET purged_txid = ?, purged_id = ?, updated_at = NOW()
              WHERE id = 1
                AND (purged_txid, purged_id) < (?, ?)
              """;
          jdbcTemplate.update(
              watermarkSql,
              position.primary(),
              position.secondary(),
              position.primary(),
              position.secondary());
          String purgeSql = "DELETE FROM change_log WHERE (txid, id) <= (?, ?)";
          int purged = jdbcTemplate.update(purgeSql, position.primary(), position.secondary());
          if (purged > 0) {
            log.debug(
                "Change log purged source={} position={} rows={}", name, position.encode(), purged);
          }
          return purged;
        });
  }

  @Override
  public void close() {
    cursor = null;
  }

  private List<ChangeLogRow> fetchStableBatch() {
    String sql =
        """
        SELECT id,
               txid,
               table_name,
               operation,
               row_key,
               before_image::text AS before_image,
               after_image::text AS after_image,
               changed_at
        FROM change_log
        WHERE (txid, id) > (?, ?)
          AND txid < txid_snapshot_xmin(txid_current_snapshot())
        ORDER BY txid, id
        LIMIT ?
        """;
    return jdbcTemplate.query(
        sql, this::mapRow, cursor.primary(), cursor.secondary(), batchSize);
  }

  private CapturePosition purgeWatermark() {
    String sql = "SELECT purged_txid, purged_id FROM change_log_watermark WHERE id = 1";
    List<CapturePosition> rows =
        jdbcTemplate.query(
            sql,
            (rs, rowNum) -> CapturePosition.of(rs.getLong("purged_txid"), rs.getLong("purged_id")));
    return rows.isEmpty() ? CapturePosition.beginning() : rows.get(0);
  }

  private CapturePosition stableTail() {
    String sql =
        """
        SELECT txid, id
        FROM change_log
        WHERE txid < txid_snapshot_xmin(txid_current_snapshot())
        ORDER BY txid DESC, id DESC
        LIMIT 1
        """;
    List<CapturePosition> rows =
        jdbcTemplate.query(
            sql, (rs, rowNum) -> CapturePosition.of(rs.getLong("txid"), rs.getLong("id")));
    return rows.isEmpty() ? CapturePosition.beginning() : rows.get(0);
  }

  private ChangeLogRow mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ChangeLogRow(
        rs.getLong("id"),
        rs.getLong("txid"),
        rs.getString("table_name"),
        rs.getString("operation"),
        rs.getString("row_key"),
        rs.getString("before_image"),
        rs.getString("after_image"),
        rs.getTimestamp("changed_at").toInstant());
  }

  private RawChangeRecord toRecord(ChangeLogRow row) {
    try {
      return new RawChangeRecord(
          CapturePosition.of(row.txid(), row.id()),
          row.tableName(),
          ChangeOperation.valueOf(row.operation()),
          row.rowKey(),
          parseImage(row.beforeImage()),
          parseImage(row.afterImage()),
          row.changedAt(),
          Long.toString(row.txid()));
    } catch (RuntimeException ex) {
      throw new CaptureException(
          name, "Unreadable change_log row id=" + row.id() + ": " + ex.getMessage(), ex);
    }
  }

  private Map<String, Object> parseImage(String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readValue(json, IMAGE_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("row image is not a JSON object", ex);
    }
  }

  private void waitFor(Duration maxWait) {
    if (maxWait == null || maxWait.isZero() || maxWait.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(maxWait);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private <T> T translate(Supplier<T> action) {
    try {
      return action.get();
    } catch (TransientDataAccessException
        | RecoverableDataAccessException
        | DataAccessResourceFailureException ex) {
      throw new SourceDisconnectedException(
          name, "Change log unavailable: " + ex.getMostSpecificCause().getMessage(), ex);
    } catch (DataAccessException ex) {
      throw new CaptureException(
          name, "Change log query failed: " + ex.getMostSpecificCause().getMessage(), ex);
    }
  }

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private record ChangeLogRow(
      long id,
      long txid,
      String tableName,
      String operation,
      String rowKey,
      String beforeImage,
      String afterImage,
      Instant changedAt) {}
}
