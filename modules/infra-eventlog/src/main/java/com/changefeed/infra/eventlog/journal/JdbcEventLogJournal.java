package com.changefeed.infra.eventlog.journal;

import com.changefeed.domain.changes.ChangeEvent;
import com.changefeed.domain.changes.ChangeOperation;
import com.changefeed.infra.eventlog.LogEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;

public class JdbcEventLogJournal implements EventLogJournal {
  private static final TypeReference<Map<String, Object>> IMAGE_TYPE = new TypeReference<>() {};

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public JdbcEventLogJournal(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public void append(List<LogEntry> entries) {
    if (entries.isEmpty()) {
      return;
    }
    String sql =
        """
                INSERT INTO event_log (
                    log_offset, channel, operation, row_key, before_image, after_image,
                    commit_ts, transaction_id, appended_at
                ) VALUES (?, ?, ?, ?, CAST(? AS JSONB), CAST(? AS JSONB), ?, ?, ?)
                """;
    List<Object[]> rows =
        entries.stream()
            .map(
                entry -> {
                  ChangeEvent event = entry.event();
                  return new Object[] {
                    entry.offset(),
                    event.channel(),
                    event.operation().name(),
                    event.key(),
                    toJson(event.before()),
                    toJson(event.after()),
                    Timestamp.from(event.commitTimestamp()),
                    event.transactionId(),
                    Timestamp.from(entry.appendedAt())
                  };
                })
            .toList();
    jdbcTemplate.batchUpdate(sql, rows);
  }

  @Override
  public List<LogEntry> loadTail(int limit) {
    String sql =
        """
                SELECT log_offset, channel, operation, row_key, before_image::text AS before_image,
                       after_image::text AS after_image, commit_ts, transaction_id, appended_at
                FROM (
                    SELECT * FROM event_log ORDER BY log_offset DESC LIMIT ?
                ) tail
                ORDER BY log_offset ASC
                """;
    return jdbcTemplate.query(sql, this::mapEntry, Math.max(1, limit));
  }

  @Override
  public void truncateBefore(long floorOffset) {
    String sql =
        """
                DELETE FROM event_log
                WHERE log_offset < ?
                  AND log_offset < (SELECT COALESCE(MAX(log_offset), 0) FROM event_log)
                """;
    jdbcTemplate.update(sql, floorOffset);
  }

  private LogEntry mapEntry(ResultSet rs, int rowNum) throws SQLException {
    long offset = rs.getLong("log_offset");
    ChangeEvent event =
        new ChangeEvent(
            offset,
            rs.getString("channel"),
            ChangeOperation.valueOf(rs.getString("operation")),
            rs.getString("row_key"),
            fromJson(rs.getString("before_image")),
            fromJson(rs.getString("after_image")),
            rs.getTimestamp("commit_ts").toInstant(),
            rs.getString("transaction_id"));
    return new LogEntry(offset, event, rs.getTimestamp("appended_at").toInstant());
  }

  private String toJson(Map<String, Object> image) {
    if (image == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(image);
    } catch (JsonProcessingException ex) {
      throw new EventLogJournalException("Failed to serialize row image", ex);
    }
  }

  private Map<String, Object> fromJson(String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readValue(json, IMAGE_TYPE);
    } catch (JsonProcessingException ex) {
      throw new EventLogJournalException("Failed to deserialize row image", ex);
    }
  }
}
