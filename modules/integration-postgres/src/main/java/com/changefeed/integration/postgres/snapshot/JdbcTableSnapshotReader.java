package com.changefeed.integration.postgres.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Baseline reads of watched tables. Rows are rendered with {@code to_jsonb} so column values have
 * the same JSON shape as the row images carried by change events.
 */
public class JdbcTableSnapshotReader {
  private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final Map<String, SnapshotTable> tables;

  public JdbcTableSnapshotReader(
      JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, List<SnapshotTable> tables) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
    this.tables =
        tables.stream().collect(Collectors.toUnmodifiableMap(SnapshotTable::tableName, Function.identity()));
  }

  public boolean supports(String channel) {
    return tables.containsKey(channel);
  }

  public TableSnapshot read(String channel, int limit) {
    SnapshotTable table = tables.get(channel);
    if (table == null) {
      throw new UnknownSnapshotTableException(channel);
    }
    int safeLimit = Math.max(1, limit);
    String sql =
        "SELECT to_jsonb(t)::text AS row_json FROM \""
            + table.tableName()
            + "\" t ORDER BY t.\""
            + table.keyColumn()
            + "\" LIMIT ?";
    List<String> rawRows =
        jdbcTemplate.query(sql, (rs, rowNum) -> rs.getString("row_json"), safeLimit + 1);
    boolean truncated = rawRows.size() > safeLimit;
    List<Map<String, Object>> rows = new ArrayList<>(Math.min(rawRows.size(), safeLimit));
    for (String rawRow : rawRows.subList(0, Math.min(rawRows.size(), safeLimit))) {
      rows.add(parse(rawRow));
    }
    return new TableSnapshot(channel, rows, truncated);
  }

  private Map<String, Object> parse(String json) {
    try {
      return objectMapper.readValue(json, ROW_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Snapshot row is not a JSON object", ex);
    }
  }
}
