package com.changefeed.gateway.config;

import com.changefeed.gateway.auth.AccessPolicy;
import com.changefeed.gateway.snapshot.SnapshotProperties;
import com.changefeed.gateway.snapshot.SnapshotService;
import com.changefeed.infra.eventlog.DurableEventLog;
import com.changefeed.integration.postgres.snapshot.JdbcTableSnapshotReader;
import com.changefeed.integration.postgres.snapshot.SnapshotTable;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class SnapshotConfiguration {
  @Bean
  public JdbcTableSnapshotReader jdbcTableSnapshotReader(
      JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, SnapshotProperties snapshotProperties) {
    List<SnapshotTable> tables =
        snapshotProperties.getTables().stream()
            .map(table -> new SnapshotTable(table.getName(), table.getKeyColumn()))
            .toList();
    return new JdbcTableSnapshotReader(jdbcTemplate, objectMapper, tables);
  }

  @Bean
  public SnapshotService snapshotService(
      JdbcTableSnapshotReader jdbcTableSnapshotReader,
      DurableEventLog durableEventLog,
      AccessPolicy accessPolicy,
      SnapshotProperties snapshotProperties) {
    return new SnapshotService(
        jdbcTableSnapshotReader, durableEventLog, accessPolicy, snapshotProperties);
  }
}
