package com.changefeed.gateway.snapshot;

import com.changefeed.domain.sessions.AccessClaims;
import com.changefeed.gateway.auth.AccessPolicy;
import com.changefeed.infra.eventlog.DurableEventLog;
import com.changefeed.integration.postgres.snapshot.JdbcTableSnapshotReader;
import com.changefeed.integration.postgres.snapshot.TableSnapshot;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SnapshotService {
  private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

  private final JdbcTableSnapshotReader reader;
  private final DurableEventLog eventLog;
  private final AccessPolicy accessPolicy;
  private final SnapshotProperties properties;

  public SnapshotService(
      JdbcTableSnapshotReader reader,
      DurableEventLog eventLog,
      AccessPolicy accessPolicy,
      SnapshotProperties properties) {
    this.reader = reader;
    this.eventLog = eventLog;
    this.accessPolicy = accessPolicy;
    this.properties = properties;
  }

  public SnapshotResponse read(AccessClaims claims, String channel, Integer requestedLimit) {
    int limit = requestedLimit == null ? properties.getDefaultLimit() : requestedLimit;
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1");
    }
    limit = Math.min(limit, properties.getMaxRows());
    // Read the head first so the rows are at least as new as atSequence.
    long atSequence = eventLog.headOffset();
    TableSnapshot snapshot = reader.read(channel, limit);
    List<Map<String, Object>> visible =
        snapshot.rows().stream().filter(row -> accessPolicy.authorizeRow(claims, channel, row)).toList();
    log.debug(
        "Snapshot served channel={} subject={} rows={} visible={} at_sequence={}",
        channel,
        claims.subject(),
        snapshot.rows().size(),
        visible.size(),
        atSequence);
    return new SnapshotResponse(channel, atSequence, visible.size(), snapshot.truncated(), visible);
  }
}
