package com.changefeed.integration.kafka;

import com.changefeed.domain.changes.ChangeOperation;
import java.time.Instant;
import java.util.Map;

/** A Debezium change envelope reduced to the fields the capture source needs. */
public record DebeziumChange(
    String table,
    ChangeOperation operation,
    String key,
    Map<String, Object> before,
    Map<String, Object> after,
    Instant commitTimestamp,
    String transactionId) {}
