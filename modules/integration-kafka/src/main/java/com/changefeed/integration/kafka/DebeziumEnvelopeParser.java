package com.changefeed.integration.kafka;

import com.changefeed.domain.changes.ChangeOperation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Parses Debezium JSON change envelopes, with or without the {@code schema}/{@code payload}
 * wrapper. Tombstones, truncates and logical messages carry no row change and are skipped.
 */
public class DebeziumEnvelopeParser {
  private static final TypeReference<Map<String, Object>> IMAGE_TYPE = new TypeReference<>() {};

  private final ObjectMapper objectMapper;
  private final String keyColumn;

  public DebeziumEnvelopeParser(ObjectMapper objectMapper, String keyColumn) {
    this.objectMapper = objectMapper;
    this.keyColumn = keyColumn == null || keyColumn.isBlank() ? "id" : keyColumn;
  }

  public Optional<DebeziumChange> parse(String recordKey, String recordValue) {
    if (recordValue == null || recordValue.isBlank()) {
      return Optional.empty();
    }
    JsonNode root = readTree(recordValue);
    JsonNode envelope = root.has("payload") && root.has("schema") ? root.get("payload") : root;
    if (envelope == null || envelope.isNull()) {
      return Optional.empty();
    }

    ChangeOperation operation = operationFor(text(envelope, "op"));
    if (operation == null) {
      return Optional.empty();
    }
    JsonNode source = envelope.path("source");
    String table = text(source, "table");
    if (table == null) {
      throw new DebeziumEnvelopeException("Change envelope has no source.table");
    }

    Map<String, Object> before = image(envelope.get("before"));
    Map<String, Object> after = image(envelope.get("after"));
    if (operation == ChangeOperation.INSERT) {
      before = null;
    }
    return Optional.of(
        new DebeziumChange(
            table,
            operation,
            keyFor(recordKey, before, after),
            before,
            after,
            commitTimestamp(envelope, source),
            text(source, "txId")));
  }

  private static ChangeOperation operationFor(String op) {
    if (op == null) {
      return null;
    }
    return switch (op) {
      case "c", "r" -> ChangeOperation.INSERT;
      case "u" -> ChangeOperation.UPDATE;
      case "d" -> ChangeOperation.DELETE;
      default -> null;
    };
  }

  private String keyFor(String recordKey, Map<String, Object> before, Map<String, Object> after) {
    Map<String, Object> image = after != null ? after : before;
    if (image != null && image.get(keyColumn) != null) {
      return String.valueOf(image.get(keyColumn));
    }
    if (recordKey == null || recordKey.isBlank()) {
      throw new DebeziumEnvelopeException(
          "Change envelope has neither key column '" + keyColumn + "' nor a record key");
    }
    JsonNode keyNode = readTree(recordKey);
    if (keyNode.has("payload")) {
      keyNode = keyNode.get("payload");
    }
    if (keyNode.isObject() && keyNode.size() == 1) {
      return keyNode.elements().next().asText();
    }
    return keyNode.isValueNode() ? keyNode.asText() : recordKey;
  }

  private static Instant commitTimestamp(JsonNode envelope, JsonNode source) {
    JsonNode sourceTs = source.get("ts_ms");
    if (sourceTs != null && sourceTs.canConvertToLong()) {
      return Instant.ofEpochMilli(sourceTs.asLong());
    }
    JsonNode envelopeTs = envelope.get("ts_ms");
    if (envelopeTs != null && envelopeTs.canConvertToLong()) {
      return Instant.ofEpochMilli(envelopeTs.asLong());
    }
    throw new DebeziumEnvelopeException("Change envelope has no ts_ms");
  }

  private Map<String, Object> image(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isObject()) {
      throw new DebeziumEnvelopeException("Row image must be a JSON object");
    }
    return objectMapper.convertValue(node, IMAGE_TYPE);
  }

  private JsonNode readTree(String json) {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException ex) {
      throw new DebeziumEnvelopeException("Record is not valid JSON", ex);
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.asText();
  }
}
