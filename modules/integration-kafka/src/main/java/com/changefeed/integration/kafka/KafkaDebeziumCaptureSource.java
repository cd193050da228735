package com.changefeed.integration.kafka;

import com.changefeed.domain.changes.CapturePosition;
import com.changefeed.domain.changes.ChangeDomainException;
import com.changefeed.domain.changes.RawChangeRecord;
import com.changefeed.domain.changes.capture.CaptureException;
import com.changefeed.domain.changes.capture.ChangeCaptureSource;
import com.changefeed.domain.changes.capture.ResyncRequiredException;
import com.changefeed.domain.changes.capture.SourceDisconnectedException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.InvalidOffsetException;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.RetriableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.ConsumerFactory;

/**
 * Consumes a single-partition topic fed by a Debezium PostgreSQL connector.
 *
 * <p>Positions are {@code (next offset, 0)}: the record at offset {@code n} is acknowledged as
 * {@code n + 1}, so {@link CapturePosition#beginning()} means nothing has been consumed yet.
 */
public class KafkaDebeziumCaptureSource implements ChangeCaptureSource {
  private static final Logger log = LoggerFactory.getLogger(KafkaDebeziumCaptureSource.class);

  private final String name;
  private final ConsumerFactory<String, String> consumerFactory;
  private final TopicPartition partition;
  private final DebeziumEnvelopeParser parser;
  private final boolean commitOffsets;

  private Consumer<String, String> consumer;

  public KafkaDebeziumCaptureSource(
      String name,
      ConsumerFactory<String, String> consumerFactory,
      String topic,
      DebeziumEnvelopeParser parser,
      boolean commitOffsets) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    this.name = name;
    this.consumerFactory = Objects.requireNonNull(consumerFactory, "consumerFactory must not be null");
    this.partition = new TopicPartition(topic, 0);
    this.parser = Objects.requireNonNull(parser, "parser must not be null");
    this.commitOffsets = commitOffsets;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void open(CapturePosition resumeAfter) {
    Objects.requireNonNull(resumeAfter, "resumeAfter must not be null");
    close();
    try {
      consumer = consumerFactory.createConsumer();
      consumer.assign(List.of(partition));
      if (resumeAfter.isLatest()) {
        consumer.seekToEnd(List.of(partition));
        log.info(
            "Debezium capture opened source={} partition={} offset={}",
            name,
            partition,
            consumer.position(partition));
        return;
      }
      long target = resumeAfter.primary();
      long beginning = offsetOrZero(consumer.beginningOffsets(List.of(partition)));
      long end = offsetOrZero(consumer.endOffsets(List.of(partition)));
      if (target < beginning || target > end) {
        throw new ResyncRequiredException(name, resumeAfter, CapturePosition.of(beginning, 0L));
      }
      consumer.seek(partition, target);
      log.info("Debezium capture opened source={} partition={} offset={}", name, partition, target);
    } catch (ResyncRequiredException ex) {
      close();
      throw ex;
    } catch (KafkaException ex) {
      close();
      throw translate(ex, resumeAfter);
    }
  }

  @Override
  public List<RawChangeRecord> poll(Duration maxWait) {
    if (consumer == null) {
      throw new IllegalStateException("source " + name + " is not open");
    }
    ConsumerRecords<String, String> polled;
    try {
      polled = consumer.poll(maxWait);
    } catch (KafkaException ex) {
      throw translate(ex, null);
    }
    List<RawChangeRecord> records = new ArrayList<>(polled.count());
    for (ConsumerRecord<String, String> record : polled.records(partition)) {
      toRawRecord(record).ifPresent(records::add);
    }
    return records;
  }

  @Override
  public void acknowledge(CapturePosition position) {
    if (!commitOffsets || consumer == null || position == null || position.isLatest()) {
      return;
    }
    try {
      consumer.commitSync(Map.of(partition, new OffsetAndMetadata(position.primary())));
    } catch (KafkaException ex) {
      throw translate(ex, null);
    }
  }

  @Override
  public void close() {
    if (consumer == null) {
      return;
    }
    Consumer<String, String> current = consumer;
    consumer = null;
    try {
      current.close();
    } catch (KafkaException ex) {
      log.warn("Debezium consumer close failed source={} error={}", name, ex.getMessage());
    }
  }

  private Optional<RawChangeRecord> toRawRecord(ConsumerRecord<String, String> record) {
    Optional<DebeziumChange> change;
    try {
      change = parser.parse(record.key(), record.value());
    } catch (DebeziumEnvelopeException ex) {
      throw new CaptureException(
          name, "Unparseable change at offset " + record.offset() + ": " + ex.getMessage(), ex);
    }
    if (change.isEmpty()) {
      log.debug("Debezium record skipped source={} offset={}", name, record.offset());
      return Optional.empty();
    }
    DebeziumChange parsed = change.get();
    try {
      return Optional.of(
          new RawChangeRecord(
              CapturePosition.of(record.offset() + 1L, 0L),
              parsed.table(),
              parsed.operation(),
              parsed.key(),
              parsed.before(),
              parsed.after(),
              parsed.commitTimestamp(),
              parsed.transactionId()));
    } catch (ChangeDomainException ex) {
      throw new CaptureException(
          name, "Invalid change at offset " + record.offset() + ": " + ex.getMessage(), ex);
    }
  }

  private CaptureException translate(KafkaException ex, CapturePosition requested) {
    if (ex instanceof InvalidOffsetException) {
      return new ResyncRequiredException(name, requested, null);
    }
    if (ex instanceof RetriableException) {
      return new SourceDisconnectedException(name, "Kafka unavailable: " + ex.getMessage(), ex);
    }
    return new CaptureException(name, "Kafka consumer failed: " + ex.getMessage(), ex);
  }

  private long offsetOrZero(Map<TopicPartition, Long> offsets) {
    Long offset = offsets.get(partition);
    return offset == null ? 0L : offset;
  }
}
