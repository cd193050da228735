package com.changefeed.gateway.config;

import com.changefeed.domain.changes.capture.CapturePositionStore;
import com.changefeed.domain.changes.capture.ChangeCaptureSource;
import com.changefeed.domain.sessions.ErrorCode;
import com.changefeed.gateway.capture.CaptureHealth;
import com.changefeed.gateway.capture.CaptureHealthIndicator;
import com.changefeed.gateway.capture.CaptureIngestionService;
import com.changefeed.gateway.capture.CaptureProperties;
import com.changefeed.gateway.capture.CaptureRetryPolicy;
import com.changefeed.gateway.capture.KafkaCaptureProperties;
import com.changefeed.gateway.connection.ConnectionManager;
import com.changefeed.infra.eventlog.DurableEventLog;
import com.changefeed.integration.kafka.DebeziumEnvelopeParser;
import com.changefeed.integration.kafka.KafkaDebeziumCaptureSource;
import com.changefeed.integration.postgres.JdbcCapturePositionStore;
import com.changefeed.integration.postgres.JdbcChangeLogCaptureSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;

@Configuration
public class CaptureConfiguration {
  @Bean
  public CaptureHealth captureHealth(Clock clock) {
    return new CaptureHealth(clock);
  }

  @Bean
  public CaptureHealthIndicator captureHealthIndicator(CaptureHealth captureHealth) {
    return new CaptureHealthIndicator(captureHealth);
  }

  @Bean
  public CapturePositionStore capturePositionStore(JdbcTemplate jdbcTemplate) {
    return new JdbcCapturePositionStore(jdbcTemplate);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "changefeed.capture",
      name = "mode",
      havingValue = "jdbc",
      matchIfMissing = true)
  public ChangeCaptureSource changeLogCaptureSource(
      JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, CaptureProperties captureProperties) {
    return new JdbcChangeLogCaptureSource(
        captureProperties.getSourceName(),
        jdbcTemplate,
        objectMapper,
        captureProperties.getBatchSize(),
        Set.copyOf(captureProperties.getWatchedTables()),
        captureProperties.isPurgeAcknowledged());
  }

  @Bean
  @ConditionalOnProperty(prefix = "changefeed.capture", name = "mode", havingValue = "debezium")
  public ChangeCaptureSource debeziumCaptureSource(
      ObjectMapper objectMapper,
      CaptureProperties captureProperties,
      KafkaCaptureProperties kafkaProperties) {
    Map<String, Object> consumerConfig = new HashMap<>();
    consumerConfig.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.getBootstrapServers());
    consumerConfig.put(ConsumerConfig.GROUP_ID_CONFIG, kafkaProperties.getGroupId());
    consumerConfig.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    consumerConfig.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, captureProperties.getBatchSize());
    consumerConfig.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
    consumerConfig.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
    return new KafkaDebeziumCaptureSource(
        captureProperties.getSourceName(),
        new DefaultKafkaConsumerFactory<>(consumerConfig),
        kafkaProperties.getTopic(),
        new DebeziumEnvelopeParser(objectMapper, kafkaProperties.getKeyColumn()),
        kafkaProperties.isCommitOffsets());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "changefeed.capture",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public CaptureIngestionService captureIngestionService(
      ChangeCaptureSource changeCaptureSource,
      CapturePositionStore capturePositionStore,
      DurableEventLog durableEventLog,
      CaptureHealth captureHealth,
      CaptureProperties captureProperties,
      ConnectionManager connectionManager,
      MeterRegistry meterRegistry) {
    CaptureIngestionService service =
        new CaptureIngestionService(
            changeCaptureSource,
            capturePositionStore,
            durableEventLog,
            captureHealth,
            CaptureRetryPolicy.from(captureProperties),
            captureProperties,
            meterRegistry);
    service.setHaltListener(
        (resyncRequired, reason) -> {
          if (resyncRequired) {
            connectionManager.broadcastError(
                ErrorCode.RESYNC_REQUIRED,
                "change capture lost its position; refetch a snapshot before trusting further events");
          }
        });
    return service;
  }
}
