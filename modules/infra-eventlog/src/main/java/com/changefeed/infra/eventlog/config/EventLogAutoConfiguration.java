package com.changefeed.infra.eventlog.config;

import com.changefeed.infra.eventlog.DurableEventLog;
import com.changefeed.infra.eventlog.journal.EventLogJournal;
import com.changefeed.infra.eventlog.journal.JdbcEventLogJournal;
import com.changefeed.infra.eventlog.journal.NoOpEventLogJournal;
import com.changefeed.infra.eventlog.observability.EventLogTelemetry;
import com.changefeed.infra.eventlog.observability.MicrometerEventLogTelemetry;
import com.changefeed.infra.eventlog.observability.NoOpEventLogTelemetry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

@AutoConfiguration(after = {JdbcTemplateAutoConfiguration.class, JacksonAutoConfiguration.class})
@EnableConfigurationProperties(EventLogProperties.class)
public class EventLogAutoConfiguration {
  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(EventLogTelemetry.class)
  public EventLogTelemetry micrometerEventLogTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerEventLogTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(EventLogTelemetry.class)
  public EventLogTelemetry noOpEventLogTelemetry() {
    return new NoOpEventLogTelemetry();
  }

  @Bean
  @ConditionalOnBean(JdbcTemplate.class)
  @ConditionalOnProperty(
      prefix = "changefeed.event-log.journal",
      name = "mode",
      havingValue = "jdbc",
      matchIfMissing = true)
  @ConditionalOnMissingBean(EventLogJournal.class)
  public EventLogJournal jdbcEventLogJournal(
      JdbcTemplate jdbcTemplate, ObjectProvider<ObjectMapper> objectMapper) {
    return new JdbcEventLogJournal(jdbcTemplate, objectMapper.getIfAvailable(ObjectMapper::new));
  }

  @Bean
  @ConditionalOnMissingBean(EventLogJournal.class)
  public EventLogJournal noOpEventLogJournal() {
    return new NoOpEventLogJournal();
  }

  @Bean
  @ConditionalOnMissingBean
  public DurableEventLog durableEventLog(
      EventLogJournal eventLogJournal,
      EventLogTelemetry eventLogTelemetry,
      EventLogProperties properties) {
    DurableEventLog eventLog =
        new DurableEventLog(eventLogJournal, eventLogTelemetry, properties.toRetentionPolicy());
    eventLog.recover();
    return eventLog;
  }
}
