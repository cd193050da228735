package com.changefeed.gateway.capture;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "changefeed.kafka")
public class KafkaCaptureProperties {
  private String bootstrapServers = "localhost:9092";
  private String topic = "changefeed.public.tasks";
  private String groupId = "changefeed-gateway";
  private String keyColumn = "id";
  private boolean commitOffsets = true;

  public String getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(String bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public String getTopic() {
    return topic;
  }

  public void setTopic(String topic) {
    this.topic = topic;
  }

  public String getGroupId() {
    return groupId;
  }

  public void setGroupId(String groupId) {
    this.groupId = groupId;
  }

  public String getKeyColumn() {
    return keyColumn;
  }

  public void setKeyColumn(String keyColumn) {
    this.keyColumn = keyColumn;
  }

  public boolean isCommitOffsets() {
    return commitOffsets;
  }

  public void setCommitOffsets(boolean commitOffsets) {
    this.commitOffsets = commitOffsets;
  }
}
