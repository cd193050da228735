package com.changefeed.gateway.snapshot;

import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "changefeed.snapshot")
public class SnapshotProperties {
  @Min(1)
  private int defaultLimit = 100;
  @Min(1)
  private int maxRows = 1_000;
  private List<Table> tables = new ArrayList<>();

  public int getDefaultLimit() {
    return defaultLimit;
  }

  public void setDefaultLimit(int defaultLimit) {
    this.defaultLimit = defaultLimit;
  }

  public int getMaxRows() {
    return maxRows;
  }

  public void setMaxRows(int maxRows) {
    this.maxRows = maxRows;
  }

  public List<Table> getTables() {
    return tables;
  }

  public void setTables(List<Table> tables) {
    this.tables = tables;
  }

  public static class Table {
    private String name;
    private String keyColumn = "id";

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getKeyColumn() {
      return keyColumn;
    }

    public void setKeyColumn(String keyColumn) {
      this.keyColumn = keyColumn;
    }
  }
}
