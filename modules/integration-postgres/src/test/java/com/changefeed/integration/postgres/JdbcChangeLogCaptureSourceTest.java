package com.changefeed.integration.postgres;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.changefeed.domain.changes.CapturePosition;
import com.changefeed.domain.changes.capture.CaptureException;
import com.changefeed.domain.changes.capture.SourceDisconnectedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.SQLException;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

@ExtendWith(MockitoExtension.class)
class JdbcChangeLogCaptureSourceTest {
  @Mock private JdbcTemplate jdbcTemplate;

  @Test
  void lostConnectionShouldSurfaceAsSourceDisconnected() {
    when(jdbcTemplate.query(anyString(), ArgumentMatchers.<RowMapper<CapturePosition>>any()))
        .thenThrow(new CannotGetJdbcConnectionException("connection refused"));

    SourceDisconnectedException failure =
        assertThrows(
            SourceDisconnectedException.class,
            () -> newSource().open(CapturePosition.beginning()));
    assertEquals("pg-test", failure.sourceName());
  }

  @Test
  void queryTimeoutShouldSurfaceAsSourceDisconnected() {
    when(jdbcTemplate.query(anyString(), ArgumentMatchers.<RowMapper<CapturePosition>>any()))
        .thenThrow(new QueryTimeoutException("statement timeout"));

    assertThrows(
        SourceDisconnectedException.class, () -> newSource().open(CapturePosition.beginning()));
  }

  @Test
  void schemaErrorsShouldBeFatalCaptureFailures() {
    when(jdbcTemplate.query(anyString(), ArgumentMatchers.<RowMapper<CapturePosition>>any()))
        .thenThrow(
            new BadSqlGrammarException(
                "watermark", "SELECT ...", new SQLException("relation does not exist")));

    CaptureException failure =
        assertThrows(CaptureException.class, () -> newSource().open(CapturePosition.beginning()));
    assertFalse(failure instanceof SourceDisconnectedException);
  }

  @Test
  void pollingBeforeOpenShouldFail() {
    assertThrows(
        IllegalStateException.class, () -> newSource().poll(java.time.Duration.ZERO));
  }

  @Test
  void acknowledgeWithoutPurgeShouldNotTouchDatabase() {
    newSource().acknowledge(CapturePosition.of(5L, 5L));

    verifyNoInteractions(jdbcTemplate);
  }

  private JdbcChangeLogCaptureSource newSource() {
    return new JdbcChangeLogCaptureSource(
        "pg-test", jdbcTemplate, new ObjectMapper(), 10, Set.of(), false, duration -> {});
  }
}
