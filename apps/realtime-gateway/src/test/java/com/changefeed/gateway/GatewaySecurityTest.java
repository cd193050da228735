package com.changefeed.gateway;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.changefeed.domain.sessions.ConnectionState;
import com.changefeed.gateway.config.RealmRoleGrantedAuthoritiesConverter;
import com.changefeed.gateway.connection.ConnectionManager;
import com.changefeed.gateway.dispatch.FanOutDispatcher;
import com.changefeed.gateway.snapshot.SnapshotResponse;
import com.changefeed.gateway.snapshot.SnapshotService;
import com.changefeed.infra.eventlog.DurableEventLog;
import com.changefeed.integration.postgres.snapshot.UnknownSnapshotTableException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;

@SpringBootTest(
    properties = {
      "spring.autoconfigure.exclude="
          + "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration,"
          + "org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration",
      "changefeed.capture.enabled=false",
      "changefeed.dispatch.enabled=false",
      "changefeed.connection.sweep.enabled=false",
      "changefeed.event-log.compaction.enabled=false",
      "changefeed.event-log.journal.mode=none"
    })
@AutoConfigureMockMvc
class GatewaySecurityTest {
  @Autowired private MockMvc mockMvc;
  @MockBean private JdbcTemplate jdbcTemplate;
  @MockBean private DurableEventLog durableEventLog;
  @MockBean private ConnectionManager connectionManager;
  @MockBean private FanOutDispatcher fanOutDispatcher;
  @MockBean private SnapshotService snapshotService;

  @Test
  void engineStatusShouldReturnUnauthorizedWithoutToken() throws Exception {
    mockMvc.perform(get("/v1/engine/status")).andExpect(status().isUnauthorized());
  }

  @Test
  void engineStatusShouldReturnForbiddenForNonAdminRole() throws Exception {
    mockMvc
        .perform(get("/v1/engine/status").with(userJwt("u1")))
        .andExpect(status().isForbidden());
  }

  @Test
  void engineStatusShouldReportEngineStateForAdminRole() throws Exception {
    when(durableEventLog.headOffset()).thenReturn(42L);
    when(durableEventLog.floorOffset()).thenReturn(1L);
    when(fanOutDispatcher.dispatchedThrough()).thenReturn(40L);
    when(fanOutDispatcher.lag()).thenReturn(2L);
    when(connectionManager.countByState()).thenReturn(Map.of(ConnectionState.ACTIVE, 3));

    mockMvc
        .perform(
            get("/v1/engine/status")
                .with(
                    jwt()
                        .jwt(jwt -> jwt.claim("realm_access", Map.of("roles", List.of("ADMIN"))))
                        .authorities(new RealmRoleGrantedAuthoritiesConverter())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.eventLog.headSequence").value(42))
        .andExpect(jsonPath("$.dispatch.lag").value(2))
        .andExpect(jsonPath("$.connections.total").value(3))
        .andExpect(jsonPath("$.connections.byState.ACTIVE").value(3))
        .andExpect(jsonPath("$.capture.status").value("STARTING"));
  }

  @Test
  void snapshotShouldReturnUnauthorizedWithoutToken() throws Exception {
    mockMvc.perform(get("/v1/snapshots/tasks")).andExpect(status().isUnauthorized());
  }

  @Test
  void snapshotShouldPassCallerClaimsToService() throws Exception {
    when(snapshotService.read(any(), eq("tasks"), isNull()))
        .thenReturn(
            new SnapshotResponse(
                "tasks", 7L, 1, false, List.of(Map.of("id", "t-1", "user_id", "u1"))));

    mockMvc
        .perform(get("/v1/snapshots/tasks").with(userJwt("u1")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.atSequence").value(7))
        .andExpect(jsonPath("$.rows[0].id").value("t-1"));
  }

  @Test
  void snapshotOfUnknownTableShouldReturnNotFound() throws Exception {
    when(snapshotService.read(any(), eq("ledger"), any()))
        .thenThrow(new UnknownSnapshotTableException("ledger"));

    mockMvc
        .perform(get("/v1/snapshots/ledger").with(userJwt("u1")))
        .andExpect(status().isNotFound());
  }

  @Test
  void snapshotWithInvalidLimitShouldReturnBadRequest() throws Exception {
    when(snapshotService.read(any(), eq("tasks"), eq(0)))
        .thenThrow(new IllegalArgumentException("limit must be >= 1"));

    mockMvc
        .perform(get("/v1/snapshots/tasks").param("limit", "0").with(userJwt("u1")))
        .andExpect(status().isBadRequest());
  }

  @Test
  void snapshotShouldReturnServiceUnavailableWhenSourceIsDown() throws Exception {
    when(snapshotService.read(any(), eq("tasks"), any()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    mockMvc
        .perform(get("/v1/snapshots/tasks").with(userJwt("u1")))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.title").value("Source Unavailable"));
  }

  private RequestPostProcessor userJwt(String subject) {
    return jwt()
        .jwt(
            jwt ->
                jwt.subject(subject).claim("realm_access", Map.of("roles", List.of("USER"))))
        .authorities(new RealmRoleGrantedAuthoritiesConverter());
  }
}
