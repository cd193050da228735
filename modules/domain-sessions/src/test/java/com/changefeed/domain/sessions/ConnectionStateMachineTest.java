package com.changefeed.domain.sessions;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ConnectionStateMachineTest {
  @Test
  void shouldAllowLifecycleTransitions() {
    assertTrue(
        ConnectionStateMachine.canTransition(
            ConnectionState.CONNECTING, ConnectionState.AUTHENTICATED));
    assertTrue(
        ConnectionStateMachine.canTransition(ConnectionState.AUTHENTICATED, ConnectionState.ACTIVE));
    assertTrue(
        ConnectionStateMachine.canTransition(ConnectionState.ACTIVE, ConnectionState.DRAINING));
    assertTrue(
        ConnectionStateMachine.canTransition(ConnectionState.DRAINING, ConnectionState.CLOSED));
  }

  @Test
  void shouldAllowAbortFromAnyLiveState() {
    assertTrue(
        ConnectionStateMachine.canTransition(ConnectionState.CONNECTING, ConnectionState.CLOSED));
    assertTrue(
        ConnectionStateMachine.canTransition(ConnectionState.AUTHENTICATED, ConnectionState.CLOSED));
    assertTrue(ConnectionStateMachine.canTransition(ConnectionState.ACTIVE, ConnectionState.CLOSED));
  }

  @Test
  void shouldRejectBackwardOrTerminalTransitions() {
    assertFalse(
        ConnectionStateMachine.canTransition(ConnectionState.ACTIVE, ConnectionState.CONNECTING));
    assertFalse(
        ConnectionStateMachine.canTransition(ConnectionState.CONNECTING, ConnectionState.ACTIVE));
    assertFalse(
        ConnectionStateMachine.canTransition(ConnectionState.DRAINING, ConnectionState.ACTIVE));
    assertFalse(
        ConnectionStateMachine.canTransition(ConnectionState.CLOSED, ConnectionState.CONNECTING));
  }

  @Test
  void shouldThrowForInvalidTransition() {
    assertThrows(
        SessionDomainException.class,
        () ->
            ConnectionStateMachine.validateTransition(
                ConnectionState.CLOSED, ConnectionState.ACTIVE));
    assertDoesNotThrow(
        () ->
            ConnectionStateMachine.validateTransition(
                ConnectionState.CONNECTING, ConnectionState.AUTHENTICATED));
  }
}
