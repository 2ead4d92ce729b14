package com.proptrading.domain.positions;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PositionStateMachineTest {
  @Test
  void shouldAllowOpenPositionsToStayOpenOrTerminate() {
    assertTrue(PositionStateMachine.canTransition(PositionStatus.OPEN, PositionStatus.OPEN));
    assertTrue(PositionStateMachine.canTransition(PositionStatus.OPEN, PositionStatus.CLOSED));
    assertTrue(PositionStateMachine.canTransition(PositionStatus.OPEN, PositionStatus.LIQUIDATED));
  }

  @Test
  void shouldRejectExitsFromTerminalStates() {
    assertFalse(PositionStateMachine.canTransition(PositionStatus.CLOSED, PositionStatus.OPEN));
    assertFalse(
        PositionStateMachine.canTransition(PositionStatus.LIQUIDATED, PositionStatus.CLOSED));
    assertFalse(PositionStateMachine.canTransition(null, PositionStatus.OPEN));
    assertThrows(
        PositionDomainException.class,
        () ->
            PositionStateMachine.validateTransition(
                PositionStatus.CLOSED, PositionStatus.LIQUIDATED));
    assertDoesNotThrow(
        () -> PositionStateMachine.validateTransition(PositionStatus.OPEN, PositionStatus.CLOSED));
  }

  @Test
  void shouldMapCloseReasonsToTerminalStatus() {
    assertTrue(CloseReason.TP_TRIGGERED.isAutomatic());
    assertFalse(CloseReason.MANUAL.isAutomatic());
    assertTrue(CloseReason.LIQUIDATION_TRIGGERED.terminalStatus() == PositionStatus.LIQUIDATED);
    assertTrue(CloseReason.BREACH.terminalStatus() == PositionStatus.CLOSED);
  }
}
