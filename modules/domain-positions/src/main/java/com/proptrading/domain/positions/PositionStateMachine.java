package com.proptrading.domain.positions;

import java.util.EnumSet;
import java.util.Map;

public final class PositionStateMachine {
  private static final Map<PositionStatus, EnumSet<PositionStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PositionStatus.OPEN,
              EnumSet.of(PositionStatus.OPEN, PositionStatus.CLOSED, PositionStatus.LIQUIDATED),
          PositionStatus.CLOSED, EnumSet.noneOf(PositionStatus.class),
          PositionStatus.LIQUIDATED, EnumSet.noneOf(PositionStatus.class));

  private PositionStateMachine() {}

  public static boolean canTransition(PositionStatus from, PositionStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<PositionStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(PositionStatus from, PositionStatus to) {
    if (!canTransition(from, to)) {
      throw new PositionDomainException(
          "Invalid position status transition from " + from + " to " + to);
    }
  }
}
