package com.proptrading.domain.orders;

import java.util.EnumSet;
import java.util.Map;

public final class PendingOrderStateMachine {
  private static final Map<PendingOrderStatus, EnumSet<PendingOrderStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PendingOrderStatus.PENDING,
              EnumSet.of(
                  PendingOrderStatus.FILLED,
                  PendingOrderStatus.CANCELLED,
                  PendingOrderStatus.EXPIRED),
          PendingOrderStatus.FILLED, EnumSet.noneOf(PendingOrderStatus.class),
          PendingOrderStatus.CANCELLED, EnumSet.noneOf(PendingOrderStatus.class),
          PendingOrderStatus.EXPIRED, EnumSet.noneOf(PendingOrderStatus.class));

  private PendingOrderStateMachine() {}

  public static boolean canTransition(PendingOrderStatus from, PendingOrderStatus to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<PendingOrderStatus> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(PendingOrderStatus from, PendingOrderStatus to) {
    if (!canTransition(from, to)) {
      throw new OrderDomainException(
          "Invalid pending order transition from " + from + " to " + to);
    }
  }
}
