package com.proptrading.engine.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.math.BigDecimal;

public final class DecimalAssertions {
  private DecimalAssertions() {}

  /** Compares by value, so {@code 50.01} equals {@code 50.01000000}. */
  public static void assertDecimalEquals(String expected, BigDecimal actual) {
    assertNotNull(actual, () -> "expected " + expected + " but was null");
    assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> expected + " != " + actual);
  }
}
