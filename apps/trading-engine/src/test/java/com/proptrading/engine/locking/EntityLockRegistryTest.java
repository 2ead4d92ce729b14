package com.proptrading.engine.locking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.engine.errors.EngineRejectionException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class EntityLockRegistryTest {
  private final EntityLockRegistry locks = new EntityLockRegistry(Duration.ofMillis(50));
  private final ExecutorService executor = Executors.newFixedThreadPool(4);

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void shouldReportTimeoutWhenAccountLockIsHeld() throws Exception {
    CountDownLatch held = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Future<?> holder =
        executor.submit(
            () ->
                locks.withAccountLock(
                    "acc-1",
                    () -> {
                      held.countDown();
                      await(release);
                      return null;
                    }));
    assertTrue(held.await(1, TimeUnit.SECONDS));

    EngineRejectionException rejection =
        assertThrows(
            EngineRejectionException.class, () -> locks.withAccountLock("acc-1", () -> "never"));
    assertEquals(RejectionCode.LOCK_TIMEOUT, rejection.code());
    assertTrue(rejection.rejection().isRetryable());

    release.countDown();
    holder.get(1, TimeUnit.SECONDS);
  }

  @Test
  void shouldSerializeWorkOnOneAccount() throws Exception {
    EntityLockRegistry patient = new EntityLockRegistry(Duration.ofSeconds(5));
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    Future<?>[] futures = new Future<?>[4];
    for (int i = 0; i < futures.length; i++) {
      futures[i] =
          executor.submit(
              () ->
                  patient.withAccountLock(
                      "acc-1",
                      () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        sleep(10);
                        inside.decrementAndGet();
                        return null;
                      }));
    }
    for (Future<?> future : futures) {
      future.get(5, TimeUnit.SECONDS);
    }

    assertEquals(1, maxInside.get());
  }

  @Test
  void shouldBeReentrantAcrossPositionAndAccountLocks() {
    String result =
        locks.withPositionAndAccountLock(
            "pos-1", "acc-1", () -> locks.withAccountLock("acc-1", () -> "ok"));

    assertEquals("ok", result);
  }

  @Test
  void shouldForgetClosedPositionLocks() {
    locks.withPositionLock("pos-1", () -> null);
    locks.withPositionLock("pos-2", () -> null);

    locks.forgetPosition("pos-1");

    assertEquals(1, locks.trackedPositionLocks());
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }
}
