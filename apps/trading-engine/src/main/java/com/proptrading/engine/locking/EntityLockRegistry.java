package com.proptrading.engine.locking;

import com.proptrading.domain.orders.RejectionCode;
import com.proptrading.engine.errors.EngineRejectionException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One reentrant lock per account and per position. When both are needed they are taken in the
 * order position, then account. Every acquisition waits at most {@code lockWait}; a timeout is
 * reported as a retryable {@link RejectionCode#LOCK_TIMEOUT}.
 */
public class EntityLockRegistry {
  private static final Logger log = LoggerFactory.getLogger(EntityLockRegistry.class);

  private final Map<String, ReentrantLock> accountLocks = new ConcurrentHashMap<>();
  private final Map<String, ReentrantLock> positionLocks = new ConcurrentHashMap<>();
  private final long lockWaitNanos;

  public EntityLockRegistry(Duration lockWait) {
    this.lockWaitNanos = lockWait.toNanos();
  }

  public <T> T withAccountLock(String accountId, Supplier<T> action) {
    ReentrantLock lock = accountLocks.computeIfAbsent(accountId, ignored -> new ReentrantLock());
    acquire(lock, "account", accountId);
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  public <T> T withPositionAndAccountLock(
      String positionId, String accountId, Supplier<T> action) {
    ReentrantLock lock = positionLocks.computeIfAbsent(positionId, ignored -> new ReentrantLock());
    acquire(lock, "position", positionId);
    try {
      return withAccountLock(accountId, action);
    } finally {
      lock.unlock();
    }
  }

  public <T> T withPositionLock(String positionId, Supplier<T> action) {
    ReentrantLock lock = positionLocks.computeIfAbsent(positionId, ignored -> new ReentrantLock());
    acquire(lock, "position", positionId);
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  /** Drops the lock of a closed position; later lookups of that id create a fresh lock. */
  public void forgetPosition(String positionId) {
    positionLocks.remove(positionId);
  }

  int trackedPositionLocks() {
    return positionLocks.size();
  }

  private void acquire(ReentrantLock lock, String entity, String id) {
    boolean acquired;
    try {
      acquired = lock.tryLock(lockWaitNanos, TimeUnit.NANOSECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new EngineRejectionException(
          RejectionCode.LOCK_TIMEOUT, "Interrupted while waiting for " + entity + " lock");
    }
    if (!acquired) {
      log.warn("Lock timeout entity={} id={}", entity, id);
      throw new EngineRejectionException(
          RejectionCode.LOCK_TIMEOUT, "Timed out waiting for " + entity + " lock, please retry");
    }
  }
}
