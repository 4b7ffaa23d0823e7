package com.codurance.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bookkeeping for one execution of a {@link RetryPolicy}: the attempt counter,
 * the remaining budget and the recorded failures. Holds a copy of the policy's
 * configuration taken when the execution starts.
 *
 * <p>Not thread-safe. The async path touches it from several workers, but only
 * one attempt is ever in flight and each hand-off goes through the executor.
 */
final class RetryExecution {
  private static final Logger logger = LoggerFactory.getLogger(RetryExecution.class);

  private final int maxAttempts;
  private final Duration interval;
  private final Map<Class<? extends Exception>, Predicate<Exception>> exceptionFilters;
  private final FailureCallback onFailure;

  private final List<Exception> failures = new ArrayList<>();
  private int attemptCount = 0;
  private int remainingAttempts;

  RetryExecution(int maxAttempts, Duration interval,
      Map<Class<? extends Exception>, Predicate<Exception>> exceptionFilters,
      FailureCallback onFailure) {
    this.maxAttempts = maxAttempts;
    this.interval = interval;
    this.exceptionFilters = new LinkedHashMap<>(exceptionFilters);
    this.onFailure = onFailure;
    this.remainingAttempts = maxAttempts;
  }

  /**
   * Runs the operation on the calling thread until it succeeds or the budget
   * is spent. The wait between attempts blocks the caller.
   */
  <T> T runBlocking(Callable<T> operation) {
    while (true) {
      try {
        T result = operation.call();
        succeeded();
        return result;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw cancelled(e);
      } catch (Exception e) {
        RetryExhaustedException exhausted = recordFailure(e);
        if (exhausted != null) {
          throw exhausted;
        }
        pause();
      }
    }
  }

  /**
   * Runs each attempt on {@code executor}. The next attempt is scheduled with a
   * delayed executor, so no thread waits out the interval. Cancelling the
   * returned future stops further attempts; an operation that throws
   * {@link InterruptedException} cancels the execution as well.
   */
  <T> CompletableFuture<T> runAsync(Callable<T> operation, Executor executor) {
    CompletableFuture<T> promise = new CompletableFuture<>();
    Executor guarded = task -> {
      try {
        executor.execute(task);
      } catch (RejectedExecutionException e) {
        promise.completeExceptionally(e);
      }
    };
    guarded.execute(() -> attempt(operation, promise, guarded));
    return promise;
  }

  private <T> void attempt(Callable<T> operation, CompletableFuture<T> promise, Executor guarded) {
    if (promise.isDone()) {
      logger.debug("Execution already completed or cancelled; skipping attempt {}", attemptCount + 1);
      return;
    }
    try {
      T result;
      try {
        result = operation.call();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        promise.completeExceptionally(cancelled(e));
        return;
      } catch (Exception e) {
        RetryExhaustedException exhausted = recordFailure(e);
        if (exhausted != null) {
          promise.completeExceptionally(exhausted);
        } else {
          nextAttemptExecutor(guarded).execute(() -> attempt(operation, promise, guarded));
        }
        return;
      }
      succeeded();
      promise.complete(result);
    } catch (Throwable t) {
      // failure callback or an Error; nothing left to retry
      promise.completeExceptionally(t);
    }
  }

  private Executor nextAttemptExecutor(Executor guarded) {
    if (interval.isZero()) {
      return guarded;
    }
    return CompletableFuture.delayedExecutor(interval.toNanos(), TimeUnit.NANOSECONDS, guarded);
  }

  /**
   * Books one failed attempt. Returns the aggregate failure when the budget is
   * spent, {@code null} when another attempt should follow.
   */
  RetryExhaustedException recordFailure(Exception failure) {
    attemptCount++;
    remainingAttempts--;
    logger.debug("Attempt {}/{} failed: {}", attemptCount, maxAttempts, failure.toString());

    if (onFailure != null) {
      onFailure.onFailure(attemptCount, failure);
    }
    if (isCaught(failure)) {
      failures.add(failure);
    }
    if (remainingAttempts <= 0) {
      logger.warn("Giving up after {} attempts ({} recorded failures)", attemptCount, failures.size());
      return new RetryExhaustedException(attemptCount, failures, failure);
    }
    return null;
  }

  /** Exact runtime class lookup; a superclass entry does not cover subclasses. */
  boolean isCaught(Exception failure) {
    Class<? extends Exception> kind = failure.getClass();
    if (!exceptionFilters.containsKey(kind)) {
      return false;
    }
    Predicate<Exception> predicate = exceptionFilters.get(kind);
    return predicate == null || predicate.test(failure);
  }

  int getAttemptCount() {
    return attemptCount;
  }

  private void succeeded() {
    logger.trace("Operation succeeded on attempt {}", attemptCount + 1);
  }

  private void pause() {
    if (interval.isZero()) {
      return;
    }
    try {
      Thread.sleep(interval.toMillis(), interval.toNanosPart() % 1_000_000);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw cancelled(e);
    }
  }

  private CancellationException cancelled(InterruptedException cause) {
    CancellationException cancelled =
        new CancellationException("Retry interrupted after " + attemptCount + " failed attempt(s)");
    cancelled.initCause(cause);
    return cancelled;
  }
}
