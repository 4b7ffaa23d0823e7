package com.codurance.retry;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fluent retry policy: re-runs an operation on failure, up to a fixed number of
 * attempts with a fixed interval between them.
 *
 * <pre>{@code
 * String body = RetryPolicy.defaults()
 *     .withMaxAttempts(5)
 *     .withInterval(Duration.ofMillis(500))
 *     .withCaughtException(IOException.class)
 *     .onFailure((attempt, e) -> log.info("attempt {} failed", attempt, e))
 *     .execute(() -> client.fetch(url));
 * }</pre>
 *
 * Every failure is retried until the budget is spent, whatever its kind. The
 * registered exception kinds only decide which failures end up in the
 * {@link RetryExhaustedException} raised at the end. A kind matches on the
 * exact runtime class of the failure.
 *
 * <p>The attempt budget is configuration; counters live in the execution, so
 * one policy can be executed any number of times and from several threads.
 * Reconfiguring a policy while it executes is not supported.
 */
public class RetryPolicy {
  private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(2);

  private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
  private Duration interval = DEFAULT_INTERVAL;
  private final Map<Class<? extends Exception>, Predicate<Exception>> exceptionFilters = new LinkedHashMap<>();
  private FailureCallback onFailure;
  private Executor executor = ForkJoinPool.commonPool();

  private RetryPolicy() {
    exceptionFilters.put(Exception.class, null);
    exceptionFilters.put(RetryExhaustedException.class, null);
  }

  /** A fresh policy: 3 attempts, 2 seconds apart, {@code Exception} and aggregate failures recorded. */
  public static RetryPolicy defaults() {
    return new RetryPolicy();
  }

  public RetryPolicy withMaxAttempts(int maxAttempts) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
    }
    this.maxAttempts = maxAttempts;
    return this;
  }

  public RetryPolicy withInterval(Duration interval) {
    Objects.requireNonNull(interval, "interval");
    if (interval.isNegative()) {
      throw new IllegalArgumentException("interval must not be negative, was " + interval);
    }
    this.interval = interval;
    return this;
  }

  public RetryPolicy withInterval(long seconds) {
    if (seconds < 0) {
      throw new IllegalArgumentException("interval must not be negative, was " + seconds + "s");
    }
    return withInterval(Duration.ofSeconds(seconds));
  }

  /** Records every failure whose runtime class is exactly {@code kind}. */
  public <E extends Exception> RetryPolicy withCaughtException(Class<E> kind) {
    return withCaughtException(kind, null);
  }

  /**
   * Records failures whose runtime class is exactly {@code kind} and which
   * {@code predicate} accepts. Replaces any earlier registration of the same
   * kind; a {@code null} predicate accepts every instance.
   */
  public <E extends Exception> RetryPolicy withCaughtException(Class<E> kind, Predicate<? super E> predicate) {
    Objects.requireNonNull(kind, "kind");
    exceptionFilters.put(kind, predicate == null ? null : e -> predicate.test(kind.cast(e)));
    return this;
  }

  /**
   * Accepted so existing call sites keep compiling. Results are never
   * inspected: a normal return is always a success.
   */
  public <R> RetryPolicy withResultCondition(Predicate<? super R> condition) {
    logger.debug("Result conditions are not evaluated; ignoring {}", condition);
    return this;
  }

  /** Sets the failure callback, replacing the previous one. {@code null} removes it. */
  public RetryPolicy onFailure(FailureCallback callback) {
    this.onFailure = callback;
    return this;
  }

  /** Worker for the async variants. Defaults to the common fork-join pool. */
  public RetryPolicy withExecutor(Executor executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
    return this;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public Duration getInterval() {
    return interval;
  }

  /** Registered exception kinds, in registration order. */
  public Set<Class<? extends Exception>> getCaughtExceptions() {
    return Collections.unmodifiableSet(exceptionFilters.keySet());
  }

  /**
   * Runs {@code action} on the calling thread until it completes normally.
   *
   * @throws RetryExhaustedException when every attempt failed
   * @throws java.util.concurrent.CancellationException when the thread is interrupted
   */
  public void execute(RetryableAction action) {
    Objects.requireNonNull(action, "action");
    newExecution().runBlocking(asCallable(action));
  }

  /**
   * Runs {@code operation} on the calling thread and returns its first
   * successful result.
   *
   * @throws RetryExhaustedException when every attempt failed
   * @throws java.util.concurrent.CancellationException when the thread is interrupted
   */
  public <T> T execute(Callable<T> operation) {
    Objects.requireNonNull(operation, "operation");
    return newExecution().runBlocking(operation);
  }

  /**
   * Runs {@code action} on the configured executor. The future completes
   * exceptionally with {@link RetryExhaustedException} when every attempt failed.
   */
  public CompletableFuture<Void> executeAsync(RetryableAction action) {
    Objects.requireNonNull(action, "action");
    return newExecution().runAsync(asCallable(action), executor);
  }

  /**
   * Runs {@code operation} on the configured executor and completes with its
   * first successful result.
   */
  public <T> CompletableFuture<T> executeAsync(Callable<T> operation) {
    Objects.requireNonNull(operation, "operation");
    return newExecution().runAsync(operation, executor);
  }

  RetryExecution newExecution() {
    return new RetryExecution(maxAttempts, interval, exceptionFilters, onFailure);
  }

  private static Callable<Void> asCallable(RetryableAction action) {
    return () -> {
      action.run();
      return null;
    };
  }
}
