package com.codurance.retry;

/**
 * An operation without a result, run by {@link RetryPolicy#execute(RetryableAction)}.
 * Use {@link java.util.concurrent.Callable} when the operation produces a value.
 */
@FunctionalInterface
public interface RetryableAction {

  void run() throws Exception;
}
