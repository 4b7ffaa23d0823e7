package com.codurance.retry;

/**
 * Notified after every failed attempt, before the attempt budget is checked.
 */
@FunctionalInterface
public interface FailureCallback {

  /**
   * @param attempt 1-based number of the attempt that failed
   * @param failure what the attempt threw
   */
  void onFailure(int attempt, Exception failure);
}
