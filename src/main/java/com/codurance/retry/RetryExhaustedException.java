package com.codurance.retry;

import java.util.List;

/**
 * Raised once the attempt budget is spent. Wraps, in order of occurrence, the
 * failures whose kind was registered with the policy. The cause is the failure
 * of the final attempt, registered or not.
 */
public class RetryExhaustedException extends RuntimeException {
  private final int attempts;
  private final List<Exception> failures;

  public RetryExhaustedException(int attempts, List<Exception> failures, Exception lastFailure) {
    super("Retry attempts exhausted after " + attempts + " attempt(s), "
        + failures.size() + " recorded failure(s)", lastFailure);
    this.attempts = attempts;
    this.failures = List.copyOf(failures);
    for (Exception failure : this.failures) {
      addSuppressed(failure);
    }
  }

  public int getAttempts() {
    return attempts;
  }

  public List<Exception> getFailures() {
    return failures;
  }
}
