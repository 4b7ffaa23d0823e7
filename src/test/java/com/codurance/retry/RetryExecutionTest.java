package com.codurance.retry;

import static org.junit.jupiter.api.Assertions.*;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.time.Duration;

import org.junit.jupiter.api.Test;

public class RetryExecutionTest {

  @Test
  public void matchesOnExactRuntimeClass() {
    RetryExecution execution = RetryPolicy.defaults().withCaughtException(IOException.class).newExecution();

    assertTrue(execution.isCaught(new Exception()));
    assertTrue(execution.isCaught(new IOException()));
    assertFalse(execution.isCaught(new FileNotFoundException()));
    assertFalse(execution.isCaught(new RuntimeException()));
  }

  @Test
  public void budgetIsSpentAfterMaxAttemptsFailures() {
    RetryExecution execution = RetryPolicy.defaults().withMaxAttempts(2).newExecution();

    assertNull(execution.recordFailure(new Exception("first")));
    RetryExhaustedException exhausted = execution.recordFailure(new Exception("second"));

    assertNotNull(exhausted);
    assertEquals(2, execution.getAttemptCount());
    assertEquals(2, exhausted.getFailures().size());
  }

  @Test
  public void executionKeepsConfigurationFromWhenItStarted() {
    RetryPolicy policy = RetryPolicy.defaults().withMaxAttempts(1).withInterval(Duration.ZERO);
    RetryExecution execution = policy.newExecution();

    policy.withMaxAttempts(5).withCaughtException(IOException.class, e -> false);

    assertFalse(execution.isCaught(new IOException()));
    assertNotNull(execution.recordFailure(new IOException("only")));
  }
}
