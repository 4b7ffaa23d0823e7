package com.codurance.retry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

public class FailureCallbackTest {

  @Test
  public void callbackSeesEveryAttemptInOrder() {
    FailureCallback callback = mock(FailureCallback.class);
    IllegalStateException failure = new IllegalStateException("down");

    assertThrows(RetryExhaustedException.class, () -> RetryPolicy.defaults()
        .withInterval(Duration.ZERO)
        .withMaxAttempts(4)
        .onFailure(callback)
        .execute(() -> {
          throw failure;
        }));

    InOrder order = inOrder(callback);
    for (int attempt = 1; attempt <= 4; attempt++) {
      order.verify(callback).onFailure(attempt, failure);
    }
    verifyNoMoreInteractions(callback);
  }

  @Test
  public void callbackIsNotCalledForSuccessfulAttempt() {
    FailureCallback callback = mock(FailureCallback.class);
    AtomicInteger calls = new AtomicInteger();

    String result = RetryPolicy.defaults()
        .withInterval(Duration.ZERO)
        .onFailure(callback)
        .execute(() -> {
          if (calls.incrementAndGet() == 1) {
            throw new IllegalStateException("first");
          }
          return "ok";
        });

    assertEquals("ok", result);
    verify(callback, times(1)).onFailure(eq(1), any(IllegalStateException.class));
    verify(callback, never()).onFailure(eq(2), any(Exception.class));
  }

  @Test
  public void throwingCallbackStopsAsyncExecution() throws Exception {
    FailureCallback callback = mock(FailureCallback.class);
    IllegalArgumentException boom = new IllegalArgumentException("callback");
    doThrow(boom).when(callback).onFailure(anyInt(), any(Exception.class));
    AtomicInteger calls = new AtomicInteger();

    ExecutionException ex = assertThrows(ExecutionException.class, () ->
        RetryPolicy.defaults()
            .withInterval(Duration.ZERO)
            .withExecutor(Runnable::run)
            .onFailure(callback)
            .executeAsync(() -> {
              calls.incrementAndGet();
              throw new IllegalStateException("op");
            })
            .get());

    assertEquals(boom, ex.getCause());
    assertEquals(1, calls.get());
    verify(callback).onFailure(eq(1), any(IllegalStateException.class));
  }
}
