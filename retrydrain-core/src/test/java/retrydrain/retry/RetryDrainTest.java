package retrydrain.retry;

import org.junit.jupiter.api.Test;
import retrydrain.Drain;
import retrydrain.DrainException;
import retrydrain.FatalDrainException;
import retrydrain.Level;
import retrydrain.LogRecord;
import retrydrain.RetriesExhaustedException;
import retrydrain.TransientDrainException;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryDrainTest {

  private static final LogRecord RECORD = LogRecord.builder(Level.INFO, "Msg 1")
      .field("user", "alice")
      .build();

  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final CountingMetrics metrics = new CountingMetrics();

  private RetryDrain retrying(Drain inner, RetryPolicy policy) {
    return RetryDrain.builder()
        .drain(inner)
        .retryPolicy(policy)
        .sleeper(sleeper)
        .metrics(metrics)
        .build();
  }

  private static TransientDrainException transientFailure(int n) {
    return new TransientDrainException("Injected logger error " + n);
  }

  // ── Success ─────────────────────────────────────────────────────

  @Test
  void successOnFirstAttemptCallsInnerOnce() throws Exception {
    ScriptedDrain inner = new ScriptedDrain();
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(5, Duration.ofMillis(10)));

    drain.emit(RECORD);

    assertEquals(1, inner.calls());
    assertTrue(sleeper.sleeps.isEmpty());
    assertEquals(1, metrics.delivered.get());
    assertEquals(List.of(1), metrics.attempts);
  }

  @Test
  void successIgnoresPolicyEvenWithoutRetries() throws Exception {
    ScriptedDrain inner = new ScriptedDrain();
    RetryDrain drain = retrying(inner, RetryPolicy.noRetry());

    drain.emit(RECORD);
    drain.emit(RECORD);

    assertEquals(2, inner.calls());
  }

  // ── Fatal failures ──────────────────────────────────────────────

  @Test
  void fatalFailureIsRethrownAfterOneAttempt() {
    FatalDrainException fatal = new FatalDrainException("malformed record");
    ScriptedDrain inner = ScriptedDrain.alwaysFailing(fatal);
    AtomicInteger backoffCalls = new AtomicInteger();
    RetryPolicy policy = RetryPolicy.builder()
        .maxAttempts(5)
        .backoff(failed -> {
          backoffCalls.incrementAndGet();
          return 10;
        })
        .build();
    RetryDrain drain = retrying(inner, policy);

    FatalDrainException thrown = assertThrows(FatalDrainException.class, () -> drain.emit(RECORD));

    assertSame(fatal, thrown);
    assertEquals(1, inner.calls());
    assertEquals(0, backoffCalls.get());
    assertTrue(sleeper.sleeps.isEmpty());
    assertEquals(1, metrics.fatal.get());
  }

  @Test
  void uncheckedFatalFailureIsRethrownVerbatim() {
    IllegalStateException bug = new IllegalStateException("destination bug");
    ScriptedDrain inner = ScriptedDrain.alwaysFailing(bug);
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(3, Duration.ZERO));

    IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> drain.emit(RECORD));

    assertSame(bug, thrown);
    assertEquals(1, inner.calls());
  }

  @Test
  void unclassifiedDrainExceptionIsFatalByDefault() {
    DrainException plain = new DrainException("unknown");
    ScriptedDrain inner = ScriptedDrain.alwaysFailing(plain);
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(3, Duration.ZERO));

    DrainException thrown = assertThrows(DrainException.class, () -> drain.emit(RECORD));

    assertSame(plain, thrown);
    assertEquals(1, inner.calls());
  }

  @Test
  void fatalAfterTransientStopsRetrying() {
    FatalDrainException fatal = new FatalDrainException("permanently broken");
    ScriptedDrain inner = new ScriptedDrain(transientFailure(1), fatal);
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(5, Duration.ofMillis(7)));

    assertSame(fatal, assertThrows(FatalDrainException.class, () -> drain.emit(RECORD)));
    assertEquals(2, inner.calls());
    assertEquals(List.of(7L), sleeper.sleeps);
  }

  // ── Transient failures ──────────────────────────────────────────

  @Test
  void transientFailuresBelowBudgetEndInSuccess() throws Exception {
    ScriptedDrain inner = new ScriptedDrain(transientFailure(1), transientFailure(2));
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(4, Duration.ofMillis(10)));

    drain.emit(RECORD);

    assertEquals(3, inner.calls());
    assertEquals(List.of(10L, 10L), sleeper.sleeps);
    assertEquals(2, metrics.retried.get());
    assertEquals(1, metrics.delivered.get());
    assertEquals(List.of(3), metrics.attempts);
  }

  @Test
  void transientFailuresReachingBudgetAreExhausted() {
    TransientDrainException last = transientFailure(3);
    ScriptedDrain inner = new ScriptedDrain(transientFailure(1), transientFailure(2), last);
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(3, Duration.ofMillis(10)));

    RetriesExhaustedException thrown =
        assertThrows(RetriesExhaustedException.class, () -> drain.emit(RECORD));

    assertEquals(3, thrown.attempts());
    assertSame(last, thrown.getCause());
    assertEquals(3, inner.calls());
    assertEquals(List.of(10L, 10L), sleeper.sleeps);
    assertEquals(1, metrics.exhausted.get());
  }

  @Test
  void transientFailuresBeyondBudgetStopAtBudget() {
    ScriptedDrain inner = new ScriptedDrain(
        transientFailure(1), transientFailure(2), transientFailure(3), transientFailure(4));
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(2, Duration.ZERO));

    RetriesExhaustedException thrown =
        assertThrows(RetriesExhaustedException.class, () -> drain.emit(RECORD));

    assertEquals(2, thrown.attempts());
    assertEquals(2, inner.calls());
  }

  @Test
  void singleAttemptBudgetGivesUpWithoutDelay() {
    ScriptedDrain inner = ScriptedDrain.alwaysFailing(transientFailure(1));
    RetryDrain drain = retrying(inner, RetryPolicy.builder()
        .maxAttempts(1)
        .fixedDelay(Duration.ofSeconds(10))
        .build());

    RetriesExhaustedException thrown =
        assertThrows(RetriesExhaustedException.class, () -> drain.emit(RECORD));

    assertEquals(1, thrown.attempts());
    assertEquals(1, inner.calls());
    assertTrue(sleeper.sleeps.isEmpty());
  }

  @Test
  void ioCausedFailureIsRetried() throws Exception {
    ScriptedDrain inner = new ScriptedDrain(new DrainException("write failed", new IOException("broken pipe")));
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(2, Duration.ZERO));

    drain.emit(RECORD);

    assertEquals(2, inner.calls());
  }

  @Test
  void customClassifierDecidesWhatIsRetried() throws Exception {
    ScriptedDrain inner = new ScriptedDrain(new DrainException("unknown"), new IllegalStateException("flaky"));
    RetryDrain drain = retrying(inner, RetryPolicy.builder()
        .maxAttempts(3)
        .fixedDelay(Duration.ZERO)
        .classifier(FailureClassifier.ALWAYS_TRANSIENT)
        .build());

    drain.emit(RECORD);

    assertEquals(3, inner.calls());
  }

  // ── Delays ──────────────────────────────────────────────────────

  @Test
  void lastDelayIsReusedWhenSequenceRunsOut() {
    ScriptedDrain inner = ScriptedDrain.alwaysFailing(transientFailure(1));
    RetryDrain drain = retrying(inner, RetryPolicy.builder()
        .maxAttempts(5)
        .delays(Duration.ofMillis(10), Duration.ofMillis(20))
        .build());

    assertThrows(RetriesExhaustedException.class, () -> drain.emit(RECORD));

    assertEquals(5, inner.calls());
    assertEquals(List.of(10L, 20L, 20L, 20L), sleeper.sleeps);
    assertEquals(List.of(10L, 20L, 20L, 20L), metrics.delays);
  }

  @Test
  void backoffIsAskedForEachRetryInOrder() {
    List<Integer> asked = new ArrayList<>();
    ScriptedDrain inner = ScriptedDrain.alwaysFailing(transientFailure(1));
    RetryDrain drain = retrying(inner, RetryPolicy.builder()
        .maxAttempts(4)
        .backoff(failed -> {
          asked.add(failed);
          return failed * 100L;
        })
        .build());

    assertThrows(RetriesExhaustedException.class, () -> drain.emit(RECORD));

    assertEquals(List.of(1, 2, 3), asked);
    assertEquals(List.of(100L, 200L, 300L), sleeper.sleeps);
  }

  @Test
  void zeroDelaySkipsSleeping() throws Exception {
    ScriptedDrain inner = new ScriptedDrain(transientFailure(1));
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(2, Duration.ZERO));

    drain.emit(RECORD);

    assertTrue(sleeper.sleeps.isEmpty());
  }

  @Test
  void subMillisecondDelayStillSleeps() throws Exception {
    ScriptedDrain inner = new ScriptedDrain(transientFailure(1));
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(2, Duration.ofNanos(900_000)));

    drain.emit(RECORD);

    assertEquals(2, inner.calls());
    assertEquals(List.of(1L), sleeper.sleeps);
  }

  @Test
  void blocksCallerForAllDelays() throws Exception {
    ScriptedDrain inner = new ScriptedDrain(transientFailure(1), transientFailure(2));
    RetryDrain drain = new RetryDrain(inner, RetryPolicy.fixed(3, Duration.ofMillis(10)));

    long start = System.nanoTime();
    drain.emit(RECORD);
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertTrue(elapsedMs >= 20, "Expected at least 20ms, got: " + elapsedMs);
    assertEquals(3, inner.calls());
    for (LogRecord received : inner.received) {
      assertSame(RECORD, received);
      assertEquals("Msg 1", received.message());
      assertEquals(Map.of("user", "alice"), received.fields());
    }
  }

  @Test
  void interruptDuringDelayDoesNotAbortRetries() throws Exception {
    AtomicInteger sleeps = new AtomicInteger();
    ScriptedDrain inner = new ScriptedDrain(transientFailure(1), transientFailure(2));
    RetryDrain drain = RetryDrain.builder()
        .drain(inner)
        .retryPolicy(RetryPolicy.fixed(3, Duration.ofMillis(5)))
        .sleeper(millis -> {
          if (sleeps.incrementAndGet() == 1) {
            throw new InterruptedException("shutdown signal");
          }
        })
        .build();

    try {
      drain.emit(RECORD);

      assertEquals(3, inner.calls());
      assertTrue(sleeps.get() >= 2, "Interrupted delay should be resumed");
      assertTrue(Thread.currentThread().isInterrupted(), "Interrupt flag should be restored");
    } finally {
      Thread.interrupted();
    }
  }

  // ── Record identity ─────────────────────────────────────────────

  @Test
  void sameRecordInstanceIsResubmittedOnEveryAttempt() {
    ScriptedDrain inner = ScriptedDrain.alwaysFailing(transientFailure(1));
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(4, Duration.ZERO));

    assertThrows(RetriesExhaustedException.class, () -> drain.emit(RECORD));

    assertEquals(4, inner.received.size());
    inner.received.forEach(received -> assertSame(RECORD, received));
  }

  @Test
  void nullRecordIsRejected() {
    RetryDrain drain = retrying(new ScriptedDrain(), RetryPolicy.noRetry());

    assertThrows(NullPointerException.class, () -> drain.emit(null));
  }

  // ── Composition ─────────────────────────────────────────────────

  @Test
  void retryDrainCanWrapAnotherRetryDrain() {
    ScriptedDrain inner = ScriptedDrain.alwaysFailing(transientFailure(1));
    RetryDrain nested = retrying(inner, RetryPolicy.fixed(2, Duration.ZERO));
    RetryDrain outer = retrying(nested, RetryPolicy.fixed(3, Duration.ZERO));

    RetriesExhaustedException thrown =
        assertThrows(RetriesExhaustedException.class, () -> outer.emit(RECORD));

    assertEquals(3, thrown.attempts());
    assertInstanceOf(RetriesExhaustedException.class, thrown.getCause());
    assertEquals(6, inner.calls());
  }

  @Test
  void concurrentCallsRunIndependentLoops() throws Exception {
    Set<String> failedOnce = ConcurrentHashMap.newKeySet();
    AtomicInteger calls = new AtomicInteger();
    Drain inner = record -> {
      calls.incrementAndGet();
      if (failedOnce.add(record.recordId())) {
        throw new TransientDrainException("first attempt fails");
      }
    };
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(2, Duration.ZERO));
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        LogRecord record = LogRecord.of(Level.INFO, "Msg " + i);
        futures.add(pool.submit(() -> {
          start.await();
          drain.emit(record);
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(5, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(threads * 2, calls.get());
    assertEquals(threads, metrics.delivered.get());
  }

  // ── Lifecycle ───────────────────────────────────────────────────

  @Test
  void flushIsForwardedWithoutRetry() throws Exception {
    ScriptedDrain inner = new ScriptedDrain();
    RetryDrain drain = retrying(inner, RetryPolicy.defaultPolicy());

    drain.flush();

    assertEquals(1, inner.flushCount.get());
  }

  @Test
  void failingFlushPropagatesImmediately() {
    AtomicInteger flushes = new AtomicInteger();
    Drain inner = new Drain() {
      @Override
      public void emit(LogRecord record) {
      }

      @Override
      public void flush() throws DrainException {
        flushes.incrementAndGet();
        throw new TransientDrainException("disk busy");
      }
    };
    RetryDrain drain = retrying(inner, RetryPolicy.fixed(5, Duration.ZERO));

    assertThrows(TransientDrainException.class, drain::flush);
    assertEquals(1, flushes.get());
  }

  @Test
  void closeIsForwardedOnce() throws Exception {
    ScriptedDrain inner = new ScriptedDrain();
    RetryDrain drain = retrying(inner, RetryPolicy.defaultPolicy());

    drain.close();
    drain.close();

    assertEquals(1, inner.closeCount.get());
  }

  // ── Construction ────────────────────────────────────────────────

  @Test
  void builderRejectsMissingDrain() {
    assertThrows(NullPointerException.class, () -> RetryDrain.builder().build());
  }

  @Test
  void constructorRejectsNullPolicy() {
    assertThrows(NullPointerException.class, () -> new RetryDrain(new ScriptedDrain(), null));
  }

  @Test
  void builderDefaultsToDefaultPolicy() {
    RetryDrain drain = RetryDrain.builder().drain(new ScriptedDrain()).build();

    assertEquals(RetryPolicy.DEFAULT_MAX_ATTEMPTS, drain.retryPolicy().maxAttempts());
  }
}
