package nl.adgroot.pdfocr.batch;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class RetrySchedulerTest {

  @Test
  void reject_requeuesWithIncrementedCounter_untilMaxRetries_thenDropsOnce() {
    RetryScheduler scheduler = new RetryScheduler(3);
    BatchTask last = BatchTask.of(FakeBatchClient.chunk(1, 2));

    for (int expectedRetry = 1; expectedRetry <= 3; expectedRetry++) {
      assertTrue(scheduler.reject(last, "bad"), "rejection " + expectedRetry + " should requeue");
      List<BatchTask> wave = scheduler.drainWave();
      assertEquals(1, wave.size());
      last = wave.get(0);
      assertEquals(expectedRetry, last.retryCount());
    }

    assertFalse(scheduler.reject(last, "still bad"));

    assertFalse(scheduler.hasPending());
    assertEquals(List.of(last), scheduler.dropped());
  }

  @Test
  void drainWave_returnsArrivalOrder_andEmptiesQueue() {
    RetryScheduler scheduler = new RetryScheduler(3);
    BatchTask a = BatchTask.of(FakeBatchClient.chunk(1));
    BatchTask b = BatchTask.of(FakeBatchClient.chunk(2));
    scheduler.enqueue(a);
    scheduler.enqueue(b);

    assertEquals(2, scheduler.pendingCount());
    assertEquals(List.of(a, b), scheduler.drainWave());
    assertFalse(scheduler.hasPending());
    assertTrue(scheduler.drainWave().isEmpty());
  }

  @Test
  void zeroRetries_dropsOnFirstRejection() {
    RetryScheduler scheduler = new RetryScheduler(0);
    BatchTask task = BatchTask.of(FakeBatchClient.chunk(7));

    assertFalse(scheduler.reject(task, "nope"));
    assertEquals(1, scheduler.dropped().size());
    assertFalse(scheduler.hasPending());
  }

  @Test
  void requeuedTask_keepsPayloadBytes() {
    RetryScheduler scheduler = new RetryScheduler(2);
    BatchTask task = BatchTask.of(FakeBatchClient.chunk(4, 5));

    scheduler.reject(task, "bad");
    BatchTask retried = scheduler.drainWave().get(0);

    assertSame(task.payload(), retried.payload());
    assertEquals(task, retried, "identity is the page mapping");
  }

  @Test
  void negativeMaxRetries_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> new RetryScheduler(-1));
  }
}
