package nl.adgroot.pdfocr.batch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the pending queue. Tasks enter once, leave at the start of a wave, and come back only
 * through {@link #reject} until their retries are used up.
 */
public class RetryScheduler {

  private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

  private final int maxRetries;
  private final Deque<BatchTask> pending = new ArrayDeque<>();
  private final List<BatchTask> dropped = new ArrayList<>();

  public RetryScheduler(int maxRetries) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
    }
    this.maxRetries = maxRetries;
  }

  public void enqueue(BatchTask task) {
    pending.addLast(task);
  }

  /**
   * Requeues the task with one more attempt, or drops it when {@code maxRetries} is reached.
   *
   * @return {@code true} if requeued
   */
  public boolean reject(BatchTask task, String reason) {
    if (task.retryCount() < maxRetries) {
      BatchTask next = task.nextAttempt();
      log.info("Retrying pages {} (attempt {}/{}): {}",
          task.pageMapping(), next.retryCount() + 1, maxRetries + 1, reason);
      pending.addLast(next);
      return true;
    }
    log.error("Max retries reached, dropping pages {}: {}", task.pageMapping(), reason);
    dropped.add(task);
    return false;
  }

  /** Removes and returns everything pending, in arrival order. */
  public List<BatchTask> drainWave() {
    List<BatchTask> wave = new ArrayList<>(pending);
    pending.clear();
    return wave;
  }

  public boolean hasPending() {
    return !pending.isEmpty();
  }

  public int pendingCount() {
    return pending.size();
  }

  public List<BatchTask> dropped() {
    return Collections.unmodifiableList(dropped);
  }

  public int maxRetries() {
    return maxRetries;
  }
}
