package nl.adgroot.pdfocr.batch;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import nl.adgroot.pdfocr.llm.BatchClient;
import nl.adgroot.pdfocr.llm.JobSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking round-robin poller. One sweep checks every job that is not terminal yet, then sleeps.
 */
public class JobPoller {

  private static final Logger log = LoggerFactory.getLogger(JobPoller.class);

  @FunctionalInterface
  public interface CompletionHandler {
    void onDone(BatchJob job, JobSnapshot snapshot);
  }

  private final BatchClient client;
  private final Sleeper sleeper;
  private final Duration pollInterval;
  private final Duration errorDelay;

  public JobPoller(BatchClient client, Sleeper sleeper, Duration pollInterval, Duration errorDelay) {
    this.client = client;
    this.sleeper = sleeper;
    this.pollInterval = pollInterval;
    this.errorDelay = errorDelay;
  }

  /** Returns once every job is terminal. There is no overall timeout. */
  public void awaitAll(List<BatchJob> jobs, CompletionHandler handler) {
    if (jobs.isEmpty()) {
      return;
    }
    log.info("Waiting for {} jobs to complete...", jobs.size());
    Instant start = Instant.now();

    while (true) {
      for (int i = 0; i < jobs.size(); i++) {
        BatchJob job = jobs.get(i);
        if (job.isTerminal()) {
          continue;
        }

        JobSnapshot snapshot;
        try {
          snapshot = client.getJob(job.getName());
        } catch (Exception e) {
          log.warn("Failed to get status of job {}: {}", job.getName(), e.toString());
          pause(errorDelay);
          continue;
        }

        if (!snapshot.done()) {
          continue;
        }

        job.setStatus(snapshot.succeeded() ? JobStatus.SUCCEEDED : JobStatus.FAILED);
        log.info("Job {}/{} finished with state {} (elapsed {}s)",
            i + 1, jobs.size(), snapshot.state(), Duration.between(start, Instant.now()).toSeconds());
        handler.onDone(job, snapshot);
      }

      long open = jobs.stream().filter(j -> !j.isTerminal()).count();
      if (open == 0) {
        return;
      }
      log.info("Processing... {} of {} jobs still running ({}s elapsed)",
          open, jobs.size(), Duration.between(start, Instant.now()).toSeconds());
      pause(pollInterval);
    }
  }

  private void pause(Duration d) {
    try {
      sleeper.sleep(d);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while polling batch jobs", e);
    }
  }
}
