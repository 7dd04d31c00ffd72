package nl.adgroot.pdfocr.batch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import nl.adgroot.pdfocr.config.AppConfig;
import nl.adgroot.pdfocr.llm.BatchClient;
import nl.adgroot.pdfocr.llm.InlinedResponse;
import nl.adgroot.pdfocr.llm.JobSnapshot;
import nl.adgroot.pdfocr.pdf.PdfChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives waves until the pending queue is empty:
 * - drain the queue
 * - pack and create jobs (creation failures go back to the queue)
 * - poll until every job is terminal
 * - validate each response; accepted results accumulate, rejected tasks are requeued or dropped
 * - wait the retry delay and start the next wave if anything is pending
 *
 * Per-task failures never abort sibling tasks.
 */
public class BatchRunner<T> {

  private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

  private final BatchClient client;
  private final RequestBuilder requestBuilder;
  private final ResponseValidator<T> validator;
  private final AppConfig.BatchConfig cfg;
  private final Sleeper sleeper;

  public BatchRunner(
      BatchClient client,
      RequestBuilder requestBuilder,
      ResponseValidator<T> validator,
      AppConfig.BatchConfig cfg,
      Sleeper sleeper
  ) {
    this.client = client;
    this.requestBuilder = requestBuilder;
    this.validator = validator;
    this.cfg = cfg;
    this.sleeper = sleeper;
  }

  public BatchRunReport<T> run(List<PdfChunk> chunks) {
    return runTasks(chunks.stream().map(BatchTask::of).toList());
  }

  public BatchRunReport<T> runTasks(List<BatchTask> tasks) {
    RetryScheduler scheduler = new RetryScheduler(cfg.maxRetries);
    tasks.forEach(scheduler::enqueue);

    JobSubmitter submitter = new JobSubmitter(client, requestBuilder, cfg.maxPayloadBytes);
    JobPoller poller = new JobPoller(
        client,
        sleeper,
        Duration.ofSeconds(cfg.pollIntervalSeconds),
        Duration.ofSeconds(cfg.pollErrorDelaySeconds));

    ProgressTracker tracker = new ProgressTracker(tasks.size());
    List<AcceptedResult<T>> results = new ArrayList<>();
    int waves = 0;

    while (scheduler.hasPending()) {
      List<BatchTask> wave = scheduler.drainWave();
      waves++;
      log.info("Wave {}: {} tasks", waves, wave.size());
      tracker.attempted(wave.size());

      List<BatchJob> active = submitter.submit(wave, scheduler);
      poller.awaitAll(active, (job, snapshot) -> collect(job, snapshot, scheduler, results, tracker));

      tracker.droppedSoFar(scheduler.dropped().size());
      log.info(tracker.formatStatus());

      if (scheduler.hasPending()) {
        log.info("{} tasks scheduled for retry. Waiting {}s...", scheduler.pendingCount(), cfg.retryDelaySeconds);
        pause(Duration.ofSeconds(cfg.retryDelaySeconds));
      }
    }

    return new BatchRunReport<>(results, scheduler.dropped(), waves);
  }

  private void collect(
      BatchJob job,
      JobSnapshot snapshot,
      RetryScheduler scheduler,
      List<AcceptedResult<T>> results,
      ProgressTracker tracker
  ) {
    List<BatchTask> tasks = job.getTasks();

    if (job.getStatus() != JobStatus.SUCCEEDED) {
      log.error("Job {} failed with state {}: {}", job.getName(), snapshot.state(), snapshot.error());
      for (BatchTask task : tasks) {
        scheduler.reject(task, "job ended in state " + snapshot.state());
      }
      return;
    }

    List<InlinedResponse> responses = snapshot.responses();
    for (int i = 0; i < tasks.size(); i++) {
      BatchTask task = tasks.get(i);
      try {
        String reason = accept(task, i < responses.size() ? responses.get(i) : null, results);
        if (reason == null) {
          tracker.accepted();
        } else {
          log.warn("Rejected response for pages {}: {}", task.pageMapping(), reason);
          scheduler.reject(task, reason);
        }
      } catch (RuntimeException e) {
        log.warn("Handling response for pages {} failed: {}", task.pageMapping(), e.toString());
        scheduler.reject(task, "response handling failed: " + e.getMessage());
      }
    }
  }

  /** @return null when accepted, the rejection reason otherwise */
  private String accept(BatchTask task, InlinedResponse response, List<AcceptedResult<T>> results) {
    if (response == null) {
      return "no response returned for this request";
    }
    if (response.error() != null) {
      return "request error: " + response.error();
    }
    if (!response.hasText()) {
      return "empty response";
    }

    Validation<T> validation = validator.validate(task, response.text());
    if (!validation.accepted()) {
      return validation.reason();
    }
    results.add(new AcceptedResult<>(task, validation.value()));
    return null;
  }

  private void pause(Duration d) {
    try {
      sleeper.sleep(d);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for the next wave", e);
    }
  }
}
