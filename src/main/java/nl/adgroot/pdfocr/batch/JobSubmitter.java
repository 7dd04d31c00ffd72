package nl.adgroot.pdfocr.batch;

import java.util.ArrayList;
import java.util.List;
import nl.adgroot.pdfocr.llm.BatchClient;
import nl.adgroot.pdfocr.llm.InferenceRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JobSubmitter {

  private static final Logger log = LoggerFactory.getLogger(JobSubmitter.class);

  private final BatchClient client;
  private final RequestBuilder requestBuilder;
  private final long maxPayloadBytes;

  public JobSubmitter(BatchClient client, RequestBuilder requestBuilder, long maxPayloadBytes) {
    this.client = client;
    this.requestBuilder = requestBuilder;
    this.maxPayloadBytes = maxPayloadBytes;
  }

  /**
   * Greedy first-fit packing in arrival order. A job is closed as soon as the next request
   * would push it over the budget; a request bigger than the budget on its own gets its own job.
   */
  public List<BatchJob> pack(List<BatchTask> tasks) {
    List<BatchJob> jobs = new ArrayList<>();
    BatchJob current = new BatchJob();

    for (BatchTask task : tasks) {
      InferenceRequest request = requestBuilder.build(task);
      long size = request.estimatedSize();

      if (!current.isEmpty() && current.getEstimatedSize() + size > maxPayloadBytes) {
        jobs.add(current);
        current = new BatchJob();
      }
      if (size > maxPayloadBytes) {
        log.warn("Request for pages {} is {} bytes, above the {} byte budget", task.pageMapping(), size, maxPayloadBytes);
      }
      current.add(task, request);
    }

    if (!current.isEmpty()) {
      jobs.add(current);
    }
    return jobs;
  }

  /**
   * Packs and creates the jobs of one wave. Tasks of a job that cannot be created go straight
   * to the scheduler.
   *
   * @return the jobs that exist on the backend
   */
  public List<BatchJob> submit(List<BatchTask> tasks, RetryScheduler scheduler) {
    List<BatchJob> jobs = pack(tasks);
    log.info("Submitting {} batch jobs ({} requests in total)", jobs.size(), tasks.size());

    long stamp = System.currentTimeMillis() / 1000;
    List<BatchJob> active = new ArrayList<>(jobs.size());

    for (int i = 0; i < jobs.size(); i++) {
      BatchJob job = jobs.get(i);
      log.info("Creating batch job {}/{} with {} requests (~{} KB)",
          i + 1, jobs.size(), job.getRequests().size(), job.getEstimatedSize() / 1024);
      try {
        job.setName(client.createJob(job.getRequests(), "ocr_batch_" + i + "_" + stamp));
        active.add(job);
      } catch (Exception e) {
        log.error("Failed to create batch job {}/{}: {}", i + 1, jobs.size(), e.toString());
        job.setStatus(JobStatus.FAILED);
        for (BatchTask task : job.getTasks()) {
          scheduler.reject(task, "job creation failed");
        }
      }
    }
    return active;
  }
}
