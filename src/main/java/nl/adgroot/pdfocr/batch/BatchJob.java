package nl.adgroot.pdfocr.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import nl.adgroot.pdfocr.llm.InferenceRequest;

/**
 * Requests and the tasks they were built from, in 1:1 positional order.
 */
public class BatchJob {

  private final List<InferenceRequest> requests = new ArrayList<>();
  private final List<BatchTask> tasks = new ArrayList<>();
  private long estimatedSize;

  private String name;                    // backend job name, set once created
  private JobStatus status = JobStatus.PENDING;

  void add(BatchTask task, InferenceRequest request) {
    tasks.add(task);
    requests.add(request);
    estimatedSize += request.estimatedSize();
  }

  public boolean isEmpty() {
    return tasks.isEmpty();
  }

  public List<InferenceRequest> getRequests() {
    return Collections.unmodifiableList(requests);
  }

  public List<BatchTask> getTasks() {
    return Collections.unmodifiableList(tasks);
  }

  public long getEstimatedSize() {
    return estimatedSize;
  }

  public String getName() {
    return name;
  }

  void setName(String name) {
    this.name = name;
  }

  public JobStatus getStatus() {
    return status;
  }

  void setStatus(JobStatus status) {
    this.status = status;
  }

  public boolean isTerminal() {
    return status != JobStatus.PENDING;
  }
}
