package nl.adgroot.pdfocr.batch;

import java.util.List;

/**
 * Outcome of a complete run: accepted results, tasks dropped after their last retry, and the
 * number of waves it took.
 */
public record BatchRunReport<T>(
    List<AcceptedResult<T>> results,
    List<BatchTask> dropped,
    int waves
) {

  public BatchRunReport {
    results = List.copyOf(results);
    dropped = List.copyOf(dropped);
  }

  public boolean isComplete() {
    return dropped.isEmpty();
  }

  public List<Integer> droppedPages() {
    return dropped.stream()
        .flatMap(t -> t.pageMapping().stream())
        .sorted()
        .toList();
  }
}
