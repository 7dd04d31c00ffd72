package nl.adgroot.pdfocr.batch;

import java.util.List;
import nl.adgroot.pdfocr.pdf.PdfChunk;
import org.jetbrains.annotations.NotNull;

/**
 * One chunk travelling through the submit/poll/validate waves. Identity is the page mapping.
 */
public final class BatchTask {

  private final List<Integer> pageMapping;
  private final byte[] payload;
  private final int retryCount;

  public BatchTask(List<Integer> pageMapping, byte[] payload, int retryCount) {
    if (pageMapping == null || pageMapping.isEmpty()) {
      throw new IllegalArgumentException("pageMapping must not be empty");
    }
    if (retryCount < 0) {
      throw new IllegalArgumentException("retryCount must be >= 0, was " + retryCount);
    }
    this.pageMapping = List.copyOf(pageMapping);
    this.payload = payload;
    this.retryCount = retryCount;
  }

  public static BatchTask of(PdfChunk chunk) {
    return new BatchTask(chunk.pageMapping(), chunk.payload(), 0);
  }

  /** Same pages and payload bytes, one more attempt used. */
  public BatchTask nextAttempt() {
    return new BatchTask(pageMapping, payload, retryCount + 1);
  }

  public List<Integer> pageMapping() {
    return pageMapping;
  }

  public byte[] payload() {
    return payload;
  }

  public int retryCount() {
    return retryCount;
  }

  public int pageCount() {
    return pageMapping.size();
  }

  public int firstPage() {
    return pageMapping.get(0);
  }

  /** Absolute page number for a 1-based index inside this chunk. */
  public int absolutePage(int relativePage) {
    if (relativePage < 1 || relativePage > pageMapping.size()) {
      throw new IndexOutOfBoundsException(
          "Relative page " + relativePage + " outside 1.." + pageMapping.size());
    }
    return pageMapping.get(relativePage - 1);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof BatchTask t)) return false;
    return pageMapping.equals(t.pageMapping);
  }

  @Override
  public int hashCode() {
    return pageMapping.hashCode();
  }

  @NotNull
  @Override
  public String toString() {
    return "pages " + pageMapping + " (attempt " + (retryCount + 1) + ")";
  }
}
