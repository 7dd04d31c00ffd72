package nl.adgroot.pdfocr;

import java.nio.file.Path;
import java.util.List;

/**
 * What a document run produced.
 *
 * @param output       the main output file
 * @param pagesWritten pages present in the output
 * @param droppedPages pages that exhausted their retries in this run
 */
public record DocumentResult(Path output, int pagesWritten, List<Integer> droppedPages) {

  public DocumentResult {
    droppedPages = List.copyOf(droppedPages);
  }

  public boolean isComplete() {
    return droppedPages.isEmpty();
  }
}
