package nl.adgroot.pdfocr.ocr;

import java.util.List;
import nl.adgroot.pdfocr.batch.BatchTask;

public final class PageRemapper {

  private PageRemapper() {
    // utility class
  }

  /**
   * Rewrites chunk-relative page numbers to absolute ones. Numbers outside the chunk are left
   * unchanged.
   */
  public static List<OcrPage> toAbsolute(BatchTask task, List<OcrPage> relativePages) {
    return relativePages.stream()
        .map(p -> p.pageNumber() >= 1 && p.pageNumber() <= task.pageCount()
            ? p.withPageNumber(task.absolutePage(p.pageNumber()))
            : p)
        .toList();
  }
}
