package nl.adgroot.pdfocr.pdf;

import java.util.ArrayList;
import java.util.List;

public final class PageRange {

  private PageRange() {
    // utility class
  }

  /**
   * Resolves a 1-based inclusive page range against the document size.
   *
   * <p>{@code endPage == null} means the last page. The start is clamped to 1 and the end to
   * {@code totalPages}.
   *
   * @return absolute page numbers in ascending order
   * @throws InvalidPageRangeException if nothing remains after clamping
   */
  public static List<Integer> resolve(int startPage, Integer endPage, int totalPages) {
    int first = Math.max(1, startPage);
    int last = Math.min(totalPages, endPage == null ? totalPages : endPage);

    if (first > last) {
      throw new InvalidPageRangeException(
          "Invalid page range: " + startPage + " to " + (endPage == null ? "end" : endPage)
              + " (total pages: " + totalPages + ")");
    }

    List<Integer> pages = new ArrayList<>(last - first + 1);
    for (int p = first; p <= last; p++) {
      pages.add(p);
    }
    return pages;
  }

  /** Splits pages into consecutive groups of at most {@code batchSize}, keeping order. */
  public static List<List<Integer>> partition(List<Integer> pages, int batchSize) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
    }
    List<List<Integer>> groups = new ArrayList<>();
    for (int i = 0; i < pages.size(); i += batchSize) {
      groups.add(List.copyOf(pages.subList(i, Math.min(i + batchSize, pages.size()))));
    }
    return groups;
  }
}
