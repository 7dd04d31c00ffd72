package nl.adgroot.pdfocr.pdf;

import java.util.List;

/**
 * A standalone PDF holding a subset of the source pages.
 * - pageMapping: absolute page numbers of the source, in payload order
 * - payload: serialized PDF bytes
 */
public record PdfChunk(
    List<Integer> pageMapping,
    byte[] payload
) {

  public PdfChunk {
    pageMapping = List.copyOf(pageMapping);
  }

  public int pageCount() {
    return pageMapping.size();
  }
}
