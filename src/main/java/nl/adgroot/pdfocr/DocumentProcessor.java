package nl.adgroot.pdfocr;

import java.io.IOException;
import java.nio.file.Path;

/** One OCR output mode applied to a single PDF. */
public interface DocumentProcessor {

  /**
   * @param startPage first page, 1-based
   * @param endPage   last page, inclusive; null for the last page of the document
   * @param batchSize pages per chunk sent to the backend
   * @throws DocumentProcessingException when the input is missing or nothing could be extracted
   */
  DocumentResult process(Path pdfPath, int startPage, Integer endPage, int batchSize) throws IOException;
}
