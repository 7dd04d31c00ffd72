package nl.adgroot.pdfocr.pdf;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfBoxPageChunker {

  private static final Logger log = LoggerFactory.getLogger(PdfBoxPageChunker.class);

  public int pageCount(Path pdfPath) throws IOException {
    try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
      return document.getNumberOfPages();
    }
  }

  /**
   * Copies the given pages into one in-memory PDF per group of {@code batchSize} pages.
   *
   * @param pages absolute 1-based page numbers, already in the desired order
   */
  public List<PdfChunk> chunk(Path pdfPath, List<Integer> pages, int batchSize) throws IOException {
    List<List<Integer>> groups = PageRange.partition(pages, batchSize);

    try (PDDocument source = Loader.loadPDF(pdfPath.toFile())) {
      List<PdfChunk> chunks = new ArrayList<>(groups.size());
      for (List<Integer> group : groups) {
        chunks.add(new PdfChunk(group, extract(source, group)));
      }
      log.info("Prepared {} chunks from {} pages of {}", chunks.size(), pages.size(), pdfPath.getFileName());
      return chunks;
    }
  }

  private static byte[] extract(PDDocument source, List<Integer> pageNumbers) throws IOException {
    int total = source.getNumberOfPages();

    // the chunk must be saved while the source is still open
    try (PDDocument chunk = new PDDocument()) {
      for (int pageNr : pageNumbers) {
        if (pageNr < 1 || pageNr > total) {
          throw new InvalidPageRangeException("Page " + pageNr + " is outside 1.." + total);
        }
        chunk.importPage(source.getPage(pageNr - 1));
      }

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      chunk.save(out);
      return out.toByteArray();
    }
  }
}
