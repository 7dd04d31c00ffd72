package nl.adgroot.pdfocr.markdown;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import nl.adgroot.pdfocr.DocumentProcessingException;
import nl.adgroot.pdfocr.DocumentProcessor;
import nl.adgroot.pdfocr.DocumentResult;
import nl.adgroot.pdfocr.batch.BatchRunReport;
import nl.adgroot.pdfocr.batch.BatchRunner;
import nl.adgroot.pdfocr.pdf.PageRange;
import nl.adgroot.pdfocr.pdf.PdfBoxPageChunker;
import nl.adgroot.pdfocr.pdf.PdfChunk;
import nl.adgroot.pdfocr.pdf.PdfPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Markdown mode for one PDF: writes {@code <stem>.md} with absolute page markers. */
public class MarkdownOcrService implements DocumentProcessor {

  private static final Logger log = LoggerFactory.getLogger(MarkdownOcrService.class);

  private final PdfBoxPageChunker chunker;
  private final BatchRunner<String> runner;
  private final MarkdownPageStitcher stitcher;

  public MarkdownOcrService(PdfBoxPageChunker chunker, BatchRunner<String> runner) {
    this(chunker, runner, new MarkdownPageStitcher());
  }

  public MarkdownOcrService(PdfBoxPageChunker chunker, BatchRunner<String> runner, MarkdownPageStitcher stitcher) {
    this.chunker = chunker;
    this.runner = runner;
    this.stitcher = stitcher;
  }

  @Override
  public DocumentResult process(Path pdfPath, int startPage, Integer endPage, int batchSize) throws IOException {
    if (!Files.isRegularFile(pdfPath)) {
      throw new DocumentProcessingException("PDF file not found: " + pdfPath);
    }
    Instant start = Instant.now();
    Path mdPath = PdfPaths.withExtension(pdfPath, ".md");

    int totalPages = chunker.pageCount(pdfPath);
    List<Integer> target = PageRange.resolve(startPage, endPage, totalPages);
    log.info("Target pages of {}: {}", pdfPath.getFileName(), target);

    List<PdfChunk> chunks = chunker.chunk(pdfPath, target, batchSize);
    BatchRunReport<String> report = runner.run(chunks);

    if (report.results().isEmpty()) {
      throw new DocumentProcessingException("No data could be extracted from " + pdfPath.getFileName());
    }
    if (!report.isComplete()) {
      log.warn("{}: pages {} could not be extracted and are missing from the output",
          pdfPath.getFileName(), report.droppedPages());
    }

    Files.writeString(mdPath, stitcher.stitch(report.results()), StandardCharsets.UTF_8);
    log.info("Saved Markdown: {}", mdPath);
    log.info("Total processing time for {}: {}s",
        pdfPath.getFileName(), Duration.between(start, Instant.now()).toSeconds());

    int pagesWritten = report.results().stream().mapToInt(r -> r.task().pageCount()).sum();
    return new DocumentResult(mdPath, pagesWritten, report.droppedPages());
  }
}
