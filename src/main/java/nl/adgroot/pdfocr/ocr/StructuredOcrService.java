package nl.adgroot.pdfocr.ocr;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import nl.adgroot.pdfocr.DocumentProcessingException;
import nl.adgroot.pdfocr.DocumentProcessor;
import nl.adgroot.pdfocr.DocumentResult;
import nl.adgroot.pdfocr.batch.AcceptedResult;
import nl.adgroot.pdfocr.batch.BatchRunReport;
import nl.adgroot.pdfocr.batch.BatchRunner;
import nl.adgroot.pdfocr.pdf.PageRange;
import nl.adgroot.pdfocr.pdf.PdfBoxPageChunker;
import nl.adgroot.pdfocr.pdf.PdfChunk;
import nl.adgroot.pdfocr.pdf.PdfPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured mode for one PDF: pages missing from {@code <stem>.json} are extracted, merged into
 * it, and {@code <stem>.md} is rendered from the full page list.
 */
public class StructuredOcrService implements DocumentProcessor {

  private static final Logger log = LoggerFactory.getLogger(StructuredOcrService.class);

  private final PdfBoxPageChunker chunker;
  private final BatchRunner<List<OcrPage>> runner;
  private final BlockMarkdownRenderer renderer;

  public StructuredOcrService(PdfBoxPageChunker chunker, BatchRunner<List<OcrPage>> runner) {
    this(chunker, runner, new BlockMarkdownRenderer());
  }

  public StructuredOcrService(
      PdfBoxPageChunker chunker,
      BatchRunner<List<OcrPage>> runner,
      BlockMarkdownRenderer renderer
  ) {
    this.chunker = chunker;
    this.runner = runner;
    this.renderer = renderer;
  }

  @Override
  public DocumentResult process(Path pdfPath, int startPage, Integer endPage, int batchSize) throws IOException {
    if (!Files.isRegularFile(pdfPath)) {
      throw new DocumentProcessingException("PDF file not found: " + pdfPath);
    }
    Instant start = Instant.now();

    PageStore store = new PageStore(PdfPaths.withExtension(pdfPath, ".json"));
    Path mdPath = PdfPaths.withExtension(pdfPath, ".md");

    List<OcrPage> existing = store.load();
    Set<Integer> done = PageStore.pageNumbers(existing);

    int totalPages = chunker.pageCount(pdfPath);
    List<Integer> target = PageRange.resolve(startPage, endPage, totalPages);
    List<Integer> missing = target.stream().filter(p -> !done.contains(p)).sorted().toList();

    if (missing.isEmpty()) {
      log.info("All pages {}-{} of {} already exist in {}",
          target.get(0), target.get(target.size() - 1), pdfPath.getFileName(), store.path().getFileName());
      writeMarkdown(mdPath, existing);
      return new DocumentResult(store.path(), existing.size(), List.of());
    }

    log.info("Processing {} missing pages: {}", missing.size(), missing);
    List<PdfChunk> chunks = chunker.chunk(pdfPath, missing, batchSize);
    BatchRunReport<List<OcrPage>> report = runner.run(chunks);

    List<OcrPage> extracted = new ArrayList<>();
    for (AcceptedResult<List<OcrPage>> r : report.results()) {
      extracted.addAll(PageRemapper.toAbsolute(r.task(), r.value()));
    }

    List<OcrPage> all = PageStore.merge(existing, extracted);
    if (all.isEmpty()) {
      throw new DocumentProcessingException("No data could be extracted from " + pdfPath.getFileName());
    }
    if (!report.isComplete()) {
      log.warn("{}: pages {} could not be extracted and are missing from the output",
          pdfPath.getFileName(), report.droppedPages());
    }

    store.save(all);
    log.info("Saved {} pages to {}", all.size(), store.path());
    writeMarkdown(mdPath, all);

    log.info("Total processing time for {}: {}s",
        pdfPath.getFileName(), Duration.between(start, Instant.now()).toSeconds());
    return new DocumentResult(store.path(), all.size(), report.droppedPages());
  }

  private void writeMarkdown(Path mdPath, List<OcrPage> pages) throws IOException {
    Files.writeString(mdPath, renderer.render(pages), StandardCharsets.UTF_8);
    log.info("Generated Markdown: {}", mdPath);
  }
}
