package nl.adgroot.pdfocr.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import nl.adgroot.pdfocr.DocumentProcessingException;
import nl.adgroot.pdfocr.DocumentProcessor;
import nl.adgroot.pdfocr.DocumentResult;
import nl.adgroot.pdfocr.batch.RequestBuilder;
import nl.adgroot.pdfocr.config.AppConfig;
import nl.adgroot.pdfocr.config.ConfigLoader;
import nl.adgroot.pdfocr.llm.BatchClient;
import nl.adgroot.pdfocr.llm.GeminiBatchClient;
import nl.adgroot.pdfocr.pdf.InvalidPageRangeException;
import nl.adgroot.pdfocr.prompts.PromptTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Options and the per-document loop shared by the OCR subcommands. Subclasses pick the prompt,
 * the response type and the pipeline.
 */
abstract class OcrCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(OcrCommand.class);

  @Spec
  CommandSpec spec;

  @Parameters(index = "0", arity = "0..1", description = "PDF file or directory of PDF files")
  Path input;

  @Option(names = "--batch-size", description = "Pages per request (default: batch.batchSize from config)")
  Integer batchSize;

  @Option(names = "--start-page", defaultValue = "1", description = "First page, 1-based (default: ${DEFAULT-VALUE})")
  int startPage;

  @Option(names = "--end-page", description = "Last page, inclusive (default: last page)")
  Integer endPage;

  @Option(names = "--config", description = "JSON config file (default: ai_config.json, then built-in)")
  Path configPath;

  @Option(names = "--context-file", description = "Extra document context inserted into the prompt")
  Path contextFile;

  @Option(names = "--show-prompt", description = "Print the prompt and exit without processing")
  boolean showPrompt;

  protected abstract String promptResource();

  protected abstract String responseMimeType();

  /** Context used when no {@code --context-file} is given. */
  protected String defaultContext() throws IOException {
    return "";
  }

  protected abstract DocumentProcessor createProcessor(BatchClient client, RequestBuilder requestBuilder, AppConfig cfg);

  @Override
  public Integer call() throws IOException {
    AppConfig cfg = ConfigLoader.loadDefault(configPath);
    int pagesPerRequest = batchSize != null ? batchSize : cfg.batch.batchSize;
    if (pagesPerRequest < 1) {
      throw new ParameterException(spec.commandLine(), "--batch-size must be at least 1");
    }

    RequestBuilder requestBuilder = new RequestBuilder(
        PromptTemplate.fromClasspath(promptResource()),
        readContext(),
        responseMimeType(),
        cfg.gemini.temperature);

    if (showPrompt) {
      spec.commandLine().getOut().println(requestBuilder.instructionsFor(pagesPerRequest));
      spec.commandLine().getOut().flush();
      return 0;
    }
    if (input == null) {
      throw new ParameterException(spec.commandLine(), "Missing input path (required unless --show-prompt is used)");
    }

    List<Path> pdfs;
    try {
      pdfs = PdfInputResolver.resolve(input);
    } catch (DocumentProcessingException e) {
      log.error(e.getMessage());
      return 1;
    }
    if (pdfs.isEmpty()) {
      log.warn("No PDF files found in {}", input);
      return 0;
    }

    BatchClient client;
    try {
      client = new GeminiBatchClient(cfg.gemini);
    } catch (IllegalStateException e) {
      log.error(e.getMessage());
      return 1;
    }
    DocumentProcessor processor = createProcessor(client, requestBuilder, cfg);

    int failed = 0;
    for (Path pdf : pdfs) {
      if (!processOne(processor, pdf, pagesPerRequest)) {
        failed++;
      }
    }

    if (pdfs.size() > 1) {
      log.info("Finished {} documents: {} succeeded, {} failed", pdfs.size(), pdfs.size() - failed, failed);
    }
    return failed == 0 ? 0 : 1;
  }

  private boolean processOne(DocumentProcessor processor, Path pdf, int pagesPerRequest) {
    log.info("Starting: {}", pdf.getFileName());
    try {
      DocumentResult result = processor.process(pdf, startPage, endPage, pagesPerRequest);
      if (result.isComplete()) {
        log.info("SUCCESS {}: {} pages -> {}", pdf.getFileName(), result.pagesWritten(), result.output());
      } else {
        log.warn("PARTIAL {}: {} pages -> {}, missing pages {}",
            pdf.getFileName(), result.pagesWritten(), result.output(), result.droppedPages());
      }
      return true;
    } catch (DocumentProcessingException | InvalidPageRangeException | IOException e) {
      log.error("FAILED {}: {}", pdf.getFileName(), e.getMessage());
      return false;
    } catch (RuntimeException e) {
      log.error("FAILED {}: unexpected error", pdf.getFileName(), e);
      return false;
    }
  }

  private String readContext() throws IOException {
    if (contextFile == null) {
      return defaultContext();
    }
    return Files.readString(contextFile, StandardCharsets.UTF_8);
  }
}
