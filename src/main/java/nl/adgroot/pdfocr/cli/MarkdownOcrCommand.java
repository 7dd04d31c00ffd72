package nl.adgroot.pdfocr.cli;

import java.io.IOException;
import java.util.Map;
import nl.adgroot.pdfocr.DocumentProcessor;
import nl.adgroot.pdfocr.batch.BatchRunner;
import nl.adgroot.pdfocr.batch.RequestBuilder;
import nl.adgroot.pdfocr.batch.Sleeper;
import nl.adgroot.pdfocr.config.AppConfig;
import nl.adgroot.pdfocr.llm.BatchClient;
import nl.adgroot.pdfocr.llm.InferenceRequest;
import nl.adgroot.pdfocr.markdown.MarkdownOcrService;
import nl.adgroot.pdfocr.markdown.MarkerResponseValidator;
import nl.adgroot.pdfocr.pdf.PdfBoxPageChunker;
import nl.adgroot.pdfocr.prompts.PromptTemplate;
import picocli.CommandLine.Command;

@Command(
    name = "markdown",
    mixinStandardHelpOptions = true,
    description = "Transcribe pages to <name>.md with page boundary markers. "
        + "Use merge-pages afterwards to join pages into continuous text."
)
public class MarkdownOcrCommand extends OcrCommand {

  @Override
  protected String promptResource() {
    return PromptTemplate.MARKDOWN_OCR;
  }

  @Override
  protected String responseMimeType() {
    return InferenceRequest.MIME_TEXT;
  }

  @Override
  protected String defaultContext() throws IOException {
    return PromptTemplate.fromClasspath(PromptTemplate.GENERAL_CONTEXT).render(Map.of());
  }

  @Override
  protected DocumentProcessor createProcessor(BatchClient client, RequestBuilder requestBuilder, AppConfig cfg) {
    BatchRunner<String> runner = new BatchRunner<>(
        client, requestBuilder, new MarkerResponseValidator(), cfg.batch, Sleeper.SYSTEM);
    return new MarkdownOcrService(new PdfBoxPageChunker(), runner);
  }
}
