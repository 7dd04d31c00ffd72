package nl.adgroot.pdfocr.cli;

import java.util.List;
import nl.adgroot.pdfocr.DocumentProcessor;
import nl.adgroot.pdfocr.batch.BatchRunner;
import nl.adgroot.pdfocr.batch.RequestBuilder;
import nl.adgroot.pdfocr.batch.Sleeper;
import nl.adgroot.pdfocr.config.AppConfig;
import nl.adgroot.pdfocr.llm.BatchClient;
import nl.adgroot.pdfocr.llm.InferenceRequest;
import nl.adgroot.pdfocr.ocr.OcrPage;
import nl.adgroot.pdfocr.ocr.StructuredOcrService;
import nl.adgroot.pdfocr.ocr.StructuredResponseValidator;
import nl.adgroot.pdfocr.pdf.PdfBoxPageChunker;
import nl.adgroot.pdfocr.prompts.PromptTemplate;
import picocli.CommandLine.Command;

@Command(
    name = "json",
    mixinStandardHelpOptions = true,
    description = "Extract pages as structured blocks into <name>.json and render <name>.md. "
        + "Pages already in <name>.json are skipped."
)
public class JsonOcrCommand extends OcrCommand {

  @Override
  protected String promptResource() {
    return PromptTemplate.STRUCTURED_OCR;
  }

  @Override
  protected String responseMimeType() {
    return InferenceRequest.MIME_JSON;
  }

  @Override
  protected DocumentProcessor createProcessor(BatchClient client, RequestBuilder requestBuilder, AppConfig cfg) {
    BatchRunner<List<OcrPage>> runner = new BatchRunner<>(
        client, requestBuilder, new StructuredResponseValidator(), cfg.batch, Sleeper.SYSTEM);
    return new StructuredOcrService(new PdfBoxPageChunker(), runner);
  }
}
