package nl.adgroot.pdfocr.markdown;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import nl.adgroot.pdfocr.DocumentProcessingException;
import nl.adgroot.pdfocr.DocumentResult;
import nl.adgroot.pdfocr.batch.BatchRunner;
import nl.adgroot.pdfocr.batch.FakeBatchClient;
import nl.adgroot.pdfocr.batch.RecordingSleeper;
import nl.adgroot.pdfocr.batch.RequestBuilder;
import nl.adgroot.pdfocr.config.AppConfig;
import nl.adgroot.pdfocr.llm.InferenceRequest;
import nl.adgroot.pdfocr.llm.InlinedResponse;
import nl.adgroot.pdfocr.pdf.PdfBoxPageChunker;
import nl.adgroot.pdfocr.pdf.TestPdfs;
import nl.adgroot.pdfocr.prompts.PromptTemplate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MarkdownOcrServiceTest {

  @TempDir
  Path dir;

  private final AppConfig.BatchConfig cfg = new AppConfig.BatchConfig();

  @Test
  void process_writesStitchedMarkdown_withAbsoluteBeginMarkers() throws Exception {
    Path pdf = TestPdfs.write(dir.resolve("scan.pdf"), 5);
    FakeBatchClient client = new FakeBatchClient((pages, attempt) -> InlinedResponse.ofText(fragment(pages)));

    DocumentResult result = service(client).process(pdf, 2, null, 2);

    assertEquals(dir.resolve("scan.md"), result.output());
    assertEquals(4, result.pagesWritten());
    assertTrue(result.isComplete());

    String md = Files.readString(dir.resolve("scan.md"), StandardCharsets.UTF_8);
    assertEquals(
        "=-- Begin Page 2 --=\nText of page 2\n=-- End Printed Page N/A --=\n"
            + "=-- Begin Page 3 --=\nText of page 3\n=-- End Printed Page N/A --=\n\n"
            + "=-- Begin Page 4 --=\nText of page 4\n=-- End Printed Page N/A --=\n"
            + "=-- Begin Page 5 --=\nText of page 5\n=-- End Printed Page N/A --=\n\n",
        md);
  }

  @Test
  void markerMismatch_isRetriedUntilCorrect() throws Exception {
    Path pdf = TestPdfs.write(dir.resolve("retry.pdf"), 2);
    FakeBatchClient client = new FakeBatchClient((pages, attempt) ->
        attempt == 1 ? InlinedResponse.ofText("=-- Begin Page 1 --=\nonly half") : InlinedResponse.ofText(fragment(pages)));

    DocumentResult result = service(client).process(pdf, 1, null, 2);

    assertTrue(result.isComplete());
    assertEquals(2, client.createCalls);
    assertTrue(Files.readString(result.output(), StandardCharsets.UTF_8).contains("Text of page 2"));
  }

  @Test
  void droppedChunk_isLeftOut() throws Exception {
    cfg.maxRetries = 0;
    Path pdf = TestPdfs.write(dir.resolve("gap.pdf"), 4);
    FakeBatchClient client = new FakeBatchClient((pages, attempt) ->
        pages.contains(1) ? InlinedResponse.ofText("garbage") : InlinedResponse.ofText(fragment(pages)));

    DocumentResult result = service(client).process(pdf, 1, null, 2);

    assertEquals(List.of(1, 2), result.droppedPages());
    assertEquals(2, result.pagesWritten());
    String md = Files.readString(result.output(), StandardCharsets.UTF_8);
    assertTrue(md.startsWith("=-- Begin Page 3 --="), md);
  }

  @Test
  void nothingExtracted_fails() throws Exception {
    cfg.maxRetries = 0;
    Path pdf = TestPdfs.write(dir.resolve("none.pdf"), 1);
    FakeBatchClient client = new FakeBatchClient((pages, attempt) -> InlinedResponse.ofText(""));

    assertThrows(DocumentProcessingException.class, () -> service(client).process(pdf, 1, null, 1));
    assertFalse(Files.exists(dir.resolve("none.md")));
  }

  private MarkdownOcrService service(FakeBatchClient client) {
    RequestBuilder builder = new RequestBuilder(new PromptTemplate("{{numPages}}"), "", InferenceRequest.MIME_TEXT, 0.1);
    BatchRunner<String> runner =
        new BatchRunner<>(client, builder, new MarkerResponseValidator(), cfg, new RecordingSleeper());
    return new MarkdownOcrService(new PdfBoxPageChunker(), runner);
  }

  /** Chunk-relative begin markers, as the backend is instructed to write them. */
  private static String fragment(List<Integer> absolutePages) {
    return IntStream.rangeClosed(1, absolutePages.size())
        .mapToObj(rel -> "=-- Begin Page " + rel + " --=\nText of page " + absolutePages.get(rel - 1)
            + "\n=-- End Printed Page N/A --=")
        .collect(Collectors.joining("\n"));
  }
}
