package nl.adgroot.pdfocr.markdown;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import nl.adgroot.pdfocr.batch.BatchTask;
import nl.adgroot.pdfocr.batch.Validation;
import nl.adgroot.pdfocr.pdf.PdfChunk;
import org.junit.jupiter.api.Test;

class MarkerResponseValidatorTest {

  private final MarkerResponseValidator validator = new MarkerResponseValidator();
  private final BatchTask twoPages = BatchTask.of(new PdfChunk(List.of(8, 9), new byte[0]));

  @Test
  void acceptsOneBeginAndOneEndPerPage() {
    String text = "=-- Begin Page 1 --=\na\n=-- End Printed Page 3 --=\n=-- Begin Page 2 (Continuation) --=\nb\n=-- End Printed Page N/A --=";

    Validation<String> v = validator.validate(twoPages, text);

    assertTrue(v.accepted(), v.reason());
    assertEquals(text, v.value());
  }

  @Test
  void rejectsMissingEndMarker() {
    String text = "=-- Begin Page 1 --=\na\n=-- End Printed Page 3 --=\n=-- Begin Page 2 --=\nb";

    Validation<String> v = validator.validate(twoPages, text);

    assertFalse(v.accepted());
    assertEquals("Page marker count mismatch (expected 2, begin 2, end 1)", v.reason());
  }

  @Test
  void rejectsExtraBeginMarker() {
    String text = "=-- Begin Page 1 --=\n=-- Begin Page 1 --=\na\n=-- End Printed Page 3 --=\n=-- Begin Page 2 --=\nb\n=-- End Printed Page 4 --=";

    assertFalse(validator.validate(twoPages, text).accepted());
  }

  @Test
  void rejectsBlankResponse() {
    assertFalse(validator.validate(twoPages, "  ").accepted());
  }
}
