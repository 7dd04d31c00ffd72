package nl.adgroot.pdfocr.pdf;

import java.io.IOException;
import java.nio.file.Path;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;

public final class TestPdfs {

  private TestPdfs() {
  }

  /** Writes a PDF whose page {@code n} is {@code 100 + n} points wide, so pages can be told apart. */
  public static Path write(Path file, int pages) throws IOException {
    try (PDDocument doc = new PDDocument()) {
      for (int i = 1; i <= pages; i++) {
        doc.addPage(new PDPage(new PDRectangle(100 + i, 200)));
      }
      doc.save(file.toFile());
    }
    return file;
  }

  public static int pageNumberOf(PDPage page) {
    return Math.round(page.getMediaBox().getWidth()) - 100;
  }
}
