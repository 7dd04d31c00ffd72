package nl.adgroot.pdfocr.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import nl.adgroot.pdfocr.DocumentProcessingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfInputResolverTest {

  @TempDir
  Path dir;

  @Test
  void directory_yieldsPdfsSortedByName() throws Exception {
    Files.createFile(dir.resolve("b.pdf"));
    Files.createFile(dir.resolve("a.PDF"));
    Files.createFile(dir.resolve("notes.txt"));
    Files.createDirectory(dir.resolve("sub.pdf"));

    assertEquals(List.of(dir.resolve("a.PDF"), dir.resolve("b.pdf")), PdfInputResolver.resolve(dir));
  }

  @Test
  void existingFile_isUsedAsIs() throws Exception {
    Path pdf = Files.createFile(dir.resolve("doc.pdf"));

    assertEquals(List.of(pdf), PdfInputResolver.resolve(pdf));
  }

  @Test
  void nameWithoutExtension_fallsBackToPdf() throws Exception {
    Path pdf = Files.createFile(dir.resolve("doc.pdf"));

    assertEquals(List.of(pdf), PdfInputResolver.resolve(dir.resolve("doc")));
  }

  @Test
  void missingInput_fails() {
    assertThrows(DocumentProcessingException.class, () -> PdfInputResolver.resolve(dir.resolve("ghost")));
  }
}
