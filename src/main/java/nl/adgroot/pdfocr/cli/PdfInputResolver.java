package nl.adgroot.pdfocr.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import nl.adgroot.pdfocr.DocumentProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands the command line input into the PDFs to process: a directory becomes its PDFs sorted
 * by file name, a path without extension falls back to {@code <path>.pdf}.
 */
public final class PdfInputResolver {

  private static final Logger log = LoggerFactory.getLogger(PdfInputResolver.class);

  private PdfInputResolver() {
    // utility class
  }

  public static List<Path> resolve(Path input) throws IOException {
    if (Files.isDirectory(input)) {
      List<Path> pdfs = listPdfs(input);
      log.info("Found {} PDF files in {}", pdfs.size(), input);
      return pdfs;
    }
    if (Files.isRegularFile(input)) {
      return List.of(input);
    }

    Path withExtension = input.resolveSibling(input.getFileName() + ".pdf");
    if (Files.isRegularFile(withExtension)) {
      log.info("Using {}", withExtension);
      return List.of(withExtension);
    }
    throw new DocumentProcessingException("PDF file not found: " + input);
  }

  static List<Path> listPdfs(Path dir) throws IOException {
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .toList();
    }
  }
}
