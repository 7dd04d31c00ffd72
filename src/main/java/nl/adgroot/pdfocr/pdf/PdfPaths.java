package nl.adgroot.pdfocr.pdf;

import java.nio.file.Path;

public final class PdfPaths {

  private PdfPaths() {
    // utility class
  }

  /** {@code dir/report.pdf} with {@code ".json"} gives {@code dir/report.json}. */
  public static Path withExtension(Path file, String extension) {
    return file.resolveSibling(stem(file) + extension);
  }

  public static String stem(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
