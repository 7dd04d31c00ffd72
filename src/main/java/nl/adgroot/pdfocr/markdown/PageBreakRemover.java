package nl.adgroot.pdfocr.markdown;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import nl.adgroot.pdfocr.DocumentProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a paged Markdown file into continuous text. {@code X_paged.md} is written to
 * {@code X.md}, any other {@code X.md} to {@code X_clean.md}.
 */
public class PageBreakRemover {

  private static final Logger log = LoggerFactory.getLogger(PageBreakRemover.class);

  static final String PAGED_SUFFIX = "_paged.md";
  static final String CLEAN_SUFFIX = "_clean.md";
  static final String MERGED_SUFFIX = "_merged.md";

  private final BoundaryTokenizer tokenizer;
  private final BoundaryFolder folder;

  public PageBreakRemover() {
    this(new BoundaryTokenizer(), new BoundaryFolder());
  }

  public PageBreakRemover(BoundaryTokenizer tokenizer, BoundaryFolder folder) {
    this.tokenizer = tokenizer;
    this.folder = folder;
  }

  public String removeBreaks(String content) {
    return folder.fold(tokenizer.tokenize(content));
  }

  /** @return the file written */
  public Path process(Path mdFile) throws IOException {
    if (!Files.isRegularFile(mdFile)) {
      throw new DocumentProcessingException("File not found: " + mdFile);
    }
    String content = Files.readString(mdFile, StandardCharsets.UTF_8);
    Path output = outputPathFor(mdFile);
    Files.writeString(output, removeBreaks(content), StandardCharsets.UTF_8);
    log.info("Created: {}", output);
    return output;
  }

  /**
   * Processes the {@code *_paged.md} files of a directory, or when there are none every
   * {@code *.md} that is not already a cleaned or merged output. A failing file is logged and
   * skipped.
   *
   * @return the files written
   */
  public List<Path> processDirectory(Path dir) throws IOException {
    List<Path> inputs = selectInputs(dir);
    log.info("Found {} Markdown files in {}", inputs.size(), dir);

    List<Path> written = new ArrayList<>();
    for (Path md : inputs) {
      try {
        written.add(process(md));
      } catch (IOException | RuntimeException e) {
        log.error("Failed to process {}: {}", md, e.getMessage());
      }
    }
    return written;
  }

  static List<Path> selectInputs(Path dir) throws IOException {
    List<Path> markdown;
    try (Stream<Path> files = Files.list(dir)) {
      markdown = files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().endsWith(".md"))
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .toList();
    }

    List<Path> paged = markdown.stream()
        .filter(p -> p.getFileName().toString().endsWith(PAGED_SUFFIX))
        .toList();
    if (!paged.isEmpty()) {
      return paged;
    }
    return markdown.stream()
        .filter(p -> {
          String name = p.getFileName().toString();
          return !name.endsWith(CLEAN_SUFFIX) && !name.endsWith(MERGED_SUFFIX);
        })
        .toList();
  }

  static Path outputPathFor(Path mdFile) {
    String name = mdFile.getFileName().toString();
    if (name.endsWith(PAGED_SUFFIX)) {
      return mdFile.resolveSibling(name.substring(0, name.length() - PAGED_SUFFIX.length()) + ".md");
    }
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    String ext = dot > 0 ? name.substring(dot) : "";
    return mdFile.resolveSibling(stem + "_clean" + ext);
  }
}
