package nl.adgroot.pdfocr.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import nl.adgroot.pdfocr.DocumentProcessingException;
import nl.adgroot.pdfocr.markdown.PageBreakRemover;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(
    name = "merge-pages",
    mixinStandardHelpOptions = true,
    description = "Remove page markers from paged Markdown. X_paged.md becomes X.md, other X.md becomes X_clean.md."
)
public class MergePagesCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(MergePagesCommand.class);

  @Parameters(index = "0", description = "Markdown file or directory")
  Path input;

  @Override
  public Integer call() throws IOException {
    PageBreakRemover remover = new PageBreakRemover();

    if (Files.isDirectory(input)) {
      remover.processDirectory(input);
      return 0;
    }
    try {
      remover.process(input);
      return 0;
    } catch (DocumentProcessingException e) {
      log.error(e.getMessage());
      return 1;
    }
  }
}
