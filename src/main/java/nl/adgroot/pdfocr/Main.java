package nl.adgroot.pdfocr;

import nl.adgroot.pdfocr.cli.JsonOcrCommand;
import nl.adgroot.pdfocr.cli.MarkdownOcrCommand;
import nl.adgroot.pdfocr.cli.MergePagesCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "pdf-ocr",
    mixinStandardHelpOptions = true,
    version = "pdf-ocr 1.0",
    description = "OCR PDF documents through the Gemini Batch API.",
    subcommands = {
        JsonOcrCommand.class,
        MarkdownOcrCommand.class,
        MergePagesCommand.class
    }
)
public class Main implements Runnable {

  @Spec
  CommandSpec spec;

  public static void main(String[] args) {
    System.exit(commandLine().execute(args));
  }

  static CommandLine commandLine() {
    return new CommandLine(new Main());
  }

  @Override
  public void run() {
    spec.commandLine().usage(spec.commandLine().getOut());
  }
}
