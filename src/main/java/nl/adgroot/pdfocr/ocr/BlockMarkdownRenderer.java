package nl.adgroot.pdfocr.ocr;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders page objects as Markdown. Consecutive blocks with the same label are joined until a
 * block ends its flow ({@code continues == false}) or the label changes. Labels are compared as
 * written, so two different unknown labels never join.
 */
public class BlockMarkdownRenderer {

  public String render(List<OcrPage> pages) {
    List<String> lines = new ArrayList<>();

    for (OcrPage page : pages) {
      lines.add("## Page " + page.pageNumber());
      lines.add("");

      StringBuilder buffer = new StringBuilder();
      String bufferLabel = null;

      for (Block block : page.blocks()) {
        if (block.isBlank()) {
          continue;
        }

        if (bufferLabel != null && !block.label().equals(bufferLabel)) {
          appendUnit(lines, bufferLabel, buffer.toString());
          buffer.setLength(0);
        }

        bufferLabel = block.label();
        buffer.append(block.text());

        if (!block.continues()) {
          appendUnit(lines, bufferLabel, buffer.toString());
          buffer.setLength(0);
          bufferLabel = null;
        }
      }

      if (bufferLabel != null && buffer.length() > 0) {
        appendUnit(lines, bufferLabel, buffer.toString());
      }

      lines.add("---");
      lines.add("");
    }

    return String.join("\n", lines);
  }

  private static void appendUnit(List<String> lines, String label, String text) {
    if (text.isEmpty()) {
      return;
    }
    String rendered = format(BlockLabel.fromWire(label), text);
    if (rendered == null) {
      return;
    }
    lines.add(rendered);
    lines.add("");
  }

  /** @return the Markdown for one unit, or null when the label is not rendered */
  static String format(BlockLabel label, String text) {
    return switch (label) {
      case TITLE -> "# " + text;
      case SECTION_HEADING -> "## " + text;
      case SUB_HEADING -> "### " + text;
      case CAPTION -> "> " + text;
      case HEADER, FOOTER, PAGE_NUMBER -> "*" + text + "*";
      case ISOLATED, IGNORED -> null;
      case BODY -> text;
    };
  }
}
