package nl.adgroot.pdfocr.markdown;

import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import nl.adgroot.pdfocr.batch.AcceptedResult;
import nl.adgroot.pdfocr.batch.BatchTask;

/**
 * Joins accepted fragments into one document in page order and rewrites begin markers from
 * chunk-relative to absolute page numbers. End markers are left as they are.
 */
public class MarkdownPageStitcher {

  public String stitch(List<AcceptedResult<String>> fragments) {
    StringBuilder sb = new StringBuilder();
    fragments.stream()
        .sorted(Comparator.comparingInt(r -> r.task().firstPage()))
        .forEach(r -> sb.append(renumber(r.task(), r.value())).append("\n\n"));
    return sb.toString();
  }

  static String renumber(BatchTask task, String fragment) {
    Matcher m = PageMarkers.BEGIN_NUMBERED.matcher(fragment);
    StringBuilder sb = new StringBuilder(fragment.length() + 16);
    while (m.find()) {
      String replacement = m.group(0);
      try {
        int relative = Integer.parseInt(m.group(1));
        if (relative >= 1 && relative <= task.pageCount()) {
          replacement = "=-- Begin Page " + task.absolutePage(relative) + m.group(2) + " --=";
        }
      } catch (NumberFormatException e) {
        // digits too long for an int: not a page index we produced
        replacement = m.group(0);
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
    }
    m.appendTail(sb);
    return sb.toString();
  }
}
