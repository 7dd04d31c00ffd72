package nl.adgroot.pdfocr.markdown;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Removes page markers from a token stream and decides how the text on either side of each
 * page boundary is joined.
 *
 * <p>An end marker followed, with only whitespace in between, by a begin marker is a boundary.
 * The boundary and the whitespace before it disappear; if either marker is a continuation the
 * paragraph is joined, otherwise a blank line separates the pages. Markers that are not part of a
 * boundary are dropped along with the adjacent whitespace.
 */
public class BoundaryFolder {

  private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");
  private static final String PARAGRAPH_BREAK = "\n\n";

  public String fold(List<BoundaryToken> tokens) {
    StringBuilder out = new StringBuilder();
    boolean skipLeadingWhitespace = false;

    for (int i = 0; i < tokens.size(); i++) {
      BoundaryToken token = tokens.get(i);

      switch (token.type()) {
        case TEXT -> {
          String text = skipLeadingWhitespace ? token.text().stripLeading() : token.text();
          out.append(text);
          skipLeadingWhitespace = false;
        }
        case END -> {
          int next = i + 1;
          if (next < tokens.size() && tokens.get(next).isBlankText()) {
            next++;
          }
          stripTrailingWhitespace(out);
          skipLeadingWhitespace = false;
          if (next < tokens.size() && tokens.get(next).type() == BoundaryToken.Type.BEGIN) {
            BoundaryToken begin = tokens.get(next);
            if (!token.isContinuation() && !begin.isContinuation()) {
              out.append(PARAGRAPH_BREAK);
            }
            i = next;
          }
        }
        case BEGIN -> skipLeadingWhitespace = true;
        case LEGACY -> {
          if (token.isContinuation()) {
            stripTrailingWhitespace(out);
          }
          skipLeadingWhitespace = true;
        }
      }
    }

    return EXCESS_NEWLINES.matcher(out).replaceAll(PARAGRAPH_BREAK);
  }

  private static void stripTrailingWhitespace(StringBuilder sb) {
    int len = sb.length();
    while (len > 0 && Character.isWhitespace(sb.charAt(len - 1))) {
      len--;
    }
    sb.setLength(len);
  }
}
