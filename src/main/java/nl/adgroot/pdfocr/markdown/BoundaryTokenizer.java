package nl.adgroot.pdfocr.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a paged Markdown document into text runs and page markers. Concatenating the token texts
 * gives back the input.
 */
public class BoundaryTokenizer {

  private static final Pattern MARKER = Pattern.compile(
      "(?<begin>" + PageMarkers.BEGIN.pattern() + ")"
          + "|(?<end>" + PageMarkers.END.pattern() + ")"
          + "|(?<legacy>" + PageMarkers.LEGACY.pattern() + ")",
      Pattern.MULTILINE);

  public List<BoundaryToken> tokenize(String content) {
    List<BoundaryToken> tokens = new ArrayList<>();
    Matcher m = MARKER.matcher(content);
    int pos = 0;

    while (m.find()) {
      if (m.start() > pos) {
        tokens.add(BoundaryToken.text(content.substring(pos, m.start())));
      }
      tokens.add(new BoundaryToken(typeOf(m), m.group()));
      pos = m.end();
    }
    if (pos < content.length()) {
      tokens.add(BoundaryToken.text(content.substring(pos)));
    }
    return tokens;
  }

  private static BoundaryToken.Type typeOf(Matcher m) {
    if (m.group("begin") != null) {
      return BoundaryToken.Type.BEGIN;
    }
    if (m.group("end") != null) {
      return BoundaryToken.Type.END;
    }
    return BoundaryToken.Type.LEGACY;
  }
}
