package nl.adgroot.pdfocr.markdown;

import java.util.regex.Pattern;

/**
 * Page boundary markers written by the Markdown OCR prompt:
 * {@code =-- Begin Page N (Continuation) --=} and {@code =-- End Printed Page X (Continuation) --=}.
 */
public final class PageMarkers {

  public static final String BEGIN_PREFIX = "=-- Begin Page";
  public static final String END_PREFIX = "=-- End Printed Page";
  public static final String CONTINUATION = "(Continuation)";

  /** Begin marker with its chunk-relative index in group 1 and the rest up to the closing tag in group 2. */
  static final Pattern BEGIN_NUMBERED = Pattern.compile("=-- Begin Page (\\d+)(.*?) --=");

  static final Pattern BEGIN = Pattern.compile("=-- Begin Page [^\\n]*? --=");
  static final Pattern END = Pattern.compile("=-- End Printed Page [^\\n]*? --=");

  /** Older single-marker format, only recognised at the start of a line. */
  static final Pattern LEGACY = Pattern.compile("(?m)^=-- Page [^\\n]*?--=");

  private PageMarkers() {
    // constants
  }

  static int count(String text, String marker) {
    int n = 0;
    int from = 0;
    while ((from = text.indexOf(marker, from)) >= 0) {
      n++;
      from += marker.length();
    }
    return n;
  }
}
