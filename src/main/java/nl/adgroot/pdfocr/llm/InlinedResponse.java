package nl.adgroot.pdfocr.llm;

/**
 * Per-request outcome of a finished batch job. Exactly one of {@code text} / {@code error} is
 * normally set; both may be null when the backend returned an empty candidate.
 */
public record InlinedResponse(String text, String error) {

  public static InlinedResponse ofText(String text) {
    return new InlinedResponse(text, null);
  }

  public static InlinedResponse ofError(String error) {
    return new InlinedResponse(null, error);
  }

  public boolean hasText() {
    return text != null && !text.isBlank();
  }
}
