package nl.adgroot.pdfocr.llm;

/**
 * One generateContent request inside a batch job: an inline PDF plus instructions.
 */
public record InferenceRequest(
    byte[] pdfPayload,
    String instructions,
    String responseMimeType,
    double temperature
) {

  public static final String MIME_JSON = "application/json";
  public static final String MIME_TEXT = "text/plain";

  /** Rough inline size: base64 of the payload plus the instruction text. */
  public long estimatedSize() {
    long base64 = 4L * ((pdfPayload.length + 2) / 3);
    return base64 + instructions.length();
  }
}
