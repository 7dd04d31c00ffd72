package nl.adgroot.pdfocr.batch;

/**
 * Accept/reject decision for one task's response. {@code value} is set only when accepted.
 */
public record Validation<T>(boolean accepted, T value, String reason) {

  public static <T> Validation<T> accept(T value) {
    return new Validation<>(true, value, "");
  }

  public static <T> Validation<T> reject(String reason) {
    return new Validation<>(false, null, reason);
  }
}
