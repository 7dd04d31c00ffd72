package nl.adgroot.pdfocr;

/**
 * Fatal for the current document only: missing input or nothing extracted. Nothing is written
 * when this is thrown.
 */
public class DocumentProcessingException extends RuntimeException {

  public DocumentProcessingException(String message) {
    super(message);
  }

  public DocumentProcessingException(String message, Throwable cause) {
    super(message, cause);
  }
}
