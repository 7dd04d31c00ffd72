package nl.adgroot.pdfocr.pdf;

public class InvalidPageRangeException extends RuntimeException {

  public InvalidPageRangeException(String message) {
    super(message);
  }
}
