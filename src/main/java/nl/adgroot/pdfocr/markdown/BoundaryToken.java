package nl.adgroot.pdfocr.markdown;

public record BoundaryToken(Type type, String text) {

  public enum Type {
    TEXT,
    BEGIN,
    END,
    LEGACY
  }

  public static BoundaryToken text(String text) {
    return new BoundaryToken(Type.TEXT, text);
  }

  public boolean isMarker() {
    return type != Type.TEXT;
  }

  public boolean isContinuation() {
    return isMarker() && text.contains(PageMarkers.CONTINUATION);
  }

  public boolean isBlankText() {
    return type == Type.TEXT && text.isBlank();
  }
}
