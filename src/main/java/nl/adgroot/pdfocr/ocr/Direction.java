package nl.adgroot.pdfocr.ocr;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Direction {
  HORIZONTAL("horizontal"),
  VERTICAL("vertical");

  private final String wireName;

  Direction(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  @JsonCreator
  public static Direction fromWire(String value) {
    return VERTICAL.wireName.equals(value) ? VERTICAL : HORIZONTAL;
  }
}
