package nl.adgroot.pdfocr.ocr;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One run of text on a page, in reading order.
 *
 * @param label     label as the backend wrote it, kept for storage and run comparison
 * @param continues true when the next block carries on the same logical flow
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Block(
    String text,
    String label,
    @JsonProperty("font_size") int fontSize,
    boolean continues,
    Direction direction,
    Box box
) {

  public Block {
    text = text == null ? "" : text;
    label = label == null ? BlockLabel.BODY.wireName() : label;
    direction = direction == null ? Direction.HORIZONTAL : direction;
  }

  public static Block of(String text, BlockLabel label, boolean continues) {
    return new Block(text, label.wireName(), 0, continues, Direction.HORIZONTAL, null);
  }

  @JsonIgnore
  public boolean isBlank() {
    return text.isBlank();
  }
}
