package nl.adgroot.pdfocr.ocr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OcrPage(
    @JsonProperty("page_number") int pageNumber,
    List<Block> blocks
) {

  public OcrPage {
    blocks = blocks == null ? List.of() : List.copyOf(blocks);
  }

  public OcrPage withPageNumber(int newPageNumber) {
    return new OcrPage(newPageNumber, blocks);
  }
}
