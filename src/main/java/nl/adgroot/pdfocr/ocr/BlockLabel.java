package nl.adgroot.pdfocr.ocr;

/** How a block label renders. Labels outside this set render as body text. */
public enum BlockLabel {
  TITLE("title"),
  SECTION_HEADING("sectionHeading"),
  SUB_HEADING("subHeading"),
  BODY("body"),
  CAPTION("caption"),
  HEADER("header"),
  FOOTER("footer"),
  PAGE_NUMBER("pageNumber"),
  ISOLATED("isolated"),
  IGNORED("ignored");

  private final String wireName;

  BlockLabel(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  /** Unknown or missing labels are treated as body text. */
  public static BlockLabel fromWire(String value) {
    if (value != null) {
      for (BlockLabel label : values()) {
        if (label.wireName.equals(value)) {
          return label;
        }
      }
    }
    return BODY;
  }
}
