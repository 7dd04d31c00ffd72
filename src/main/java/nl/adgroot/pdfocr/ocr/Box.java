package nl.adgroot.pdfocr.ocr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Bounding box on a 0..1000 normalized page, origin top-left. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Box(int x, int y, int width, int height) {}
