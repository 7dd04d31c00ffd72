package nl.adgroot.pdfocr.ocr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import nl.adgroot.pdfocr.batch.BatchTask;
import nl.adgroot.pdfocr.batch.ResponseValidator;
import nl.adgroot.pdfocr.batch.Validation;

/**
 * Accepts a JSON page list whose page numbers are exactly 1..n for a chunk of n pages. A single
 * page object (anything with {@code blocks}) is treated as a one-element list. Page numbers in the
 * accepted value are still relative to the chunk.
 */
public class StructuredResponseValidator implements ResponseValidator<List<OcrPage>> {

  private final ObjectMapper mapper;

  public StructuredResponseValidator() {
    this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
  }

  public StructuredResponseValidator(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public Validation<List<OcrPage>> validate(BatchTask task, String rawResponse) {
    JsonNode root;
    try {
      root = mapper.readTree(rawResponse);
    } catch (JsonProcessingException e) {
      return Validation.reject("JSON parse error: " + e.getOriginalMessage());
    }

    if (root != null && root.isObject() && root.has("blocks")) {
      ArrayNode wrapped = mapper.createArrayNode();
      wrapped.add(root);
      root = wrapped;
    }
    if (root == null || !root.isArray()) {
      return Validation.reject("Response is not a list or a valid page object");
    }

    int expected = task.pageCount();
    if (root.size() != expected) {
      return Validation.reject("Page count mismatch: expected " + expected + ", got " + root.size());
    }

    List<Integer> pageNumbers = new ArrayList<>(expected);
    for (JsonNode item : root) {
      pageNumbers.add(pageNumberOf(item));
    }
    pageNumbers.sort(null);
    List<Integer> expectedNumbers = IntStream.rangeClosed(1, expected).boxed().toList();
    if (!pageNumbers.equals(expectedNumbers)) {
      return Validation.reject("Invalid page numbers: expected " + expectedNumbers + ", got " + pageNumbers);
    }

    try {
      List<OcrPage> pages = new ArrayList<>(expected);
      for (JsonNode item : root) {
        pages.add(mapper.treeToValue(item, OcrPage.class));
      }
      return Validation.accept(pages);
    } catch (JsonProcessingException | RuntimeException e) {
      return Validation.reject("Page object does not match the block schema: " + e.getMessage());
    }
  }

  /** Integral numbers, including {@code 2.0}; anything else counts as 0. */
  private static int pageNumberOf(JsonNode item) {
    JsonNode nr = item.path("page_number");
    if (nr.isIntegralNumber() && nr.canConvertToInt()) {
      return nr.asInt();
    }
    if (nr.isFloatingPointNumber()) {
      double d = nr.asDouble();
      if (d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) {
        return (int) d;
      }
    }
    return 0;
  }
}
