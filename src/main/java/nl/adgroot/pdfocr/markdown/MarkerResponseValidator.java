package nl.adgroot.pdfocr.markdown;

import nl.adgroot.pdfocr.batch.BatchTask;
import nl.adgroot.pdfocr.batch.ResponseValidator;
import nl.adgroot.pdfocr.batch.Validation;

/** A Markdown fragment is complete when it has one begin and one end marker per page. */
public class MarkerResponseValidator implements ResponseValidator<String> {

  @Override
  public Validation<String> validate(BatchTask task, String rawResponse) {
    if (rawResponse == null || rawResponse.isBlank()) {
      return Validation.reject("empty response");
    }
    int expected = task.pageCount();
    int begins = PageMarkers.count(rawResponse, PageMarkers.BEGIN_PREFIX);
    int ends = PageMarkers.count(rawResponse, PageMarkers.END_PREFIX);

    if (begins != expected || ends != expected) {
      return Validation.reject(String.format(
          "Page marker count mismatch (expected %d, begin %d, end %d)", expected, begins, ends));
    }
    return Validation.accept(rawResponse);
  }
}
