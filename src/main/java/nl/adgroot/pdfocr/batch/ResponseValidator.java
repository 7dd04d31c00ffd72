package nl.adgroot.pdfocr.batch;

/**
 * Decides whether a raw response is acceptable for a task. Implementations must not throw:
 * every parse or schema problem is a rejection.
 */
@FunctionalInterface
public interface ResponseValidator<T> {

  Validation<T> validate(BatchTask task, String rawResponse);
}
