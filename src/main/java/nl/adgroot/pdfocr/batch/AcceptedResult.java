package nl.adgroot.pdfocr.batch;

public record AcceptedResult<T>(BatchTask task, T value) {}
