package nl.adgroot.pdfocr.batch;

public enum JobStatus {
  PENDING,
  SUCCEEDED,
  FAILED
}
