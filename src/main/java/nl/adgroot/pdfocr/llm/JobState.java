package nl.adgroot.pdfocr.llm;

import java.util.Locale;

public enum JobState {
  PENDING,
  RUNNING,
  SUCCEEDED,
  FAILED,
  CANCELLED,
  EXPIRED,
  UNSPECIFIED;

  /** Accepts both {@code BATCH_STATE_*} and {@code JOB_STATE_*} spellings. */
  public static JobState fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNSPECIFIED;
    }
    String s = raw.trim().toUpperCase(Locale.ROOT)
        .replace("BATCH_STATE_", "")
        .replace("JOB_STATE_", "");
    try {
      return valueOf(s);
    } catch (IllegalArgumentException e) {
      return UNSPECIFIED;
    }
  }
}
