package nl.adgroot.pdfocr.llm;

import java.util.List;

/**
 * Status of a remote batch job as returned by one status call.
 */
public record JobSnapshot(
    String name,
    boolean done,
    JobState state,
    List<InlinedResponse> responses,
    String error
) {

  public JobSnapshot {
    responses = responses == null ? List.of() : List.copyOf(responses);
  }

  public boolean succeeded() {
    return done && state == JobState.SUCCEEDED;
  }
}
