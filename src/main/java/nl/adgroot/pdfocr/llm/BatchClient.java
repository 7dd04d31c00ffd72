package nl.adgroot.pdfocr.llm;

import java.io.IOException;
import java.util.List;

/**
 * Asynchronous batch inference backend.
 */
public interface BatchClient {

  /**
   * Creates one batch job carrying {@code requests} in order.
   *
   * @return the backend job name used for status checks
   */
  String createJob(List<InferenceRequest> requests, String displayName) throws IOException;

  JobSnapshot getJob(String jobName) throws IOException;
}
