package nl.adgroot.pdfocr.batch;

import java.util.Map;
import nl.adgroot.pdfocr.llm.InferenceRequest;
import nl.adgroot.pdfocr.prompts.PromptTemplate;

/**
 * Turns a task into one inference request. The backend always sees pages as 1..n of the chunk.
 */
public class RequestBuilder {

  private final PromptTemplate template;
  private final String contextInstruction;
  private final String responseMimeType;
  private final double temperature;

  public RequestBuilder(
      PromptTemplate template,
      String contextInstruction,
      String responseMimeType,
      double temperature
  ) {
    this.template = template;
    this.contextInstruction = contextInstruction == null ? "" : contextInstruction;
    this.responseMimeType = responseMimeType;
    this.temperature = temperature;
  }

  public InferenceRequest build(BatchTask task) {
    return new InferenceRequest(task.payload(), instructionsFor(task.pageCount()), responseMimeType, temperature);
  }

  public String instructionsFor(int numPages) {
    return template.render(Map.of(
        "numPages", String.valueOf(numPages),
        "context", contextInstruction
    ));
  }
}
