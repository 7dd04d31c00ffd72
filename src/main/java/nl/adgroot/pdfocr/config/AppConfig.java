package nl.adgroot.pdfocr.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {

  public GeminiConfig gemini = new GeminiConfig();
  public BatchConfig batch = new BatchConfig();

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class GeminiConfig {
    // falls back to GEMINI_API_KEY when empty
    public String apiKey = "";

    public String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
    public String model = "gemini-3-flash-preview";

    public double temperature = 0.1;
    public int timeoutSeconds = 120;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class BatchConfig {
    public int maxRetries = 3;

    // 18 MiB: safety margin below the 20 MiB inline batch limit
    public long maxPayloadBytes = 18L * 1024 * 1024;

    public int pollIntervalSeconds = 10;
    public int pollErrorDelaySeconds = 5;
    public int retryDelaySeconds = 1;

    // pages per chunk when the command line does not override it
    public int batchSize = 4;
  }
}
