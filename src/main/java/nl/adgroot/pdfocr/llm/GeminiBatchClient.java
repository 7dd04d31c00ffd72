package nl.adgroot.pdfocr.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import nl.adgroot.pdfocr.config.AppConfig;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Gemini Batch API over REST with inline requests and inline responses.
 */
public class GeminiBatchClient implements BatchClient {

  private static final MediaType JSON = MediaType.parse("application/json");
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final String API_KEY_HEADER = "x-goog-api-key";
  private static final String REQUEST_KEY_PREFIX = "request-";

  private final OkHttpClient http;
  private final String baseUrl;
  private final String model;
  private final String apiKey;

  public GeminiBatchClient(AppConfig.GeminiConfig cfg) {
    if (cfg.apiKey == null || cfg.apiKey.isBlank()) {
      throw new IllegalStateException("Gemini API key not found in config or GEMINI_API_KEY");
    }
    this.baseUrl = stripTrailingSlash(cfg.baseUrl);
    this.model = cfg.model;
    this.apiKey = cfg.apiKey;

    Duration t = Duration.ofSeconds(cfg.timeoutSeconds);

    this.http = new OkHttpClient.Builder()
        .connectTimeout(t)
        .readTimeout(t)
        .writeTimeout(t)
        .callTimeout(t)
        .build();
  }

  @Override
  public String createJob(List<InferenceRequest> requests, String displayName) throws IOException {
    ObjectNode body = toCreateBody(requests, displayName);

    Request request = new Request.Builder()
        .url(baseUrl + "/models/" + model + ":batchGenerateContent")
        .header(API_KEY_HEADER, apiKey)
        .post(RequestBody.create(MAPPER.writeValueAsString(body), JSON))
        .build();

    JsonNode json = execute(request);
    String name = json.path("name").asText("");
    if (name.isEmpty()) {
      throw new IOException("Batch create response carries no job name: " + json);
    }
    return name;
  }

  @Override
  public JobSnapshot getJob(String jobName) throws IOException {
    Request request = new Request.Builder()
        .url(baseUrl + "/" + jobName)
        .header(API_KEY_HEADER, apiKey)
        .get()
        .build();

    return parseSnapshot(jobName, execute(request));
  }

  private JsonNode execute(Request request) throws IOException {
    try (Response r = http.newCall(request).execute()) {
      if (!r.isSuccessful()) {
        String body = readBodySafely(r.body());
        throw new IOException("Gemini error: " + r.code() + " " + r.message() + "\n" + body);
      }
      String body = Objects.requireNonNull(r.body()).string();
      return MAPPER.readTree(body);
    }
  }

  static ObjectNode toCreateBody(List<InferenceRequest> requests, String displayName) {
    ObjectNode root = MAPPER.createObjectNode();
    ObjectNode batch = root.putObject("batch");
    batch.put("display_name", displayName);

    ArrayNode items = batch.putObject("input_config")
        .putObject("requests")
        .putArray("requests");

    for (int i = 0; i < requests.size(); i++) {
      InferenceRequest req = requests.get(i);
      ObjectNode item = items.addObject();

      ObjectNode generateRequest = item.putObject("request");
      ObjectNode content = generateRequest.putArray("contents").addObject();
      content.put("role", "user");
      ArrayNode parts = content.putArray("parts");
      ObjectNode inline = parts.addObject().putObject("inline_data");
      inline.put("mime_type", "application/pdf");
      inline.put("data", Base64.getEncoder().encodeToString(req.pdfPayload()));
      parts.addObject().put("text", req.instructions());

      ObjectNode generation = generateRequest.putObject("generation_config");
      generation.put("temperature", req.temperature());
      generation.put("response_mime_type", req.responseMimeType());

      item.putObject("metadata").put("key", REQUEST_KEY_PREFIX + i);
    }
    return root;
  }

  static JobSnapshot parseSnapshot(String jobName, JsonNode json) {
    JsonNode metadata = json.path("metadata");
    String rawState = metadata.path("state").asText(json.path("state").asText(""));
    JobState state = JobState.fromWire(rawState);

    boolean done = json.path("done").asBoolean(false)
        || state == JobState.SUCCEEDED
        || state == JobState.FAILED
        || state == JobState.CANCELLED
        || state == JobState.EXPIRED;

    JsonNode error = json.path("error");
    String errorText = error.isMissingNode() || error.isNull() ? null : error.toString();

    // a done operation without state is reported as succeeded unless it carries an error
    if (done && state == JobState.UNSPECIFIED) {
      state = errorText == null ? JobState.SUCCEEDED : JobState.FAILED;
    }

    JsonNode inlined = json.path("response").path("inlinedResponses").path("inlinedResponses");
    if (!inlined.isArray()) {
      inlined = metadata.path("output").path("inlinedResponses").path("inlinedResponses");
    }

    List<InlinedResponse> responses = new ArrayList<>();
    if (inlined.isArray()) {
      TreeMap<Integer, InlinedResponse> byKey = new TreeMap<>();
      boolean keyed = true;
      for (JsonNode item : inlined) {
        InlinedResponse response = parseInlined(item);
        responses.add(response);
        int index = requestIndex(item.path("metadata").path("key").asText(""));
        if (index < 0 || byKey.put(index, response) != null) {
          keyed = false;
        }
      }
      // keys echoed back by the backend win over response order
      if (keyed && !byKey.isEmpty()) {
        responses = inRequestOrder(byKey);
      }
    }

    String name = json.path("name").asText(jobName);
    return new JobSnapshot(name, done, state, responses, errorText);
  }

  private static int requestIndex(String key) {
    if (!key.startsWith(REQUEST_KEY_PREFIX)) {
      return -1;
    }
    try {
      return Integer.parseInt(key.substring(REQUEST_KEY_PREFIX.length()));
    } catch (NumberFormatException e) {
      return -1;
    }
  }

  private static List<InlinedResponse> inRequestOrder(TreeMap<Integer, InlinedResponse> byKey) {
    int last = byKey.lastKey();
    List<InlinedResponse> ordered = new ArrayList<>(last + 1);
    for (int i = 0; i <= last; i++) {
      InlinedResponse response = byKey.get(i);
      ordered.add(response != null ? response : InlinedResponse.ofError("no response returned for this request"));
    }
    return ordered;
  }

  private static InlinedResponse parseInlined(JsonNode item) {
    JsonNode error = item.path("error");
    if (!error.isMissingNode() && !error.isNull()) {
      return InlinedResponse.ofError(error.path("message").asText(error.toString()));
    }

    JsonNode parts = item.path("response").path("candidates").path(0).path("content").path("parts");
    if (!parts.isArray()) {
      return new InlinedResponse(null, null);
    }
    StringBuilder text = new StringBuilder();
    for (JsonNode part : parts) {
      text.append(part.path("text").asText(""));
    }
    return InlinedResponse.ofText(text.toString());
  }

  private static String readBodySafely(ResponseBody body) {
    if (body == null) return "";
    try {
      return body.string();
    } catch (IOException e) {
      return "<unreadable body: " + e.getMessage() + ">";
    }
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
