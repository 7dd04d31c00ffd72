package nl.adgroot.pdfocr.prompts;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plain text template with {@code {{name}}} placeholders. Unknown placeholders are left as-is.
 */
public class PromptTemplate {

  public static final String STRUCTURED_OCR = "prompts/structured-ocr.txt";
  public static final String MARKDOWN_OCR = "prompts/markdown-ocr.txt";
  public static final String GENERAL_CONTEXT = "prompts/context-general.txt";

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_]+)\\s*}}");

  private final String template;

  public PromptTemplate(String template) {
    this.template = template == null ? "" : template;
  }

  public static PromptTemplate load(Path path) throws IOException {
    return new PromptTemplate(Files.readString(path, StandardCharsets.UTF_8));
  }

  public static PromptTemplate fromClasspath(String resource) throws IOException {
    try (InputStream is = PromptTemplate.class.getClassLoader().getResourceAsStream(resource)) {
      if (is == null) {
        throw new IllegalStateException("Prompt not found on classpath: " + resource);
      }
      return new PromptTemplate(new String(is.readAllBytes(), StandardCharsets.UTF_8));
    }
  }

  public String render(Map<String, String> values) {
    Matcher m = PLACEHOLDER.matcher(template);
    StringBuilder sb = new StringBuilder(template.length() + 256);
    while (m.find()) {
      String value = values.get(m.group(1));
      m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group(0)));
    }
    m.appendTail(sb);
    return sb.toString();
  }
}
