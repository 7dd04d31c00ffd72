package nl.adgroot.pdfocr.prompts;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class PromptTemplateTest {

  @Test
  void render_replacesKnownPlaceholders_andKeepsUnknownOnes() {
    PromptTemplate t = new PromptTemplate("Pages 1..{{numPages}} {{ context }} {{other}}");

    String out = t.render(Map.of("numPages", "4", "context", "A novel."));

    assertEquals("Pages 1..4 A novel. {{other}}", out);
  }

  @Test
  void render_valueWithDollarSign_isInsertedLiterally() {
    PromptTemplate t = new PromptTemplate("Context: {{context}}");

    assertEquals("Context: costs $5", t.render(Map.of("context", "costs $5")));
  }

  @Test
  void bundledPrompts_mentionPageCountPlaceholder() throws Exception {
    for (String resource : new String[] {PromptTemplate.STRUCTURED_OCR, PromptTemplate.MARKDOWN_OCR}) {
      String rendered = PromptTemplate.fromClasspath(resource).render(Map.of("numPages", "7", "context", ""));
      assertFalse(rendered.contains("{{numPages}}"), resource);
      assertTrue(rendered.contains("7"), resource);
    }
  }

  @Test
  void fromClasspath_missingResource_fails() {
    assertThrows(IllegalStateException.class, () -> PromptTemplate.fromClasspath("prompts/nope.txt"));
  }
}
