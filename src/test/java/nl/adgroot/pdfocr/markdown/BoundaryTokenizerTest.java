package nl.adgroot.pdfocr.markdown;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import nl.adgroot.pdfocr.markdown.BoundaryToken.Type;
import org.junit.jupiter.api.Test;

class BoundaryTokenizerTest {

  private final BoundaryTokenizer tokenizer = new BoundaryTokenizer();

  @Test
  void splitsTextAndMarkers() {
    String input = "=-- Begin Page 1 --=\nHello\n=-- End Printed Page 12 (Continuation) --=\n=-- Begin Page 2 (Continuation) --=\nworld";

    List<BoundaryToken> tokens = tokenizer.tokenize(input);

    assertEquals(List.of(Type.BEGIN, Type.TEXT, Type.END, Type.TEXT, Type.BEGIN, Type.TEXT),
        tokens.stream().map(BoundaryToken::type).toList());
    assertFalse(tokens.get(0).isContinuation());
    assertTrue(tokens.get(2).isContinuation());
    assertTrue(tokens.get(4).isContinuation());
  }

  @Test
  void concatenatedTokens_giveBackInput() {
    String input = "intro\n=-- Page 3 --=\nbody =-- End Printed Page N/A --= tail";

    String joined = tokenizer.tokenize(input).stream().map(BoundaryToken::text).collect(Collectors.joining());

    assertEquals(input, joined);
  }

  @Test
  void legacyMarker_onlyAtLineStart() {
    List<BoundaryToken> atStart = tokenizer.tokenize("a\n=-- Page 2 --=\nb");
    List<BoundaryToken> inline = tokenizer.tokenize("a =-- Page 2 --= b");

    assertEquals(Type.LEGACY, atStart.get(1).type());
    assertEquals(1, inline.size());
    assertEquals(Type.TEXT, inline.get(0).type());
  }

  @Test
  void markersDoNotSpanLines() {
    List<BoundaryToken> tokens = tokenizer.tokenize("=-- Begin Page 1\n --=");

    assertEquals(1, tokens.size());
    assertEquals(Type.TEXT, tokens.get(0).type());
  }

  @Test
  void emptyInput_hasNoTokens() {
    assertTrue(tokenizer.tokenize("").isEmpty());
  }
}
