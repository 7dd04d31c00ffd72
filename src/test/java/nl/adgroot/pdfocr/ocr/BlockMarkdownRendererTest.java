package nl.adgroot.pdfocr.ocr;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class BlockMarkdownRendererTest {

  private final BlockMarkdownRenderer renderer = new BlockMarkdownRenderer();

  @Test
  void rendersLabelsWithPageHeaderAndRule() {
    OcrPage page = new OcrPage(3, List.of(
        Block.of("Report", BlockLabel.TITLE, false),
        Block.of("Scope", BlockLabel.SECTION_HEADING, false),
        Block.of("Detail", BlockLabel.SUB_HEADING, false),
        Block.of("Body text.", BlockLabel.BODY, false),
        Block.of("Figure 1", BlockLabel.CAPTION, false),
        Block.of("Confidential", BlockLabel.FOOTER, false),
        Block.of("stamp", BlockLabel.ISOLATED, false),
        Block.of("noise", BlockLabel.IGNORED, false),
        Block.of("- 3 -", BlockLabel.PAGE_NUMBER, false)));

    String md = renderer.render(List.of(page));

    assertEquals("""
        ## Page 3

        # Report

        ## Scope

        ### Detail

        Body text.

        > Figure 1

        *Confidential*

        *- 3 -*

        ---
        """, md);
  }

  @Test
  void continuingBlocksWithSameLabel_areJoinedIntoOneParagraph() {
    OcrPage page = new OcrPage(1, List.of(
        Block.of("The first line ", BlockLabel.BODY, true),
        Block.of("and the second.", BlockLabel.BODY, false),
        Block.of("New paragraph.", BlockLabel.BODY, false)));

    String md = renderer.render(List.of(page));

    assertTrue(md.contains("The first line and the second.\n\nNew paragraph.\n"), md);
  }

  @Test
  void labelChange_flushesBufferEvenWhenContinuing() {
    OcrPage page = new OcrPage(1, List.of(
        Block.of("Heading", BlockLabel.SECTION_HEADING, true),
        Block.of("Text", BlockLabel.BODY, true)));

    String md = renderer.render(List.of(page));

    assertEquals("## Page 1\n\n## Heading\n\nText\n\n---\n", md);
  }

  @Test
  void blankBlocks_areSkippedWithoutBreakingTheBuffer() {
    OcrPage page = new OcrPage(1, List.of(
        Block.of("A", BlockLabel.BODY, true),
        Block.of("   ", BlockLabel.CAPTION, false),
        Block.of("B", BlockLabel.BODY, false)));

    String md = renderer.render(List.of(page));

    assertTrue(md.contains("\nAB\n"), md);
  }

  @Test
  void unknownLabel_rendersAsBody_butDoesNotJoinBodyRun() {
    OcrPage page = new OcrPage(1, List.of(
        Block.of("A", BlockLabel.BODY, true),
        new Block("B", "table", 0, false, Direction.HORIZONTAL, null)));

    String md = renderer.render(List.of(page));

    assertEquals("## Page 1\n\nA\n\nB\n\n---\n", md);
  }

  @Test
  void missingLabel_isBody() {
    OcrPage page = new OcrPage(1, List.of(
        new Block("A", null, 0, true, null, null),
        Block.of("B", BlockLabel.BODY, false)));

    assertEquals("## Page 1\n\nAB\n\n---\n", renderer.render(List.of(page)));
  }

  @Test
  void pagesRenderInGivenOrder_andEmptyPageStillHasHeaderAndRule() {
    String md = renderer.render(List.of(new OcrPage(1, List.of()), new OcrPage(2, List.of())));

    assertEquals("## Page 1\n\n---\n\n## Page 2\n\n---\n", md);
  }

  @Test
  void noPages_rendersEmptyString() {
    assertEquals("", renderer.render(List.of()));
  }
}
