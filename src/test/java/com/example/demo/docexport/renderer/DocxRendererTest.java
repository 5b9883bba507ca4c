package com.example.demo.docexport.renderer;

import com.example.demo.docexport.TestImages;
import com.example.demo.docexport.config.ExportProperties;
import com.example.demo.docexport.latex.MathExpressionPipeline;
import com.example.demo.docexport.math.LatexToMathMlConverter;
import com.example.demo.docexport.math.MathConversionChain;
import com.example.demo.docexport.math.MathMlToOmmlConverter;
import com.example.demo.docexport.model.CodeBlock;
import com.example.demo.docexport.model.ContentBlock;
import com.example.demo.docexport.model.EquationBlock;
import com.example.demo.docexport.model.ExportFormat;
import com.example.demo.docexport.model.ImageBlock;
import com.example.demo.docexport.model.ImageLoader;
import com.example.demo.docexport.model.ListBlock;
import com.example.demo.docexport.model.RenderAsset;
import com.example.demo.docexport.model.TableBlock;
import com.example.demo.docexport.model.TextBlock;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFPicture;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

public class DocxRendererTest {

    private DocxRenderer renderer;

    @BeforeEach
    public void setup() {
        renderer = new DocxRenderer(MathExpressionPipeline.withStructuralSanitizer(),
                MathConversionChain.createDefault(), new ExportProperties());
    }

    private XWPFDocument render(ImageLoader loader, ContentBlock... blocks) throws IOException {
        byte[] bytes = renderer.render(List.of(blocks), loader);
        return new XWPFDocument(new ByteArrayInputStream(bytes));
    }

    private XWPFDocument render(ContentBlock... blocks) throws IOException {
        return render(ImageLoader.none(), blocks);
    }

    @Test
    public void testDisplayEquationIsNativeMath() throws IOException {
        assertEquals(ExportFormat.DOCX, renderer.format());
        try (XWPFDocument doc = render(EquationBlock.of("$$\\frac{a}{b}$$"))) {
            assertEquals(1, doc.getParagraphs().size());
            XWPFParagraph paragraph = doc.getParagraphs().get(0);
            assertEquals(ParagraphAlignment.CENTER, paragraph.getAlignment());
            String xml = paragraph.getCTP().xmlText();
            assertTrue(xml.contains("oMathPara"));
            assertTrue(xml.contains("oMath"));
        }
    }

    @Test
    public void testTagFollowsTheMath() throws IOException {
        try (XWPFDocument doc = render(EquationBlock.of("E = mc^2 \\tag{1}"))) {
            XWPFParagraph paragraph = doc.getParagraphs().get(0);
            assertTrue(paragraph.getText().endsWith("(1)"));
            String xml = paragraph.getCTP().xmlText();
            assertTrue(xml.indexOf("oMathPara") < xml.indexOf("(1)"));
        }
    }

    @Test
    public void testUnconvertibleEquationFallsBackToText() throws IOException {
        try (XWPFDocument doc = render(EquationBlock.of("$$\\unknownmacro \\rightarrow y$$"))) {
            XWPFParagraph paragraph = doc.getParagraphs().get(0);
            assertEquals(ParagraphAlignment.CENTER, paragraph.getAlignment());
            assertTrue(paragraph.getText().contains("→"));
            assertFalse(paragraph.getCTP().xmlText().contains("oMath"));
        }
    }

    @Test
    public void testMalformedOfficeMathFallsBackToText() throws IOException {
        MathMlToOmmlConverter broken = Mockito.mock(MathMlToOmmlConverter.class);
        when(broken.convert(anyString())).thenReturn("<m:oMath xmlns:m=\"" + MathMlToOmmlConverter.OMML_NS + "\"><m:r>");
        DocxRenderer brokenMath = new DocxRenderer(MathExpressionPipeline.withStructuralSanitizer(),
                new MathConversionChain(new LatexToMathMlConverter(), broken), new ExportProperties());

        byte[] bytes = brokenMath.render(
                List.of(EquationBlock.of("$$x \\leq y$$"), TextBlock.of("after")), ImageLoader.none());
        try (XWPFDocument doc = new XWPFDocument(new ByteArrayInputStream(bytes))) {
            List<XWPFParagraph> paragraphs = doc.getParagraphs();
            assertEquals(2, paragraphs.size());
            assertEquals(ParagraphAlignment.CENTER, paragraphs.get(0).getAlignment());
            assertTrue(paragraphs.get(0).getText().contains("≤"));
            assertFalse(paragraphs.get(0).getCTP().xmlText().contains("oMath"));
            assertEquals("after", paragraphs.get(1).getText());
        }
    }

    @Test
    public void testDeeplyNestedEquationFallsBackToText() throws IOException {
        String deep = "{".repeat(5000) + "x" + "}".repeat(5000);
        DocxRenderer normalizerOnly = new DocxRenderer(MathExpressionPipeline.normalizerOnly(),
                MathConversionChain.createDefault(), new ExportProperties());
        for (DocxRenderer candidate : List.of(renderer, normalizerOnly)) {
            byte[] bytes = assertDoesNotThrow(() -> candidate.render(
                    List.of(EquationBlock.of("$$" + deep + "$$"), TextBlock.of("after")), ImageLoader.none()));
            try (XWPFDocument doc = new XWPFDocument(new ByteArrayInputStream(bytes))) {
                List<XWPFParagraph> paragraphs = doc.getParagraphs();
                assertEquals(2, paragraphs.size());
                assertTrue(paragraphs.get(0).getText().contains("x"));
                assertFalse(paragraphs.get(0).getCTP().xmlText().contains("oMath"));
            }
        }
    }

    @Test
    public void testInlineMathKeepsDocumentOrder() throws IOException {
        try (XWPFDocument doc = render(TextBlock.of("Energy $E=mc^2$ holds"))) {
            assertEquals(1, doc.getParagraphs().size());
            XWPFParagraph paragraph = doc.getParagraphs().get(0);
            assertEquals(ParagraphAlignment.BOTH, paragraph.getAlignment());
            String xml = paragraph.getCTP().xmlText();
            int before = xml.indexOf("Energy");
            int math = xml.indexOf("oMath");
            int after = xml.indexOf("holds");
            assertTrue(before >= 0 && before < math, xml);
            assertTrue(math < after, xml);
            assertFalse(xml.contains("oMathPara"));
        }
    }

    @Test
    public void testInlineFallbackStaysInline() throws IOException {
        try (XWPFDocument doc = render(TextBlock.of("see $\\foo x$ now"))) {
            assertEquals(1, doc.getParagraphs().size());
            assertEquals("see \\foo x now", doc.getParagraphs().get(0).getText());
        }
    }

    @Test
    public void testEmptyContentCreatesNoParagraph() throws IOException {
        try (XWPFDocument doc = render(EquationBlock.of("$$ $$"), TextBlock.of("$$ $$"), TextBlock.of("  "))) {
            assertTrue(doc.getParagraphs().isEmpty());
        }
    }

    @Test
    public void testHeadingStyle() throws IOException {
        try (XWPFDocument doc = render(TextBlock.heading("Introduction", 1))) {
            XWPFParagraph paragraph = doc.getParagraphs().get(0);
            assertEquals("Heading1", paragraph.getStyle());
            assertEquals("Introduction", paragraph.getText());
            assertTrue(paragraph.getRuns().get(0).isBold());

            XWPFStyles styles = doc.getStyles();
            assertNotNull(styles);
            for (int level = 1; level <= 4; level++) {
                assertTrue(styles.styleExist("Heading" + level));
                assertEquals(BigInteger.valueOf(level - 1L),
                        styles.getStyle("Heading" + level).getCTStyle().getPPr().getOutlineLvl().getVal());
            }
        }
    }

    @Test
    public void testListParagraphs() throws IOException {
        try (XWPFDocument doc = render(
                ListBlock.of(List.of("1. first", "2. second")),
                ListBlock.of(List.of("apples", "pears")))) {
            List<XWPFParagraph> paragraphs = doc.getParagraphs();
            assertEquals(4, paragraphs.size());
            assertEquals("ListNumber", paragraphs.get(0).getStyle());
            assertEquals("1. first", paragraphs.get(0).getText());
            assertEquals("ListBullet", paragraphs.get(2).getStyle());
            assertEquals("apples", paragraphs.get(2).getText());
            assertTrue(doc.getStyles().styleExist("ListNumber"));
            assertTrue(doc.getStyles().styleExist("ListBullet"));

            BigInteger numbered = paragraphs.get(0).getNumID();
            BigInteger bullets = paragraphs.get(2).getNumID();
            assertNotNull(numbered);
            assertNotNull(bullets);
            assertEquals(numbered, paragraphs.get(1).getNumID());
            assertNotEquals(numbered, bullets);
            assertNotNull(doc.getNumbering().getNum(numbered));
        }
    }

    @Test
    public void testEachNumberedListRestarts() throws IOException {
        try (XWPFDocument doc = render(
                ListBlock.of(List.of("1. a", "2. b")),
                TextBlock.of("between"),
                ListBlock.of(List.of("1. c")))) {
            List<XWPFParagraph> paragraphs = doc.getParagraphs();
            BigInteger first = paragraphs.get(0).getNumID();
            BigInteger second = paragraphs.get(3).getNumID();
            assertNotEquals(first, second);
            assertEquals(1, doc.getNumbering().getNum(second).getCTNum().sizeOfLvlOverrideArray());
        }
    }

    @Test
    public void testHtmlTableBecomesNativeTable() throws IOException {
        String html = "<table>"
                + "<tr><td>a</td><td>b</td><td>c</td></tr>"
                + "<tr><td>1</td><td>2</td></tr>"
                + "<tr><td>x</td><td>y</td><td>z</td><td>w</td></tr>"
                + "</table>";
        try (XWPFDocument doc = render(TableBlock.builder().htmlBody(html).caption("Table 1").build())) {
            assertEquals(1, doc.getTables().size());
            XWPFTable table = doc.getTables().get(0);
            assertEquals(3, table.getRows().size());
            for (int r = 0; r < 3; r++) {
                assertEquals(3, table.getRow(r).getTableCells().size());
            }
            assertEquals("c", table.getRow(0).getCell(2).getText());
            assertEquals("", table.getRow(1).getCell(2).getText());
            assertEquals("z", table.getRow(2).getCell(2).getText());
            assertEquals("LightListAccent1", table.getStyleID());
            assertTrue(doc.getStyles().styleExist("LightListAccent1"));
            assertTrue(doc.getAllPictures().isEmpty());
            assertEquals("Table 1", doc.getParagraphs().get(doc.getParagraphs().size() - 1).getText());
        }
    }

    @Test
    public void testTableWithoutBodyUsesPicture() throws IOException {
        try (XWPFDocument doc = render(TestImages.loaderFor("tables/t1.png"),
                TableBlock.builder().path("tables/t1.png").build())) {
            assertTrue(doc.getTables().isEmpty());
            assertEquals(1, doc.getAllPictures().size());
        }
    }

    @Test
    public void testImageIsEmbeddedWithCaption() throws IOException {
        try (XWPFDocument doc = render(TestImages.loaderFor("images/a.png"),
                ImageBlock.builder().path("images/a.png").caption("Figure 1").caption("overview").build())) {
            assertEquals(1, doc.getAllPictures().size());
            List<XWPFParagraph> paragraphs = doc.getParagraphs();
            assertEquals(2, paragraphs.size());
            assertEquals(ParagraphAlignment.CENTER, paragraphs.get(0).getAlignment());
            assertEquals("Figure 1 overview", paragraphs.get(1).getText());
        }
    }

    @Test
    public void testTallImageIsScaledToFitThePage() throws IOException {
        ImageLoader tall = path -> Optional.of(new RenderAsset("tall.png", TestImages.png(1, 800), "image/png"));
        try (XWPFDocument doc = render(tall, ImageBlock.builder().path("tall.png").build())) {
            XWPFPicture picture = doc.getParagraphs().get(0).getRuns().get(0).getEmbeddedPictures().get(0);
            assertTrue(picture.getDepth() > 0);
            assertTrue(picture.getDepth() <= 9 * 72 + 1, "depth " + picture.getDepth());
            assertTrue(picture.getWidth() > 0);
            assertTrue(picture.getWidth() < 6 * 72);
        }
    }

    @Test
    public void testMissingImageIsSkipped() throws IOException {
        try (XWPFDocument doc = render(ImageBlock.builder().path("images/missing.png").caption("gone").build())) {
            assertTrue(doc.getAllPictures().isEmpty());
            assertTrue(doc.getParagraphs().isEmpty());
        }
    }

    @Test
    public void testUnsupportedPictureTypeIsSkipped() throws IOException {
        ImageLoader svg = path -> Optional.of(new RenderAsset("a.svg", "<svg/>".getBytes(), "image/svg+xml"));
        try (XWPFDocument doc = render(svg, ImageBlock.builder().path("a.svg").build())) {
            assertTrue(doc.getAllPictures().isEmpty());
            assertTrue(doc.getParagraphs().isEmpty());
        }
    }

    @Test
    public void testCodeUsesMonospaceFont() throws IOException {
        try (XWPFDocument doc = render(CodeBlock.builder().body("a = 1\nb = 2").caption("Listing 1").build())) {
            List<XWPFParagraph> paragraphs = doc.getParagraphs();
            assertEquals(2, paragraphs.size());
            assertEquals("Listing 1", paragraphs.get(0).getText());
            assertEquals("Courier New", paragraphs.get(1).getRuns().get(0).getFontFamily());
            assertTrue(paragraphs.get(1).getText().contains("a = 1"));
            assertTrue(paragraphs.get(1).getText().contains("b = 2"));
        }
    }
}
