package com.example.demo.docexport.renderer;

import com.example.demo.docexport.TestImages;
import com.example.demo.docexport.config.ExportProperties;
import com.example.demo.docexport.latex.MathExpressionPipeline;
import com.example.demo.docexport.model.CodeBlock;
import com.example.demo.docexport.model.ContentBlock;
import com.example.demo.docexport.model.EquationBlock;
import com.example.demo.docexport.model.ExportFormat;
import com.example.demo.docexport.model.IgnoredBlock;
import com.example.demo.docexport.model.ImageBlock;
import com.example.demo.docexport.model.ImageLoader;
import com.example.demo.docexport.model.ListBlock;
import com.example.demo.docexport.model.RenderAsset;
import com.example.demo.docexport.model.TableBlock;
import com.example.demo.docexport.model.TextBlock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class HtmlRendererTest {

    private HtmlRenderer renderer;

    @BeforeEach
    public void setup() {
        renderer = new HtmlRenderer(MathExpressionPipeline.withStructuralSanitizer(), new ExportProperties());
    }

    private String render(ContentBlock... blocks) {
        return renderer.render(List.of(blocks), ImageLoader.none());
    }

    @Test
    public void testDocumentShell() {
        assertEquals(ExportFormat.HTML, renderer.format());
        String html = render();
        assertTrue(html.startsWith("<!DOCTYPE html>"));
        assertTrue(html.contains("<html lang=\"zh-CN\">"));
        assertTrue(html.contains("<title>MinerU Export</title>"));
        assertTrue(html.contains("window.MathJax"));
        assertTrue(html.contains("<script async src=\"https://cdn.jsdelivr.net/npm/mathjax@3/es5/tex-mml-chtml.js\"></script>"));
        assertTrue(html.endsWith("</body>\n</html>"));
    }

    @Test
    public void testTitleComesFromProperties() {
        ExportProperties properties = new ExportProperties();
        properties.getHtml().setTitle("Report <draft>");
        properties.getHtml().setLang("en");
        String html = new HtmlRenderer(MathExpressionPipeline.normalizerOnly(), properties)
                .render(List.of(), ImageLoader.none());
        assertTrue(html.contains("<title>Report &lt;draft&gt;</title>"));
        assertTrue(html.contains("<html lang=\"en\">"));
    }

    @Test
    public void testHeadingsAndParagraphs() {
        String html = render(TextBlock.heading("Results", 2), TextBlock.of("line one\nline <b>two</b>"));
        assertTrue(html.contains("<h2>Results</h2>"));
        assertTrue(html.contains("<p>line one<br/>line <b>two</b></p>"));
    }

    @Test
    public void testOutOfRangeLevelIsParagraph() {
        String html = render(TextBlock.heading("Deep", 7));
        assertTrue(html.contains("<p>Deep</p>"));
    }

    @Test
    public void testEquationsKeepTexForMathJax() {
        String html = render(
                EquationBlock.of("$$ a < b $$"),
                EquationBlock.of("\\( x \\)"),
                EquationBlock.of("y = 1 \\tag{2}"));
        assertTrue(html.contains("<div class=\"equation\">\n$$a &lt; b$$\n</div>"));
        assertTrue(html.contains("<div class=\"equation\">\n$x$\n</div>"));
        assertTrue(html.contains("$$y = 1\\tag{2}$$"));
    }

    @Test
    public void testDeeplyNestedEquationStillRenders() {
        String deep = "{".repeat(5000) + "x" + "}".repeat(5000);
        String html = assertDoesNotThrow(() -> render(EquationBlock.of("$$" + deep + "$$"), TextBlock.of("after")));
        assertTrue(html.contains("<div class=\"equation\">\n$$" + deep + "$$\n</div>"));
        assertTrue(html.contains("<p>after</p>"));
    }

    @Test
    public void testEmptyEquationIsSkipped() {
        String html = render(EquationBlock.of("$$   $$"));
        assertFalse(html.contains("<div class=\"equation\">"));
    }

    @Test
    public void testListKind() {
        String numbered = render(ListBlock.of(List.of("1. first", "2. second")));
        assertTrue(numbered.contains("<ol>\n<li>1. first</li>\n<li>2. second</li>\n</ol>"));

        String bullets = render(ListBlock.of(List.of("1. first", "second")));
        assertTrue(bullets.contains("<ul>"));
        assertFalse(bullets.contains("<ol>"));

        assertFalse(render(ListBlock.of(List.of())).contains("<ul>"));
    }

    @Test
    public void testImageIsInlinedAsDataUri() {
        ImageLoader loader = path -> Optional.of(new RenderAsset("a.png", new byte[]{1, 2, 3}, "image/png"));
        String html = renderer.render(List.of(ImageBlock.builder()
                .path("images/a.png")
                .caption("Figure 1")
                .caption("detail")
                .build()), loader);
        assertTrue(html.contains("<figure class=\"image\">"));
        assertTrue(html.contains("src=\"data:image/png;base64,AQID\""));
        assertTrue(html.contains("<figcaption>Figure 1<br/>detail</figcaption>"));
    }

    @Test
    public void testMissingImageIsSkipped() {
        String html = render(ImageBlock.builder().path("images/missing.png").caption("gone").build());
        assertFalse(html.contains("<figure class=\"image\">"));
        assertFalse(html.contains("gone"));
    }

    @Test
    public void testTableBodyIsVerbatim() {
        String table = "<table><tr><td>1</td></tr></table>";
        String html = render(TableBlock.builder().htmlBody(table).caption("Table 1").build());
        assertTrue(html.contains(table));
        assertTrue(html.contains("<p class=\"table-caption\">Table 1</p>"));
    }

    @Test
    public void testTableFallsBackToImage() {
        String html = renderer.render(List.of(TableBlock.builder().path("t.png").build()),
                TestImages.loaderFor("t.png"));
        assertTrue(html.contains("alt=\"table\""));

        String missing = render(TableBlock.builder().path("t.png").caption("Table 2").build());
        assertFalse(missing.contains("alt=\"table\""));
        assertTrue(missing.contains("<p class=\"table-caption\">Table 2</p>"));
    }

    @Test
    public void testCodeIsEscaped() {
        String html = render(CodeBlock.builder()
                .body("if a < b:\n    pass")
                .language("python")
                .caption("Listing 1")
                .build());
        assertTrue(html.contains("<p class=\"code-caption\">Listing 1</p>"));
        assertTrue(html.contains("<pre><code class=\"language-python\">if a &lt; b:\n    pass</code></pre>"));
    }

    @Test
    public void testIgnoredBlocksProduceNothing() {
        assertEquals(render(), render(new IgnoredBlock("page_footer")));
    }
}
