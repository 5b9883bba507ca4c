package com.example.demo.docexport.latex;

import com.example.demo.docexport.model.MathExpression;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class LatexTokenNormalizerTest {

    private final LatexTokenNormalizer normalizer = new LatexTokenNormalizer();

    @Test
    public void testRulesAreAppliedInDeclaredOrder() {
        List<String> names = normalizer.getRules().stream()
                .map(NormalizationRule::getName)
                .collect(Collectors.toList());
        assertEquals(List.of(
                "collapse-newlines",
                "command-argument-spacing",
                "script-operator-spacing",
                "token-adjacency-spacing",
                "text-macro-collapse",
                "collapse-whitespace"), names);
    }

    @Test
    public void testDisplayDelimitersAreStripped() {
        MathExpression dollars = normalizer.extract("$$ x ^ 2 $$");
        assertEquals("x^2", dollars.getBody());
        assertTrue(dollars.isDisplay());

        MathExpression brackets = normalizer.extract("\\[ a + b \\]");
        assertEquals("a + b", brackets.getBody());
        assertTrue(brackets.isDisplay());
    }

    @Test
    public void testInlineDelimitersAreStripped() {
        MathExpression inline = normalizer.extract("\\( a \\)");
        assertEquals("a", inline.getBody());
        assertFalse(inline.isDisplay());

        assertFalse(normalizer.extract("y = 2").isDisplay());
    }

    @Test
    public void testSplitTextMacroIsCollapsed() {
        assertEquals("\\text{foo}", normalizer.normalize("\\text { f o o }"));
        assertEquals("\\mathrm{dx}", normalizer.normalize("\\mathrm{d x}"));
    }

    @Test
    public void testMultiCharacterWordsKeepSingleSpaces() {
        assertEquals("\\text{hello world}", normalizer.normalize("\\text{hello    world}"));
    }

    @Test
    public void testUnknownMacroArgumentIsNotCollapsed() {
        assertEquals("\\frac{a b}{c}", normalizer.normalize("\\frac{a b}{c}"));
    }

    @Test
    public void testScriptSpacingIsRemoved() {
        assertEquals("x_{i}", normalizer.normalize("x _ { i }"));
        assertEquals("\\sum_{k}", normalizer.normalize("\\sum _{k}"));
    }

    @Test
    public void testTokenAdjacencySpacing() {
        assertEquals("a\\leq b", normalizer.normalize("a \\leq b"));
        assertEquals("f(x)", normalizer.normalize("f (x)"));
        assertEquals("\\left( x\\right)", normalizer.normalize("\\left ( x \\right )"));
    }

    @Test
    public void testNewlinesAndWhitespaceRunsCollapse() {
        assertEquals("a = b + c", normalizer.normalize("a =\nb  +\r\n c"));
    }

    @Test
    public void testNullAndBlankInputAreTotal() {
        assertEquals("", normalizer.normalize(null));
        assertEquals("", normalizer.normalize("   "));
        assertTrue(normalizer.extract("$$ $$").isEmpty());
    }

    @Test
    public void testNormalizeIsIdempotent() {
        List<String> samples = List.of(
                "$$ \\text { f o o } + x _ { i } $$",
                "\\frac { a } { b } \\cdot \\mathrm { d x }",
                "\\left ( \\sum _{i=1}^{n} i \\right ) \\tag { 2 }",
                "f (x) = \\operatorname{arg max} \\, y",
                "\\(\n a \\leq\n b \\)");
        for (String sample : samples) {
            String once = normalizer.normalize(sample);
            assertEquals(once, normalizer.normalize(once), "not idempotent for " + sample);
        }
    }

    @Test
    public void testNormalizeIsIdempotentOnGeneratedInput() {
        String[] tokens = {
                "\\text", "\\mathrm", "\\operatorname", "\\frac", "\\left", "\\right", "\\sum", "\\int",
                "\\leq", "\\tag", "\\", "\\ ", "{", "}", "(", ")", "[", "]", "_", "^", "&", ",", "=",
                "a", "b", "x", "1", "f o o", "hello", " ", "  ", "\t", "\n", "\r\n",
                "$", "$$", "\\(", "\\)", "\\[", "\\]"};
        Random random = new Random(20240611L);
        for (int i = 0; i < 5000; i++) {
            StringBuilder input = new StringBuilder();
            int length = 1 + random.nextInt(16);
            for (int t = 0; t < length; t++) {
                input.append(tokens[random.nextInt(tokens.length)]);
            }
            String once = normalizer.normalize(input.toString());
            assertEquals(once, normalizer.normalize(once), "not idempotent for '" + input + "'");
        }
    }

    @Test
    public void testCollapseNewlinesRule() {
        NormalizationRule rule = rule("collapse-newlines");
        assertEquals("a b c d", rule.apply("a\nb\r\nc\rd"));
    }

    @Test
    public void testCommandArgumentSpacingRule() {
        NormalizationRule rule = rule("command-argument-spacing");
        assertEquals("\\frac{a} x {b}", rule.apply("\\frac  {a} x {b}"));
    }

    @Test
    public void testScriptOperatorSpacingRule() {
        NormalizationRule rule = rule("script-operator-spacing");
        assertEquals("x_i^2", rule.apply("x _ i ^ 2"));
        assertEquals("a\\ _b", rule.apply("a\\ _b"));
    }

    @Test
    public void testTokenAdjacencySpacingRule() {
        NormalizationRule rule = rule("token-adjacency-spacing");
        assertEquals("a\\leq b", rule.apply("a \\leq b"));
        assertEquals("{x}", rule.apply("{ x }"));
        assertEquals("\\sum_{k}", rule.apply("\\sum _{k}"));
        assertEquals("x\\ }", rule.apply("x\\ }"));
    }

    @Test
    public void testTextMacroCollapseRule() {
        NormalizationRule rule = rule("text-macro-collapse");
        assertEquals("\\mathbf{ab} c", rule.apply("\\mathbf{a b} c"));
        assertEquals("\\frac{a b}{c}", rule.apply("\\frac{a b}{c}"));
    }

    @Test
    public void testCollapseWhitespaceRule() {
        NormalizationRule rule = rule("collapse-whitespace");
        assertEquals("a b", rule.apply("  a \t b  "));
    }

    private NormalizationRule rule(String name) {
        return normalizer.getRules().stream()
                .filter(r -> r.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no rule " + name));
    }
}
