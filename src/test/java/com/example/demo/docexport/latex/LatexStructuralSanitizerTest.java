package com.example.demo.docexport.latex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LatexStructuralSanitizerTest {

    private final LatexStructuralSanitizer sanitizer = new LatexStructuralSanitizer();

    @Test
    public void testMacrosAndGroupsRoundTrip() {
        assertEquals("\\frac{a}{b}+{c}", sanitizer.sanitize("\\frac{a}{b}+{c}"));
    }

    @Test
    public void testOptionalArgumentKeepsBrackets() {
        assertEquals("\\sqrt[3]{x}", sanitizer.sanitize("\\sqrt[3]{x}"));
        assertEquals("\\sqrt[3]{x}", sanitizer.sanitize("\\sqrt [3]{x}"));
    }

    @Test
    public void testTextMacroArgumentIsCollapsed() {
        assertEquals("\\text{foo}=1", sanitizer.sanitize("\\text{f o o}=1"));
        assertEquals("\\operatorname{arg max}", sanitizer.sanitize("\\operatorname{arg   max}"));
    }

    @Test
    public void testTextMacroWithNestedGroupKeepsWords() {
        assertEquals("\\mathrm{a b{c}}", sanitizer.sanitize("\\mathrm{a  b{c}}"));
    }

    @Test
    public void testSpaceAfterArgumentlessMacroIsKept() {
        assertEquals("\\alpha x", sanitizer.sanitize("\\alpha x"));
    }

    @Test
    public void testNestedMathAndCommentsAreKept() {
        assertEquals("a $b$ c", sanitizer.sanitize("a $b$ c"));
        assertEquals("x % note", sanitizer.sanitize("x % note"));
    }

    @Test
    public void testUnparseableInputIsReturnedUnchanged() {
        assertEquals("a}b", sanitizer.sanitize("a}b"));
        assertEquals("\\frac{a", sanitizer.sanitize("\\frac{a"));
        assertEquals("x\\", sanitizer.sanitize("x\\"));
    }

    @Test
    public void testNonEmptyInputNeverComesBackEmpty() {
        String[] inputs = {"{}", "\\ ", "%", "}", "\\frac", "$$", "\\(\\)", "\\sqrt[", "x_{"};
        for (String input : inputs) {
            String out = assertDoesNotThrow(() -> sanitizer.sanitize(input));
            assertFalse(out.isEmpty(), "empty result for " + input);
        }
    }

    @Test
    public void testDeepNestingIsReturnedUnchanged() {
        String deep = "{".repeat(5000) + "x" + "}".repeat(5000);
        assertEquals(deep, assertDoesNotThrow(() -> sanitizer.sanitize(deep)));

        String shallow = "{".repeat(100) + "\\text{a  b}" + "}".repeat(100);
        assertEquals("{".repeat(100) + "\\text{a b}" + "}".repeat(100), sanitizer.sanitize(shallow));
    }

    @Test
    public void testBlankInputIsReturnedAsIs() {
        assertNull(sanitizer.sanitize(null));
        assertEquals("  ", sanitizer.sanitize("  "));
    }
}
