package com.example.demo.docexport.math;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PlainTextMathFallbackTest {

    @Test
    public void testSymbolsAreReplaced() {
        assertEquals("a → b", PlainTextMathFallback.render("a \\to b"));
        assertEquals("x ≤ y ≠ z", PlainTextMathFallback.render("x \\leq y \\neq z"));
        assertEquals("αβ", PlainTextMathFallback.render("\\alpha\\beta"));
    }

    @Test
    public void testOnlyWholeControlWordsAreReplaced() {
        assertEquals("\\top", PlainTextMathFallback.render("\\top"));
        assertEquals("\\interval", PlainTextMathFallback.render("\\interval"));
    }

    @Test
    public void testTextMacrosAreUnwrapped() {
        assertEquals("speed = v", PlainTextMathFallback.render("\\text{s p e e d} = v"));
        assertEquals("d x", PlainTextMathFallback.render("\\mathrm{d}\\,x"));
    }

    @Test
    public void testTagBecomesSuffix() {
        assertEquals("x → y (2)", PlainTextMathFallback.render("x \\rightarrow y \\tag{2}"));
    }

    @Test
    public void testNullIsEmpty() {
        assertEquals("", PlainTextMathFallback.render(null));
    }
}
