package com.example.demo.docexport.latex;

import java.util.Set;

/**
 * Knowledge about "text-like" macros whose single argument holds words rather
 * than math, and the collapse rule that repairs per-character OCR splitting
 * inside them ({@code \text{f o o}} becomes {@code \text{foo}}).
 */
public final class LatexTextMacros {

    public static final Set<String> TEXT_MACROS = Set.of(
            "text",
            "mathrm",
            "mathbf",
            "mathit",
            "mathcal",
            "operatorname",
            "boldsymbol",
            "mathbb",
            "mathsf");

    private static final Set<String> SINGLE_CHAR_TOKENS = Set.of(
            "-", "+", "=", "|", "/", "(", ")", ",", ".", ":", "'");

    private LatexTextMacros() {
    }

    public static boolean isTextMacro(String name) {
        return name != null && TEXT_MACROS.contains(name);
    }

    /**
     * Collapse the argument of a text-like macro. When every whitespace-separated
     * token is a single character or a punctuation token the tokens are glued
     * together, otherwise they are joined with single spaces.
     */
    public static String collapse(String content) {
        if (content == null) {
            return null;
        }
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return content;
        }
        String[] tokens = trimmed.split("\\s+");
        boolean brokenWord = true;
        for (String token : tokens) {
            if (token.length() != 1 && !SINGLE_CHAR_TOKENS.contains(token)) {
                brokenWord = false;
                break;
            }
        }
        return String.join(brokenWord ? "" : " ", tokens);
    }
}
