package com.example.demo.docexport.util;

import com.example.demo.docexport.util.InlineMathSplitter.Segment;

/**
 * Escapes LaTeX special characters in prose. Math segments pass through
 * untouched.
 */
public final class LatexEscaper {

    private LatexEscaper() {
    }

    /**
     * Escape everything outside {@code $...$} and {@code $$...$$}.
     */
    public static String escapeText(String text) {
        StringBuilder out = new StringBuilder();
        for (Segment segment : InlineMathSplitter.split(text)) {
            out.append(segment.isMath() ? segment.getText() : escape(segment.getText()));
        }
        return out.toString();
    }

    /**
     * Escape every special character, one character at a time so replacements
     * are never escaped twice.
     */
    public static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\':
                    out.append("\\textbackslash{}");
                    break;
                case '&':
                case '%':
                case '$':
                case '#':
                case '_':
                case '{':
                case '}':
                    out.append('\\').append(c);
                    break;
                case '~':
                    out.append("\\textasciitilde{}");
                    break;
                case '^':
                    out.append("\\^{}");
                    break;
                default:
                    out.append(c);
            }
        }
        return out.toString();
    }
}
