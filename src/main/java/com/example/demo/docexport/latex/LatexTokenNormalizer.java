package com.example.demo.docexport.latex;

import com.example.demo.docexport.model.MathExpression;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-level cleanup of raw LaTeX coming out of OCR/extraction, applied
 * before any structural parsing.
 *
 * Upstream extraction splits commands and scatters spaces around operators.
 * The rules below are applied in order; each one is exposed through
 * {@link #getRules()} so it can be exercised on its own.
 *
 * Notes:
 * - Delimiter stripping is not a {@link NormalizationRule} because it also
 *   yields the display/inline flag; see {@link #extract(String)}.
 * - {@code normalize(normalize(x)).equals(normalize(x))} holds for all input.
 */
@Slf4j
public class LatexTokenNormalizer {

    private static final Pattern TEXT_MACRO_ARGUMENT = Pattern.compile("\\\\([a-zA-Z]+)\\{([^{}]*)\\}");

    private static final List<NormalizationRule> RULES = List.of(
            NormalizationRule.regex("collapse-newlines",
                    "\\r?\\n|\\r", " "),
            NormalizationRule.regex("command-argument-spacing",
                    "\\\\([a-zA-Z]+)\\s+\\{", "\\\\$1{"),
            NormalizationRule.regex("script-operator-spacing",
                    "(?<!\\\\)\\s+([_^])", "$1",
                    "([_^])\\s+", "$1"),
            NormalizationRule.regex("token-adjacency-spacing",
                    "([a-zA-Z0-9}])\\s+\\\\", "$1\\\\",
                    "([a-zA-Z0-9}])\\s+\\(", "$1(",
                    "\\)\\s+([a-zA-Z0-9\\\\])", ")$1",
                    "\\{\\s+", "{",
                    "(?<!\\\\)\\s+\\}", "}",
                    "\\\\left\\s*\\(", "\\\\left(",
                    "\\\\right\\s*\\)", "\\\\right)",
                    "\\\\sum\\s*_\\{", "\\\\sum_{",
                    "\\\\int\\s*_\\{", "\\\\int_{"),
            NormalizationRule.of("text-macro-collapse", LatexTokenNormalizer::collapseTextMacros),
            NormalizationRule.of("collapse-whitespace", s -> s.replaceAll("\\s+", " ").strip()));

    public List<NormalizationRule> getRules() {
        return RULES;
    }

    /**
     * Normalize a raw LaTeX string. Total: never throws, null becomes "".
     */
    public String normalize(String raw) {
        return extract(raw).getBody();
    }

    /**
     * Strip enclosing delimiters, remember whether they were display ones,
     * and run every normalization rule over the remaining body.
     */
    public MathExpression extract(String raw) {
        if (raw == null) {
            return new MathExpression("", false);
        }
        String body = raw.strip();
        boolean display = false;
        String stripped;
        while ((stripped = stripEnclosing(body)) != null) {
            display |= isDisplayDelimited(body);
            body = stripped;
        }
        for (NormalizationRule rule : RULES) {
            body = rule.apply(body);
        }
        return new MathExpression(body, display);
    }

    private static boolean isDisplayDelimited(String body) {
        return body.startsWith("$$") || body.startsWith("\\[");
    }

    /**
     * @return the body without its enclosing delimiter pair, or null when the
     * string is not enclosed
     */
    private static String stripEnclosing(String body) {
        if (body.length() >= 4) {
            if (body.startsWith("$$") && body.endsWith("$$")
                    || body.startsWith("\\[") && body.endsWith("\\]")
                    || body.startsWith("\\(") && body.endsWith("\\)")) {
                return body.substring(2, body.length() - 2).strip();
            }
        }
        return null;
    }

    private static String collapseTextMacros(String input) {
        Matcher m = TEXT_MACRO_ARGUMENT.matcher(input);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String name = m.group(1);
            String replacement = m.group(0);
            if (LatexTextMacros.isTextMacro(name)) {
                replacement = "\\" + name + "{" + LatexTextMacros.collapse(m.group(2)) + "}";
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }
}
