package com.example.demo.docexport.math;

import com.example.demo.docexport.latex.LatexTextMacros;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Readable plain-text rendering of a LaTeX expression, used when the
 * conversion chain rejects it. Pure string substitution; never throws.
 */
public final class PlainTextMathFallback {

    private static final Pattern CONTROL_WORD = Pattern.compile("\\\\([a-zA-Z]+)(?![a-zA-Z])");
    private static final Pattern TEXT_MACRO = Pattern.compile(
            "\\\\(mathrm|text|operatorname|mathsf|mathbf|boldsymbol)\\s*\\{([^{}]*)\\}");

    private static final Map<String, String> SYMBOLS = new LinkedHashMap<>();

    static {
        SYMBOLS.put("rightarrow", "→");
        SYMBOLS.put("leftarrow", "←");
        SYMBOLS.put("Rightarrow", "⇒");
        SYMBOLS.put("Leftarrow", "⇐");
        SYMBOLS.put("leftrightarrow", "↔");
        SYMBOLS.put("mapsto", "↦");
        SYMBOLS.put("to", "→");
        SYMBOLS.put("leq", "≤");
        SYMBOLS.put("le", "≤");
        SYMBOLS.put("geq", "≥");
        SYMBOLS.put("ge", "≥");
        SYMBOLS.put("times", "×");
        SYMBOLS.put("pm", "±");
        SYMBOLS.put("cdot", "·");
        SYMBOLS.put("neq", "≠");
        SYMBOLS.put("ne", "≠");
        SYMBOLS.put("approx", "≈");
        SYMBOLS.put("infty", "∞");
        SYMBOLS.put("partial", "∂");
        SYMBOLS.put("sum", "∑");
        SYMBOLS.put("prod", "∏");
        SYMBOLS.put("int", "∫");
        SYMBOLS.put("in", "∈");
        SYMBOLS.put("alpha", "α");
        SYMBOLS.put("beta", "β");
        SYMBOLS.put("gamma", "γ");
        SYMBOLS.put("delta", "δ");
        SYMBOLS.put("epsilon", "ε");
        SYMBOLS.put("varepsilon", "ε");
        SYMBOLS.put("theta", "θ");
        SYMBOLS.put("lambda", "λ");
        SYMBOLS.put("mu", "μ");
        SYMBOLS.put("pi", "π");
        SYMBOLS.put("rho", "ρ");
        SYMBOLS.put("sigma", "σ");
        SYMBOLS.put("tau", "τ");
        SYMBOLS.put("phi", "φ");
        SYMBOLS.put("varphi", "φ");
        SYMBOLS.put("omega", "ω");
        SYMBOLS.put("Gamma", "Γ");
        SYMBOLS.put("Delta", "Δ");
        SYMBOLS.put("Theta", "Θ");
        SYMBOLS.put("Lambda", "Λ");
        SYMBOLS.put("Sigma", "Σ");
        SYMBOLS.put("Phi", "Φ");
        SYMBOLS.put("Omega", "Ω");
    }

    private PlainTextMathFallback() {
    }

    /**
     * @return the expression with symbols replaced, text macros unwrapped and
     * any {@code \tag} rendered as a " (tag)" suffix
     */
    public static String render(String expr) {
        if (expr == null) {
            return "";
        }
        TaggedExpression tagged = TaggedExpression.split(expr);
        String text = replaceSymbols(tagged.getBody());

        Matcher m = TEXT_MACRO.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(out, Matcher.quoteReplacement(LatexTextMacros.collapse(m.group(2))));
        }
        m.appendTail(out);

        String plain = out.toString().replace("\\,", " ").replace("\\ ", " ");
        return plain + tagged.tagSuffix();
    }

    private static String replaceSymbols(String text) {
        Matcher m = CONTROL_WORD.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String symbol = SYMBOLS.get(m.group(1));
            m.appendReplacement(out, Matcher.quoteReplacement(symbol != null ? symbol : m.group(0)));
        }
        m.appendTail(out);
        return out.toString();
    }
}
