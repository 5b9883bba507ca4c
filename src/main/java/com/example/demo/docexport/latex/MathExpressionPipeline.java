package com.example.demo.docexport.latex;

import com.example.demo.docexport.model.MathExpression;

/**
 * Turns the raw text of an equation or inline math segment into a clean
 * {@link MathExpression}: delimiters stripped, tokens normalized and, when
 * the pipeline is built with one, structurally sanitized.
 *
 * Whether the structural stage is present is decided once, at construction.
 * The normalizer-only pipeline is a supported configuration.
 */
public class MathExpressionPipeline {

    private final LatexTokenNormalizer normalizer;
    private final LatexStructuralSanitizer sanitizer;

    private MathExpressionPipeline(LatexTokenNormalizer normalizer, LatexStructuralSanitizer sanitizer) {
        this.normalizer = normalizer;
        this.sanitizer = sanitizer;
    }

    public static MathExpressionPipeline withStructuralSanitizer() {
        return new MathExpressionPipeline(new LatexTokenNormalizer(), new LatexStructuralSanitizer());
    }

    public static MathExpressionPipeline normalizerOnly() {
        return new MathExpressionPipeline(new LatexTokenNormalizer(), null);
    }

    public boolean hasStructuralSanitizer() {
        return sanitizer != null;
    }

    public MathExpression process(String raw) {
        MathExpression normalized = normalizer.extract(raw);
        if (sanitizer == null || normalized.isEmpty()) {
            return normalized;
        }
        return new MathExpression(sanitizer.sanitize(normalized.getBody()), normalized.isDisplay());
    }
}
