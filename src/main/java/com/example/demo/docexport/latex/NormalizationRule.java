package com.example.demo.docexport.latex;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named rewrite step of the {@link LatexTokenNormalizer}.
 */
public interface NormalizationRule {

    String getName();

    String apply(String input);

    static NormalizationRule of(String name, Function<String, String> rewrite) {
        return new NormalizationRule() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public String apply(String input) {
                return rewrite.apply(input);
            }

            @Override
            public String toString() {
                return "NormalizationRule[" + name + "]";
            }
        };
    }

    /**
     * Rule made of consecutive regex replacements, applied in order.
     * Replacement strings use {@link Matcher#replaceAll(String)} syntax.
     */
    static NormalizationRule regex(String name, String... patternReplacementPairs) {
        if (patternReplacementPairs.length % 2 != 0) {
            throw new IllegalArgumentException("Rule " + name + " needs pattern/replacement pairs");
        }
        Pattern[] patterns = new Pattern[patternReplacementPairs.length / 2];
        String[] replacements = new String[patterns.length];
        for (int i = 0; i < patterns.length; i++) {
            patterns[i] = Pattern.compile(patternReplacementPairs[2 * i]);
            replacements[i] = patternReplacementPairs[2 * i + 1];
        }
        return of(name, input -> {
            String out = input;
            for (int i = 0; i < patterns.length; i++) {
                out = patterns[i].matcher(out).replaceAll(replacements[i]);
            }
            return out;
        });
    }
}
