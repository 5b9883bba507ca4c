package com.example.demo.docexport.math;

import com.example.demo.docexport.exception.MathConversionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlObject;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LaTeX to Office Math, via MathML. Every stage may reject the expression;
 * callers catch {@link MathConversionException} and use
 * {@link PlainTextMathFallback} instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MathConversionChain {
    private static final String OMATH_OPEN = "<m:oMath";
    private static final String OMML_XMLNS = "xmlns:m=\"" + MathMlToOmmlConverter.OMML_NS + "\"";

    private static final Pattern PMB = Pattern.compile("\\\\pmb(?![a-zA-Z])");
    private static final Pattern BOLD_SPACE = Pattern.compile("\\\\(mathbf|boldsymbol)\\s+\\{");

    private final LatexToMathMlConverter latexToMathMl;
    private final MathMlToOmmlConverter mathMlToOmml;

    public static MathConversionChain createDefault() {
        return new MathConversionChain(new LatexToMathMlConverter(), new MathMlToOmmlConverter());
    }

    /**
     * @param expr   sanitized LaTeX, delimiters already stripped
     * @param inline true for math inside a text run, false for a display block
     */
    public MathMarkupFragment renderMath(String expr, boolean inline) {
        TaggedExpression tagged = TaggedExpression.split(expr);
        String body = applyAliases(tagged.getBody()).trim();
        if (body.isEmpty()) {
            throw new MathConversionException("Nothing to convert in '" + expr + "'");
        }

        String mathMl = latexToMathMl.convert(body, !inline);
        String omml = mathMlToOmml.convert(mathMl).trim();
        if (!omml.startsWith(OMATH_OPEN)) {
            throw new MathConversionException("Converter produced no m:oMath root for '" + body + "'");
        }
        if (!omml.contains(OMML_XMLNS)) {
            omml = OMATH_OPEN + " " + OMML_XMLNS + omml.substring(OMATH_OPEN.length());
        }
        if (!inline) {
            omml = "<m:oMathPara " + OMML_XMLNS + ">" + omml + "</m:oMathPara>";
        }
        XmlObject parsed;
        try {
            parsed = XmlObject.Factory.parse(omml);
        } catch (XmlException e) {
            throw new MathConversionException("Converted math for '" + body + "' is not well-formed XML", e);
        }
        log.trace("Converted '{}' to {}", body, omml);
        return new MathMarkupFragment(tagged.getTag(), inline, parsed);
    }

    /**
     * {@code \pmb} becomes {@code \boldsymbol}; a space between a bold macro
     * and its group is dropped. A space before a bare letter is kept so
     * {@code \mathbf x} does not turn into an unknown control word.
     */
    static String applyAliases(String expr) {
        String aliased = PMB.matcher(expr).replaceAll(Matcher.quoteReplacement("\\boldsymbol"));
        return BOLD_SPACE.matcher(aliased).replaceAll("\\\\$1{");
    }
}
