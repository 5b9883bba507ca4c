package com.example.demo.docexport.math;

import com.example.demo.docexport.exception.MathConversionException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static com.example.demo.docexport.math.MathMlToOmmlConverter.OMML_NS;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

public class MathConversionChainTest {

    private final MathConversionChain chain = MathConversionChain.createDefault();

    @Test
    public void testInlineMathIsSingleOfficeMathElement() {
        MathMarkupFragment fragment = chain.renderMath("x^2", true);
        assertTrue(fragment.isInline());
        assertTrue(xml(fragment).startsWith("<m:oMath"));
        assertTrue(xml(fragment).contains(OMML_NS));
        assertFalse(xml(fragment).contains("oMathPara"));
        assertNull(fragment.getTag());
        assertEquals("", fragment.tagSuffix());
    }

    @Test
    public void testDisplayMathIsWrappedInParagraph() {
        MathMarkupFragment fragment = chain.renderMath("\\frac{a}{b}", false);
        assertFalse(fragment.isInline());
        assertTrue(xml(fragment).startsWith("<m:oMathPara"));
        assertTrue(xml(fragment).contains(OMML_NS));
        assertTrue(xml(fragment).trim().endsWith("</m:oMathPara>"));
    }

    @Test
    public void testTagIsSplitOffAsSuffix() {
        MathMarkupFragment fragment = chain.renderMath("E = mc^2 \\tag{3.1}", false);
        assertEquals("3.1", fragment.getTag());
        assertEquals(" (3.1)", fragment.tagSuffix());
        assertFalse(xml(fragment).contains("tag"));
    }

    @Test
    public void testTagOnlyExpressionIsRejected() {
        assertThrows(MathConversionException.class, () -> chain.renderMath("\\tag{3}", false));
        assertThrows(MathConversionException.class, () -> chain.renderMath("", true));
    }

    @Test
    public void testUnsupportedMacroIsRejected() {
        assertThrows(MathConversionException.class, () -> chain.renderMath("\\unknownmacro x", true));
    }

    @Test
    public void testMalformedOfficeMathIsRejected() {
        MathMlToOmmlConverter broken = Mockito.mock(MathMlToOmmlConverter.class);
        when(broken.convert(anyString())).thenReturn("<m:oMath xmlns:m=\"" + OMML_NS + "\"><m:r>");
        MathConversionChain brokenChain = new MathConversionChain(new LatexToMathMlConverter(), broken);

        MathConversionException e = assertThrows(MathConversionException.class,
                () -> brokenChain.renderMath("x + 1", true));
        assertNotNull(e.getCause());
    }

    @Test
    public void testFragmentCarriesParsedMarkup() {
        MathMarkupFragment fragment = chain.renderMath("a + b", false);
        assertNotNull(fragment.getOmml());
        assertTrue(fragment.getOmml().xmlText().contains("oMathPara"));
    }

    @Test
    public void testBoldAliases() {
        assertEquals("\\boldsymbol{x}", MathConversionChain.applyAliases("\\pmb{x}"));
        assertEquals("\\mathbf{x}", MathConversionChain.applyAliases("\\mathbf {x}"));
        assertEquals("\\mathbf x", MathConversionChain.applyAliases("\\mathbf x"));
        assertEquals("\\pmbox", MathConversionChain.applyAliases("\\pmbox"));
        assertNotNull(chain.renderMath("\\pmb{v} \\cdot \\mathbf {w}", true));
    }

    private static String xml(MathMarkupFragment fragment) {
        return fragment.getOmml().xmlText();
    }
}
