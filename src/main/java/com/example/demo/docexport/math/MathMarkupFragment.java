package com.example.demo.docexport.math;

import lombok.Value;
import org.apache.xmlbeans.XmlObject;

/**
 * Office Math markup ready to be spliced into a word-processor paragraph.
 * {@code omml} is a parsed {@code m:oMath} element for inline math and an
 * {@code m:oMathPara} element for display math.
 */
@Value
public class MathMarkupFragment {
    /**
     * Tag text to append after the math as " (tag)", or null
     */
    String tag;

    boolean inline;

    XmlObject omml;

    public String tagSuffix() {
        return tag == null || tag.isEmpty() ? "" : " (" + tag + ")";
    }
}
