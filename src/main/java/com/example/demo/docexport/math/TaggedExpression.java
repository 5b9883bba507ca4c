package com.example.demo.docexport.math;

import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A LaTeX expression with its {@code \tag{...}} annotation split off. The tag
 * is rendered as a parenthesized suffix, never as math.
 */
@Value
public class TaggedExpression {
    private static final Pattern TAG = Pattern.compile("\\\\tag\\*?\\s*\\{([^{}]*)\\}");

    String body;

    /**
     * Tag text, or null when the expression carries none
     */
    String tag;

    public static TaggedExpression split(String expr) {
        if (expr == null) {
            return new TaggedExpression("", null);
        }
        Matcher m = TAG.matcher(expr);
        String tag = null;
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            tag = m.group(1).trim();
            m.appendReplacement(out, "");
        }
        m.appendTail(out);
        return new TaggedExpression(out.toString().trim(), tag);
    }

    public boolean hasTag() {
        return tag != null && !tag.isEmpty();
    }

    /**
     * @return " (tag)" or the empty string
     */
    public String tagSuffix() {
        return hasTag() ? " (" + tag + ")" : "";
    }
}
