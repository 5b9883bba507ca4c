package com.example.demo.docexport.model;

import lombok.Value;

/**
 * A LaTeX expression with its delimiters stripped and whitespace normalized.
 */
@Value
public class MathExpression {
    String body;
    boolean display;

    public boolean isEmpty() {
        return body == null || body.isEmpty();
    }

    public boolean hasTag() {
        return body != null && body.contains("\\tag");
    }
}
