package com.example.demo.docexport.exception;

/**
 * Signals that a LaTeX expression could not be carried through the
 * LaTeX → MathML → OMML chain. Callers degrade to plain text.
 */
public class MathConversionException extends RuntimeException {

    public MathConversionException(String message) {
        super(message);
    }

    public MathConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
