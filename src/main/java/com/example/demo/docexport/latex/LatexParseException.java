package com.example.demo.docexport.latex;

/**
 * Raised by {@link LatexNodeParser} on input it cannot build a tree for.
 * Never leaves {@link LatexStructuralSanitizer}.
 */
public class LatexParseException extends RuntimeException {

    public LatexParseException(String message, int position) {
        super(message + " at offset " + position);
    }
}
