package com.example.demo.docexport.latex;

import lombok.Value;

import java.util.List;

/**
 * Node of the tree built by {@link LatexNodeParser}.
 */
public interface LatexNode {

    /**
     * A run of ordinary characters.
     */
    @Value
    class CharsNode implements LatexNode {
        String chars;
    }

    /**
     * A brace group {@code {...}} that is not a macro argument.
     */
    @Value
    class GroupNode implements LatexNode {
        List<LatexNode> children;
    }

    /**
     * A macro with its parsed arguments. {@code postSpace} is the whitespace
     * that followed an argument-less macro name, or the empty string.
     */
    @Value
    class MacroNode implements LatexNode {
        String name;
        List<MacroArgument> arguments;
        String postSpace;
    }

    /**
     * One macro argument; optional arguments are bracketed.
     */
    @Value
    class MacroArgument {
        List<LatexNode> children;
        boolean optional;
    }

    /**
     * A nested math span such as {@code $...$} or {@code \(...\)}.
     */
    @Value
    class MathNode implements LatexNode {
        String leftDelimiter;
        String rightDelimiter;
        List<LatexNode> children;
    }

    /**
     * Anything the parser keeps as raw source, e.g. comments.
     */
    @Value
    class OpaqueNode implements LatexNode {
        String verbatim;
    }
}
