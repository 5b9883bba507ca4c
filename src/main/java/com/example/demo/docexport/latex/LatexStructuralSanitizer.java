package com.example.demo.docexport.latex;

import com.example.demo.docexport.latex.LatexNode.CharsNode;
import com.example.demo.docexport.latex.LatexNode.GroupNode;
import com.example.demo.docexport.latex.LatexNode.MacroArgument;
import com.example.demo.docexport.latex.LatexNode.MacroNode;
import com.example.demo.docexport.latex.LatexNode.MathNode;
import com.example.demo.docexport.latex.LatexNode.OpaqueNode;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Parses a normalized LaTeX expression into a tree and writes it back in
 * canonical form, collapsing the arguments of text-like macros.
 *
 * Best effort: {@link #sanitize(String)} never throws and returns its input
 * unchanged when the expression cannot be parsed.
 */
@Slf4j
public class LatexStructuralSanitizer {

    public String sanitize(String expr) {
        if (expr == null || expr.isBlank()) {
            return expr;
        }
        try {
            List<LatexNode> nodes = new LatexNodeParser(expr).parse();
            String cleaned = serialize(nodes)
                    .replace("\\ ", "\\")
                    .replaceAll("\\s+", " ")
                    .trim();
            return cleaned.isEmpty() ? expr : cleaned;
        } catch (LatexParseException e) {
            log.debug("Structural sanitizing skipped for '{}': {}", expr, e.getMessage());
            return expr;
        } catch (RuntimeException e) {
            log.warn("Unexpected failure sanitizing '{}'", expr, e);
            return expr;
        }
    }

    String serialize(List<LatexNode> nodes) {
        StringBuilder out = new StringBuilder();
        for (LatexNode node : nodes) {
            try {
                out.append(serialize(node));
            } catch (RuntimeException e) {
                log.debug("Dropping node {} during serialization: {}", node, e.getMessage());
            }
        }
        return out.toString();
    }

    private String serialize(LatexNode node) {
        if (node instanceof CharsNode) {
            return ((CharsNode) node).getChars();
        }
        if (node instanceof GroupNode) {
            return "{" + serialize(((GroupNode) node).getChildren()) + "}";
        }
        if (node instanceof MacroNode) {
            return serializeMacro((MacroNode) node);
        }
        if (node instanceof MathNode) {
            MathNode math = (MathNode) node;
            return math.getLeftDelimiter() + serialize(math.getChildren()) + math.getRightDelimiter();
        }
        if (node instanceof OpaqueNode) {
            String verbatim = ((OpaqueNode) node).getVerbatim();
            if (verbatim == null) {
                throw new IllegalStateException("Opaque node without source text");
            }
            return verbatim;
        }
        throw new IllegalStateException("Unknown node type " + node.getClass().getSimpleName());
    }

    private String serializeMacro(MacroNode macro) {
        StringBuilder out = new StringBuilder("\\").append(macro.getName());
        boolean textLike = LatexTextMacros.isTextMacro(macro.getName());
        for (MacroArgument argument : macro.getArguments()) {
            String content = serialize(argument.getChildren());
            if (textLike) {
                content = LatexTextMacros.collapse(content);
            }
            out.append(argument.isOptional() ? '[' : '{')
                    .append(content)
                    .append(argument.isOptional() ? ']' : '}');
        }
        out.append(macro.getPostSpace());
        return out.toString();
    }
}
