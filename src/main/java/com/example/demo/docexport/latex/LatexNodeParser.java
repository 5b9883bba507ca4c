package com.example.demo.docexport.latex;

import com.example.demo.docexport.latex.LatexNode.CharsNode;
import com.example.demo.docexport.latex.LatexNode.GroupNode;
import com.example.demo.docexport.latex.LatexNode.MacroArgument;
import com.example.demo.docexport.latex.LatexNode.MacroNode;
import com.example.demo.docexport.latex.LatexNode.MathNode;
import com.example.demo.docexport.latex.LatexNode.OpaqueNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Small recursive-descent parser turning a LaTeX string into a list of
 * {@link LatexNode}s. Not thread-safe; create one per input.
 */
public class LatexNodeParser {

    /**
     * Argument specs of the macros whose arguments are parsed. "{" is a
     * mandatory argument, "[" an optional one. Unlisted macros take none and
     * their following groups stay plain {@link GroupNode}s.
     */
    private static final Map<String, String> ARGUMENT_SPECS = Map.ofEntries(
            Map.entry("text", "{"),
            Map.entry("mathrm", "{"),
            Map.entry("mathbf", "{"),
            Map.entry("mathit", "{"),
            Map.entry("mathcal", "{"),
            Map.entry("operatorname", "{"),
            Map.entry("boldsymbol", "{"),
            Map.entry("mathbb", "{"),
            Map.entry("mathsf", "{"),
            Map.entry("frac", "{{"),
            Map.entry("dfrac", "{{"),
            Map.entry("tfrac", "{{"),
            Map.entry("binom", "{{"),
            Map.entry("sqrt", "[{"),
            Map.entry("tag", "{"),
            Map.entry("label", "{"),
            Map.entry("begin", "{"),
            Map.entry("end", "{"));

    /**
     * Deepest nesting of groups, arguments and math accepted before the input
     * is rejected.
     */
    public static final int MAX_DEPTH = 256;

    private enum Terminator {
        END, BRACE, BRACKET, DOLLAR, DOUBLE_DOLLAR, MATH_PAREN, MATH_BRACKET
    }

    private final String input;
    private int pos;
    private int depth;

    public LatexNodeParser(String input) {
        this.input = input;
    }

    public List<LatexNode> parse() {
        pos = 0;
        depth = 0;
        return parseNodes(Terminator.END);
    }

    private List<LatexNode> parseNodes(Terminator terminator) {
        enter();
        try {
            return parseNodesAtDepth(terminator);
        } finally {
            depth--;
        }
    }

    private List<LatexNode> parseNodesAtDepth(Terminator terminator) {
        List<LatexNode> nodes = new ArrayList<>();
        StringBuilder chars = new StringBuilder();
        while (true) {
            if (pos >= input.length()) {
                if (terminator != Terminator.END) {
                    throw new LatexParseException("Unterminated " + terminator, pos);
                }
                flushChars(chars, nodes);
                return nodes;
            }
            if (atTerminator(terminator)) {
                flushChars(chars, nodes);
                consumeTerminator(terminator);
                return nodes;
            }
            char c = input.charAt(pos);
            switch (c) {
                case '\\':
                    flushChars(chars, nodes);
                    nodes.add(parseBackslash());
                    break;
                case '{':
                    flushChars(chars, nodes);
                    pos++;
                    nodes.add(new GroupNode(parseNodes(Terminator.BRACE)));
                    break;
                case '}':
                    throw new LatexParseException("Unbalanced '}'", pos);
                case '$':
                    flushChars(chars, nodes);
                    nodes.add(parseDollarMath());
                    break;
                case '%':
                    flushChars(chars, nodes);
                    nodes.add(parseComment());
                    break;
                default:
                    chars.append(c);
                    pos++;
            }
        }
    }

    private boolean atTerminator(Terminator terminator) {
        switch (terminator) {
            case BRACE:
                return input.charAt(pos) == '}';
            case BRACKET:
                return input.charAt(pos) == ']';
            case DOLLAR:
                return input.charAt(pos) == '$';
            case DOUBLE_DOLLAR:
                return input.startsWith("$$", pos);
            case MATH_PAREN:
                return input.startsWith("\\)", pos);
            case MATH_BRACKET:
                return input.startsWith("\\]", pos);
            default:
                return false;
        }
    }

    private void consumeTerminator(Terminator terminator) {
        switch (terminator) {
            case DOUBLE_DOLLAR:
            case MATH_PAREN:
            case MATH_BRACKET:
                pos += 2;
                break;
            default:
                pos += 1;
        }
    }

    private LatexNode parseBackslash() {
        enter();
        try {
            return parseBackslashAtDepth();
        } finally {
            depth--;
        }
    }

    private LatexNode parseBackslashAtDepth() {
        int start = pos;
        pos++; // backslash
        if (pos >= input.length()) {
            throw new LatexParseException("Dangling backslash", start);
        }
        char first = input.charAt(pos);
        if (first == '(') {
            pos++;
            return new MathNode("\\(", "\\)", parseNodes(Terminator.MATH_PAREN));
        }
        if (first == '[') {
            pos++;
            return new MathNode("\\[", "\\]", parseNodes(Terminator.MATH_BRACKET));
        }
        if (first == ')' || first == ']') {
            throw new LatexParseException("Unbalanced math delimiter", start);
        }
        if (!Character.isLetter(first)) {
            pos++;
            return new MacroNode(String.valueOf(first), Collections.emptyList(), "");
        }

        int nameStart = pos;
        while (pos < input.length() && Character.isLetter(input.charAt(pos))) {
            pos++;
        }
        String baseName = input.substring(nameStart, pos);
        String name = baseName;
        if (pos < input.length() && input.charAt(pos) == '*') {
            name = name + "*";
            pos++;
        }

        String spec = ARGUMENT_SPECS.get(baseName);
        if (spec == null) {
            return new MacroNode(name, Collections.emptyList(), readWhitespace());
        }

        List<MacroArgument> arguments = new ArrayList<>();
        for (char kind : spec.toCharArray()) {
            if (kind == '[') {
                MacroArgument optional = parseOptionalArgument();
                if (optional != null) {
                    arguments.add(optional);
                }
                continue;
            }
            int beforeArgument = pos;
            readWhitespace();
            MacroArgument mandatory = parseMandatoryArgument();
            if (mandatory == null) {
                // missing argument, leave the whitespace to the caller
                pos = beforeArgument;
                break;
            }
            arguments.add(mandatory);
        }
        return new MacroNode(name, arguments, "");
    }

    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw new LatexParseException("Nesting deeper than " + MAX_DEPTH + " levels", pos);
        }
    }

    private MacroArgument parseOptionalArgument() {
        int start = pos;
        readWhitespace();
        if (pos >= input.length() || input.charAt(pos) != '[') {
            pos = start;
            return null;
        }
        pos++;
        return new MacroArgument(parseNodes(Terminator.BRACKET), true);
    }

    private MacroArgument parseMandatoryArgument() {
        if (pos >= input.length()) {
            return null;
        }
        char c = input.charAt(pos);
        if (c == '{') {
            pos++;
            return new MacroArgument(parseNodes(Terminator.BRACE), false);
        }
        if (c == '\\') {
            return new MacroArgument(List.of(parseBackslash()), false);
        }
        if (c == '}' || c == '$' || c == '%' || c == ']') {
            return null;
        }
        pos++;
        return new MacroArgument(List.of(new CharsNode(String.valueOf(c))), false);
    }

    private LatexNode parseDollarMath() {
        if (input.startsWith("$$", pos)) {
            pos += 2;
            return new MathNode("$$", "$$", parseNodes(Terminator.DOUBLE_DOLLAR));
        }
        pos++;
        return new MathNode("$", "$", parseNodes(Terminator.DOLLAR));
    }

    private LatexNode parseComment() {
        int start = pos;
        int newline = input.indexOf('\n', pos);
        pos = newline < 0 ? input.length() : newline + 1;
        return new OpaqueNode(input.substring(start, pos));
    }

    private String readWhitespace() {
        int start = pos;
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
        return input.substring(start, pos);
    }

    private static void flushChars(StringBuilder chars, List<LatexNode> nodes) {
        if (chars.length() > 0) {
            nodes.add(new CharsNode(chars.toString()));
            chars.setLength(0);
        }
    }
}
