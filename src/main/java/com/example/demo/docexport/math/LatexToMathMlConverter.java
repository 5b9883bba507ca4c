package com.example.demo.docexport.math;

import com.example.demo.docexport.exception.MathConversionException;
import com.example.demo.docexport.util.XmlSupport;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.XMLConstants;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a LaTeX math expression into a presentation MathML document.
 *
 * Covers the subset that document extraction produces in practice: scripts,
 * fractions, roots, Greek letters and operator symbols, font-style macros,
 * accents, {@code \left...\right} fences and the matrix/cases/aligned
 * environments. Anything else is rejected with a
 * {@link MathConversionException} so the caller can fall back to plain text.
 */
@Component
public class LatexToMathMlConverter {
    public static final String MATHML_NS = "http://www.w3.org/1998/Math/MathML";

    /**
     * Marks operators whose scripts become under/over limits.
     */
    static final String LIMITS_ATTR = "movablelimits";

    /**
     * Deepest nesting of groups and commands the parser descends into.
     */
    static final int MAX_DEPTH = 256;

    private static final Map<String, String> GREEK = Map.ofEntries(
            Map.entry("alpha", "α"), Map.entry("beta", "β"), Map.entry("gamma", "γ"),
            Map.entry("delta", "δ"), Map.entry("epsilon", "ϵ"), Map.entry("varepsilon", "ε"),
            Map.entry("zeta", "ζ"), Map.entry("eta", "η"), Map.entry("theta", "θ"),
            Map.entry("vartheta", "ϑ"), Map.entry("iota", "ι"), Map.entry("kappa", "κ"),
            Map.entry("lambda", "λ"), Map.entry("mu", "μ"), Map.entry("nu", "ν"),
            Map.entry("xi", "ξ"), Map.entry("pi", "π"), Map.entry("varpi", "ϖ"),
            Map.entry("rho", "ρ"), Map.entry("varrho", "ϱ"), Map.entry("sigma", "σ"),
            Map.entry("varsigma", "ς"), Map.entry("tau", "τ"), Map.entry("upsilon", "υ"),
            Map.entry("phi", "ϕ"), Map.entry("varphi", "φ"), Map.entry("chi", "χ"),
            Map.entry("psi", "ψ"), Map.entry("omega", "ω"),
            Map.entry("Gamma", "Γ"), Map.entry("Delta", "Δ"), Map.entry("Theta", "Θ"),
            Map.entry("Lambda", "Λ"), Map.entry("Xi", "Ξ"), Map.entry("Pi", "Π"),
            Map.entry("Sigma", "Σ"), Map.entry("Upsilon", "Υ"), Map.entry("Phi", "Φ"),
            Map.entry("Psi", "Ψ"), Map.entry("Omega", "Ω"));

    private static final Map<String, String> IDENTIFIERS = Map.ofEntries(
            Map.entry("infty", "∞"), Map.entry("partial", "∂"), Map.entry("nabla", "∇"),
            Map.entry("emptyset", "∅"), Map.entry("varnothing", "∅"), Map.entry("ell", "ℓ"),
            Map.entry("hbar", "ℏ"), Map.entry("aleph", "ℵ"), Map.entry("Re", "ℜ"),
            Map.entry("Im", "ℑ"), Map.entry("wp", "℘"), Map.entry("imath", "ı"),
            Map.entry("jmath", "ȷ"), Map.entry("prime", "′"), Map.entry("degree", "°"));

    private static final Map<String, String> OPERATORS = Map.ofEntries(
            Map.entry("pm", "±"), Map.entry("mp", "∓"), Map.entry("times", "×"),
            Map.entry("div", "÷"), Map.entry("cdot", "⋅"), Map.entry("ast", "∗"),
            Map.entry("star", "⋆"), Map.entry("circ", "∘"), Map.entry("bullet", "∙"),
            Map.entry("oplus", "⊕"), Map.entry("otimes", "⊗"), Map.entry("odot", "⊙"),
            Map.entry("cup", "∪"), Map.entry("cap", "∩"), Map.entry("setminus", "∖"),
            Map.entry("wedge", "∧"), Map.entry("land", "∧"), Map.entry("vee", "∨"),
            Map.entry("lor", "∨"), Map.entry("neg", "¬"), Map.entry("lnot", "¬"),
            Map.entry("leq", "≤"), Map.entry("le", "≤"), Map.entry("geq", "≥"),
            Map.entry("ge", "≥"), Map.entry("neq", "≠"), Map.entry("ne", "≠"),
            Map.entry("approx", "≈"), Map.entry("equiv", "≡"), Map.entry("sim", "∼"),
            Map.entry("simeq", "≃"), Map.entry("cong", "≅"), Map.entry("propto", "∝"),
            Map.entry("ll", "≪"), Map.entry("gg", "≫"), Map.entry("leqslant", "⩽"),
            Map.entry("geqslant", "⩾"), Map.entry("prec", "≺"), Map.entry("succ", "≻"),
            Map.entry("in", "∈"), Map.entry("notin", "∉"), Map.entry("ni", "∋"),
            Map.entry("subset", "⊂"), Map.entry("supset", "⊃"), Map.entry("subseteq", "⊆"),
            Map.entry("supseteq", "⊇"), Map.entry("forall", "∀"), Map.entry("exists", "∃"),
            Map.entry("nexists", "∄"), Map.entry("perp", "⊥"), Map.entry("parallel", "∥"),
            Map.entry("mid", "∣"), Map.entry("angle", "∠"), Map.entry("triangle", "△"),
            Map.entry("therefore", "∴"), Map.entry("because", "∵"),
            Map.entry("rightarrow", "→"), Map.entry("to", "→"), Map.entry("leftarrow", "←"),
            Map.entry("gets", "←"), Map.entry("Rightarrow", "⇒"), Map.entry("Leftarrow", "⇐"),
            Map.entry("leftrightarrow", "↔"), Map.entry("Leftrightarrow", "⇔"),
            Map.entry("iff", "⇔"), Map.entry("implies", "⟹"), Map.entry("mapsto", "↦"),
            Map.entry("longrightarrow", "⟶"), Map.entry("longleftarrow", "⟵"),
            Map.entry("Longrightarrow", "⟹"), Map.entry("uparrow", "↑"),
            Map.entry("downarrow", "↓"), Map.entry("rightleftharpoons", "⇌"),
            Map.entry("cdots", "⋯"), Map.entry("ldots", "…"), Map.entry("dots", "…"),
            Map.entry("vdots", "⋮"), Map.entry("ddots", "⋱"),
            Map.entry("langle", "⟨"), Map.entry("rangle", "⟩"), Map.entry("lfloor", "⌊"),
            Map.entry("rfloor", "⌋"), Map.entry("lceil", "⌈"), Map.entry("rceil", "⌉"),
            Map.entry("vert", "|"), Map.entry("lvert", "|"), Map.entry("rvert", "|"),
            Map.entry("Vert", "‖"), Map.entry("lVert", "‖"), Map.entry("rVert", "‖"),
            Map.entry("lbrace", "{"), Map.entry("rbrace", "}"), Map.entry("colon", ":"),
            Map.entry("mod", "mod"), Map.entry("bmod", "mod"));

    private static final Map<String, String> LARGE_OPERATORS = Map.ofEntries(
            Map.entry("sum", "∑"), Map.entry("prod", "∏"), Map.entry("coprod", "∐"),
            Map.entry("bigcup", "⋃"), Map.entry("bigcap", "⋂"), Map.entry("bigoplus", "⨁"),
            Map.entry("bigotimes", "⨂"), Map.entry("bigvee", "⋁"), Map.entry("bigwedge", "⋀"),
            Map.entry("int", "∫"), Map.entry("iint", "∬"), Map.entry("iiint", "∭"),
            Map.entry("oint", "∮"));

    /**
     * Integrals keep their limits beside the sign.
     */
    private static final Set<String> SIDE_LIMIT_OPERATORS = Set.of("int", "iint", "iiint", "oint");

    private static final Set<String> FUNCTIONS = Set.of(
            "sin", "cos", "tan", "cot", "sec", "csc", "arcsin", "arccos", "arctan",
            "sinh", "cosh", "tanh", "coth", "log", "ln", "lg", "exp", "deg", "dim",
            "ker", "hom", "arg", "Pr");

    private static final Set<String> LIMIT_FUNCTIONS = Set.of(
            "lim", "liminf", "limsup", "max", "min", "sup", "inf", "det", "gcd", "argmax", "argmin");

    private static final Map<String, String> FONT_VARIANTS = Map.ofEntries(
            Map.entry("mathrm", "normal"), Map.entry("mathbf", "bold"),
            Map.entry("boldsymbol", "bold-italic"), Map.entry("bm", "bold-italic"),
            Map.entry("mathit", "italic"), Map.entry("mathcal", "script"),
            Map.entry("mathscr", "script"), Map.entry("mathbb", "double-struck"),
            Map.entry("mathsf", "sans-serif"), Map.entry("mathtt", "monospace"),
            Map.entry("mathfrak", "fraktur"));

    private static final Map<String, String> ACCENTS = Map.ofEntries(
            Map.entry("hat", "^"), Map.entry("widehat", "^"), Map.entry("bar", "¯"),
            Map.entry("vec", "→"), Map.entry("overrightarrow", "→"), Map.entry("tilde", "˜"),
            Map.entry("widetilde", "˜"), Map.entry("dot", "˙"), Map.entry("ddot", "¨"),
            Map.entry("check", "ˇ"), Map.entry("breve", "˘"), Map.entry("acute", "´"),
            Map.entry("grave", "`"));

    private static final Set<String> TEXT_MACROS = Set.of("text", "textrm", "textit", "textbf", "mbox", "textnormal");

    private static final Set<String> IGNORED_MACROS = Set.of(
            "displaystyle", "textstyle", "scriptstyle", "scriptscriptstyle", "limits", "nolimits",
            "nonumber", "notag", "label", "mathstrut", "strut", "!", "\\");

    private static final Set<String> SIZING_MACROS = Set.of(
            "big", "Big", "bigg", "Bigg", "bigl", "bigr", "Bigl", "Bigr",
            "biggl", "biggr", "Biggl", "Biggr", "bigm", "Bigm");

    private static final Map<String, String[]> ENVIRONMENT_FENCES = Map.ofEntries(
            Map.entry("matrix", new String[]{"", ""}),
            Map.entry("smallmatrix", new String[]{"", ""}),
            Map.entry("pmatrix", new String[]{"(", ")"}),
            Map.entry("bmatrix", new String[]{"[", "]"}),
            Map.entry("Bmatrix", new String[]{"{", "}"}),
            Map.entry("vmatrix", new String[]{"|", "|"}),
            Map.entry("Vmatrix", new String[]{"‖", "‖"}),
            Map.entry("cases", new String[]{"{", ""}),
            Map.entry("rcases", new String[]{"", "}"}),
            Map.entry("array", new String[]{"", ""}),
            Map.entry("aligned", new String[]{"", ""}),
            Map.entry("align", new String[]{"", ""}),
            Map.entry("align*", new String[]{"", ""}),
            Map.entry("alignedat", new String[]{"", ""}),
            Map.entry("gathered", new String[]{"", ""}),
            Map.entry("gather", new String[]{"", ""}),
            Map.entry("gather*", new String[]{"", ""}),
            Map.entry("split", new String[]{"", ""}),
            Map.entry("eqnarray", new String[]{"", ""}),
            Map.entry("eqnarray*", new String[]{"", ""}));

    /**
     * @param latex   expression without delimiters or tag
     * @param display whether the math is a display block
     * @return serialized MathML {@code <math>} document
     * @throws MathConversionException on unsupported or malformed input
     */
    public String convert(String latex, boolean display) {
        if (latex == null || latex.isBlank()) {
            throw new MathConversionException("Empty LaTeX expression");
        }
        Document doc = XmlSupport.newDocument();
        Element math = doc.createElementNS(MATHML_NS, "math");
        math.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns", MATHML_NS);
        math.setAttribute("display", display ? "block" : "inline");
        doc.appendChild(math);
        for (Element item : new Parser(doc, latex).parseAll()) {
            math.appendChild(item);
        }
        return XmlSupport.serialize(doc);
    }

    private enum Stop {
        END, BRACE, BRACKET, RIGHT, CELL
    }

    private static final class Parser {
        private final Document doc;
        private final String src;
        private int pos;
        private int depth;

        Parser(Document doc, String src) {
            this.doc = doc;
            this.src = src;
        }

        List<Element> parseAll() {
            return parseSequence(Stop.END);
        }

        private List<Element> parseSequence(Stop stop) {
            enter();
            try {
                return parseSequenceAtDepth(stop);
            } finally {
                depth--;
            }
        }

        private List<Element> parseSequenceAtDepth(Stop stop) {
            List<Element> out = new ArrayList<>();
            while (true) {
                skipWhitespace();
                if (pos >= src.length()) {
                    if (stop == Stop.END) {
                        return out;
                    }
                    throw error("Unexpected end of expression");
                }
                char c = src.charAt(pos);
                if (c == '}') {
                    if (stop != Stop.BRACE) {
                        throw error("Unbalanced '}'");
                    }
                    pos++;
                    return out;
                }
                if (stop == Stop.BRACKET && c == ']') {
                    pos++;
                    return out;
                }
                if (stop == Stop.RIGHT && lookingAtCommand("right")) {
                    return out;
                }
                if (stop == Stop.CELL && (c == '&' || src.startsWith("\\\\", pos) || lookingAtCommand("end"))) {
                    return out;
                }
                if (c == '&') {
                    throw error("Alignment tab outside an environment");
                }
                if (c == '^' || c == '_') {
                    Element base = out.isEmpty() ? element("mrow") : out.remove(out.size() - 1);
                    out.add(parseScripts(base));
                    continue;
                }
                Element atom = parseAtom();
                if (atom != null) {
                    out.add(parseScripts(atom));
                }
            }
        }

        private Element parseScripts(Element base) {
            Element sub = null;
            Element sup = null;
            while (true) {
                skipWhitespace();
                if (pos >= src.length()) {
                    break;
                }
                char c = src.charAt(pos);
                if (c == '_' && sub == null) {
                    pos++;
                    sub = parseScriptArgument();
                } else if (c == '^' && sup == null) {
                    pos++;
                    sup = parseScriptArgument();
                } else if (c == '\'' && sup == null) {
                    pos++;
                    sup = token("mo", "′");
                } else {
                    break;
                }
            }
            if (sub == null && sup == null) {
                return base;
            }
            boolean limits = base.hasAttribute(LIMITS_ATTR);
            String name;
            if (sub != null && sup != null) {
                name = limits ? "munderover" : "msubsup";
            } else if (sub != null) {
                name = limits ? "munder" : "msub";
            } else {
                name = limits ? "mover" : "msup";
            }
            Element script = element(name);
            script.appendChild(base);
            if (sub != null) {
                script.appendChild(sub);
            }
            if (sup != null) {
                script.appendChild(sup);
            }
            return script;
        }

        private Element parseScriptArgument() {
            skipWhitespace();
            if (pos >= src.length()) {
                throw error("Missing script argument");
            }
            char c = src.charAt(pos);
            if (c == '{') {
                pos++;
                return row(parseSequence(Stop.BRACE));
            }
            if (c == '\\') {
                Element atom = parseAtom();
                if (atom == null) {
                    throw error("Empty script argument");
                }
                return atom;
            }
            if (c == '}' || c == '^' || c == '_' || c == '&') {
                throw error("Missing script argument");
            }
            pos++;
            return atomForChar(c);
        }

        private Element parseArgument() {
            skipWhitespace();
            if (pos >= src.length()) {
                throw error("Missing argument");
            }
            char c = src.charAt(pos);
            if (c == '{') {
                pos++;
                return row(parseSequence(Stop.BRACE));
            }
            if (c == '\\') {
                Element atom = parseAtom();
                if (atom == null) {
                    throw error("Empty argument");
                }
                return atom;
            }
            if (c == '}' || c == '&') {
                throw error("Missing argument");
            }
            pos++;
            return atomForChar(c);
        }

        private Element parseAtom() {
            enter();
            try {
                return parseAtomAtDepth();
            } finally {
                depth--;
            }
        }

        private void enter() {
            if (++depth > MAX_DEPTH) {
                throw error("Nesting deeper than " + MAX_DEPTH + " levels");
            }
        }

        private Element parseAtomAtDepth() {
            char c = src.charAt(pos);
            if (c == '{') {
                pos++;
                return row(parseSequence(Stop.BRACE));
            }
            if (c == '\\') {
                return parseCommand();
            }
            if (Character.isDigit(c) || c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1))) {
                int start = pos;
                while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '.')) {
                    pos++;
                }
                return token("mn", src.substring(start, pos));
            }
            pos++;
            return atomForChar(c);
        }

        private Element atomForChar(char c) {
            if (Character.isLetter(c)) {
                return token("mi", String.valueOf(c));
            }
            if (Character.isDigit(c)) {
                return token("mn", String.valueOf(c));
            }
            switch (c) {
                case '-':
                    return token("mo", "−");
                case '*':
                    return token("mo", "∗");
                case '\'':
                    return token("mo", "′");
                case '~':
                    return space("0.278em");
                default:
                    return token("mo", String.valueOf(c));
            }
        }

        private Element parseCommand() {
            int start = pos;
            pos++; // backslash
            if (pos >= src.length()) {
                throw error("Dangling backslash");
            }
            char c = src.charAt(pos);
            if (!Character.isLetter(c)) {
                pos++;
                return controlSymbol(c, start);
            }
            String name = readLetters();
            if (pos < src.length() && src.charAt(pos) == '*') {
                pos++;
            }

            if (GREEK.containsKey(name)) {
                Element mi = token("mi", GREEK.get(name));
                if (Character.isUpperCase(name.charAt(0))) {
                    mi.setAttribute("mathvariant", "normal");
                }
                return mi;
            }
            if (IDENTIFIERS.containsKey(name)) {
                return token("mi", IDENTIFIERS.get(name));
            }
            if (OPERATORS.containsKey(name)) {
                return token("mo", OPERATORS.get(name));
            }
            if (LARGE_OPERATORS.containsKey(name)) {
                Element mo = token("mo", LARGE_OPERATORS.get(name));
                mo.setAttribute("largeop", "true");
                if (!SIDE_LIMIT_OPERATORS.contains(name)) {
                    mo.setAttribute(LIMITS_ATTR, "true");
                }
                return mo;
            }
            if (FUNCTIONS.contains(name)) {
                return token("mi", name);
            }
            if (LIMIT_FUNCTIONS.contains(name)) {
                Element mi = token("mi", name);
                mi.setAttribute(LIMITS_ATTR, "true");
                return mi;
            }
            if (FONT_VARIANTS.containsKey(name)) {
                Element arg = parseArgument();
                applyVariant(arg, FONT_VARIANTS.get(name));
                return arg;
            }
            if (ACCENTS.containsKey(name)) {
                Element over = element("mover");
                over.setAttribute("accent", "true");
                over.appendChild(parseArgument());
                over.appendChild(token("mo", ACCENTS.get(name)));
                return over;
            }
            if (TEXT_MACROS.contains(name)) {
                return token("mtext", cleanText(readRawGroup()));
            }
            if (IGNORED_MACROS.contains(name)) {
                return null;
            }
            if (SIZING_MACROS.contains(name)) {
                return fence(readDelimiter());
            }
            switch (name) {
                case "frac":
                case "dfrac":
                case "tfrac":
                case "cfrac": {
                    Element frac = element("mfrac");
                    frac.appendChild(parseArgument());
                    frac.appendChild(parseArgument());
                    return frac;
                }
                case "binom":
                case "dbinom":
                case "tbinom": {
                    Element frac = element("mfrac");
                    frac.setAttribute("linethickness", "0");
                    frac.appendChild(parseArgument());
                    frac.appendChild(parseArgument());
                    return fenced("(", List.of(frac), ")");
                }
                case "sqrt":
                    return parseRoot();
                case "operatorname": {
                    Element mi = token("mi", cleanText(readRawGroup()));
                    mi.setAttribute("mathvariant", "normal");
                    return mi;
                }
                case "overline": {
                    Element over = element("mover");
                    over.appendChild(parseArgument());
                    Element bar = token("mo", "¯");
                    bar.setAttribute("stretchy", "true");
                    over.appendChild(bar);
                    return over;
                }
                case "underline": {
                    Element under = element("munder");
                    under.appendChild(parseArgument());
                    under.appendChild(token("mo", "_"));
                    return under;
                }
                case "overbrace":
                case "underbrace": {
                    boolean top = name.equals("overbrace");
                    Element el = element(top ? "mover" : "munder");
                    el.appendChild(parseArgument());
                    el.appendChild(token("mo", top ? "⏞" : "⏟"));
                    el.setAttribute(LIMITS_ATTR, "true");
                    return el;
                }
                case "overset":
                case "stackrel":
                case "underset": {
                    Element annotation = parseArgument();
                    Element base = parseArgument();
                    Element el = element(name.equals("underset") ? "munder" : "mover");
                    el.appendChild(base);
                    el.appendChild(annotation);
                    return el;
                }
                case "not":
                    return negate(parseArgument());
                case "pmod": {
                    List<Element> items = new ArrayList<>();
                    items.add(token("mi", "mod"));
                    items.add(space("0.278em"));
                    items.add(parseArgument());
                    return fenced("(", items, ")");
                }
                case "quad":
                    return space("1em");
                case "qquad":
                    return space("2em");
                case "left":
                    return parseLeftRight();
                case "right":
                    throw error("Unbalanced \\right");
                case "begin":
                    return parseEnvironment();
                case "end":
                    throw error("Unbalanced \\end");
                default:
                    throw new MathConversionException("Unsupported macro \\" + name);
            }
        }

        private Element controlSymbol(char c, int start) {
            switch (c) {
                case ',':
                    return space("0.167em");
                case ':':
                case '>':
                    return space("0.222em");
                case ';':
                    return space("0.278em");
                case ' ':
                    return space("0.25em");
                case '!':
                case '\\':
                    return null;
                case '{':
                case '}':
                case '|':
                    return token("mo", c == '|' ? "‖" : String.valueOf(c));
                case '%':
                case '$':
                case '&':
                case '#':
                case '_':
                    return token("mo", String.valueOf(c));
                default:
                    pos = start;
                    throw new MathConversionException("Unsupported control symbol \\" + c);
            }
        }

        private Element parseRoot() {
            skipWhitespace();
            Element index = null;
            if (pos < src.length() && src.charAt(pos) == '[') {
                pos++;
                index = row(parseSequence(Stop.BRACKET));
            }
            Element radicand = parseArgument();
            if (index == null) {
                Element sqrt = element("msqrt");
                sqrt.appendChild(radicand);
                return sqrt;
            }
            Element root = element("mroot");
            root.appendChild(radicand);
            root.appendChild(index);
            return root;
        }

        private Element parseLeftRight() {
            String open = readDelimiter();
            List<Element> inner = parseSequence(Stop.RIGHT);
            pos += "\\right".length();
            String close = readDelimiter();
            return fenced(open, inner, close);
        }

        private Element parseEnvironment() {
            String name = readRawGroup().trim();
            String[] fences = ENVIRONMENT_FENCES.get(name);
            if (fences == null) {
                throw new MathConversionException("Unsupported environment " + name);
            }
            if (name.equals("array") || name.equals("alignedat")) {
                readRawGroup(); // column spec or column count
            }
            List<List<Element>> rows = new ArrayList<>();
            List<Element> cells = new ArrayList<>();
            while (true) {
                cells.add(row(parseSequence(Stop.CELL)));
                if (src.charAt(pos) == '&') {
                    pos++;
                } else if (src.startsWith("\\\\", pos)) {
                    pos += 2;
                    skipRowSpacing();
                    rows.add(cells);
                    cells = new ArrayList<>();
                } else {
                    pos += "\\end".length();
                    String endName = readRawGroup().trim();
                    if (!endName.equals(name)) {
                        throw error("Environment " + name + " closed by " + endName);
                    }
                    if (!(cells.size() == 1 && isEmptyRow(cells.get(0)) && !rows.isEmpty())) {
                        rows.add(cells);
                    }
                    break;
                }
            }
            Element table = element("mtable");
            for (List<Element> rowCells : rows) {
                Element tr = element("mtr");
                for (Element cell : rowCells) {
                    Element td = element("mtd");
                    td.appendChild(cell);
                    tr.appendChild(td);
                }
                table.appendChild(tr);
            }
            if (fences[0].isEmpty() && fences[1].isEmpty()) {
                return table;
            }
            return fenced(fences[0], List.of(table), fences[1]);
        }

        private void skipRowSpacing() {
            skipWhitespace();
            if (pos < src.length() && src.charAt(pos) == '[') {
                int close = src.indexOf(']', pos);
                if (close > 0) {
                    pos = close + 1;
                }
            }
        }

        private String readDelimiter() {
            skipWhitespace();
            if (pos >= src.length()) {
                throw error("Missing delimiter");
            }
            char c = src.charAt(pos);
            if (c == '\\') {
                pos++;
                if (pos >= src.length()) {
                    throw error("Dangling backslash");
                }
                char next = src.charAt(pos);
                if (!Character.isLetter(next)) {
                    pos++;
                    return next == '|' ? "‖" : String.valueOf(next);
                }
                String name = readLetters();
                String symbol = OPERATORS.get(name);
                if (symbol == null) {
                    throw new MathConversionException("Unsupported delimiter \\" + name);
                }
                return symbol;
            }
            pos++;
            switch (c) {
                case '.':
                    return "";
                case '<':
                    return "⟨";
                case '>':
                    return "⟩";
                default:
                    return String.valueOf(c);
            }
        }

        /**
         * Raw text of a brace group, braces balanced, without the outer pair.
         */
        private String readRawGroup() {
            skipWhitespace();
            if (pos >= src.length()) {
                throw error("Missing group");
            }
            if (src.charAt(pos) != '{') {
                return String.valueOf(src.charAt(pos++));
            }
            int depth = 0;
            int start = pos + 1;
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (c == '\\') {
                    pos += 2;
                    continue;
                }
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        pos++;
                        return src.substring(start, pos - 1);
                    }
                }
                pos++;
            }
            throw error("Unterminated group");
        }

        private Element negate(Element arg) {
            String text = arg.getTextContent();
            switch (text) {
                case "=":
                    return token("mo", "≠");
                case "<":
                    return token("mo", "≮");
                case ">":
                    return token("mo", "≯");
                case "∈":
                    return token("mo", "∉");
                case "≡":
                    return token("mo", "≢");
                default:
                    return token("mo", text + "̸");
            }
        }

        private void applyVariant(Element el, String variant) {
            String name = XmlSupport.localName(el);
            if (name.equals("mi") || name.equals("mn") || name.equals("mtext")) {
                el.setAttribute("mathvariant", variant);
                return;
            }
            for (Element child : XmlSupport.childElements(el)) {
                applyVariant(child, variant);
            }
        }

        private boolean isEmptyRow(Element el) {
            return XmlSupport.localName(el).equals("mrow") && !el.hasChildNodes();
        }

        private String cleanText(String raw) {
            return raw.replace("\\,", " ").replace("\\ ", " ").replace("\\;", " ");
        }

        private boolean lookingAtCommand(String name) {
            if (!src.startsWith("\\" + name, pos)) {
                return false;
            }
            int after = pos + name.length() + 1;
            return after >= src.length() || !Character.isLetter(src.charAt(after));
        }

        private String readLetters() {
            int start = pos;
            while (pos < src.length() && Character.isLetter(src.charAt(pos))) {
                pos++;
            }
            return src.substring(start, pos);
        }

        private void skipWhitespace() {
            while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
                pos++;
            }
        }

        private Element fenced(String open, List<Element> inner, String close) {
            Element mrow = element("mrow");
            mrow.appendChild(fence(open));
            for (Element el : inner) {
                mrow.appendChild(el);
            }
            mrow.appendChild(fence(close));
            return mrow;
        }

        private Element fence(String symbol) {
            Element mo = token("mo", symbol);
            mo.setAttribute("fence", "true");
            mo.setAttribute("stretchy", "true");
            return mo;
        }

        private Element row(List<Element> items) {
            if (items.size() == 1) {
                return items.get(0);
            }
            Element mrow = element("mrow");
            for (Element item : items) {
                mrow.appendChild(item);
            }
            return mrow;
        }

        private Element space(String width) {
            Element space = element("mspace");
            space.setAttribute("width", width);
            return space;
        }

        private Element token(String name, String text) {
            Element el = element(name);
            el.appendChild(doc.createTextNode(text));
            return el;
        }

        private Element element(String name) {
            return doc.createElementNS(MATHML_NS, name);
        }

        private MathConversionException error(String message) {
            return new MathConversionException(message + " at offset " + pos + " in '" + src + "'");
        }
    }
}
