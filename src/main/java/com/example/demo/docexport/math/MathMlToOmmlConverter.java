package com.example.demo.docexport.math;

import com.example.demo.docexport.exception.MathConversionException;
import com.example.demo.docexport.util.XmlSupport;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Maps presentation MathML onto Office Math (OMML) markup.
 *
 * The result is a single {@code m:oMath} element carrying its own
 * {@code xmlns:m} declaration, ready to be imported into a WordprocessingML
 * paragraph.
 */
@Component
public class MathMlToOmmlConverter {
    public static final String OMML_NS = "http://schemas.openxmlformats.org/officeDocument/2006/math";

    private static final Map<String, String> STYLE_VARIANTS = Map.of(
            "normal", "p",
            "bold", "b",
            "italic", "i",
            "bold-italic", "bi");

    private static final Map<String, String> SCRIPT_VARIANTS = Map.of(
            "script", "script",
            "double-struck", "double-struck",
            "fraktur", "fraktur",
            "sans-serif", "sans-serif",
            "monospace", "monospace");

    public String convert(String mathMl) {
        Document source;
        try {
            source = XmlSupport.parse(mathMl);
        } catch (SAXException | IOException e) {
            throw new MathConversionException("Malformed MathML", e);
        }
        Element math = source.getDocumentElement();
        if (!"math".equals(XmlSupport.localName(math))) {
            throw new MathConversionException("MathML root is <" + XmlSupport.localName(math) + ">, expected <math>");
        }
        Document target = XmlSupport.newDocument();
        Element oMath = target.createElementNS(OMML_NS, "m:oMath");
        oMath.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:m", OMML_NS);
        target.appendChild(oMath);
        new Writer(target).appendSequence(oMath, XmlSupport.childElements(math));
        return XmlSupport.serialize(target);
    }

    private static final class Writer {
        private final Document doc;

        Writer(Document doc) {
            this.doc = doc;
        }

        void appendSequence(Element parent, List<Element> items) {
            for (int i = 0; i < items.size(); i++) {
                Element item = items.get(i);
                if (isNary(item)) {
                    Element operand = i + 1 < items.size() ? items.get(++i) : null;
                    parent.appendChild(nary(item, operand));
                } else {
                    for (Element converted : convert(item)) {
                        parent.appendChild(converted);
                    }
                }
            }
        }

        private List<Element> convert(Element el) {
            String name = XmlSupport.localName(el);
            switch (name) {
                case "mi":
                case "mn":
                case "mo":
                case "mtext":
                    return List.of(run(el));
                case "mspace":
                    return List.of(textRun(" ", null, null, false));
                case "mrow":
                    return convertRow(el);
                case "msup":
                    return List.of(script("m:sSup", el, "m:e", "m:sup"));
                case "msub":
                    return List.of(script("m:sSub", el, "m:e", "m:sub"));
                case "msubsup":
                    return List.of(script("m:sSubSup", el, "m:e", "m:sub", "m:sup"));
                case "mfrac":
                    return List.of(fraction(el));
                case "msqrt":
                    return List.of(radical(null, child(el, 0)));
                case "mroot":
                    return List.of(radical(child(el, 1), child(el, 0)));
                case "mover":
                    return List.of(over(el));
                case "munder":
                    return List.of(under(el));
                case "munderover": {
                    Element upper = omml("m:limUpp");
                    Element base = omml("m:e");
                    base.appendChild(limit("m:limLow", child(el, 0), child(el, 1)));
                    upper.appendChild(base);
                    upper.appendChild(wrap("m:lim", child(el, 2)));
                    return List.of(upper);
                }
                case "mtable":
                    return List.of(matrix(el));
                default:
                    throw new MathConversionException("Unsupported MathML element <" + name + ">");
            }
        }

        private List<Element> convertRow(Element row) {
            List<Element> children = XmlSupport.childElements(row);
            if (children.size() >= 2 && isFence(children.get(0)) && isFence(children.get(children.size() - 1))) {
                Element d = omml("m:d");
                Element dPr = omml("m:dPr");
                dPr.appendChild(valued("m:begChr", children.get(0).getTextContent()));
                dPr.appendChild(valued("m:endChr", children.get(children.size() - 1).getTextContent()));
                d.appendChild(dPr);
                Element e = omml("m:e");
                appendSequence(e, children.subList(1, children.size() - 1));
                d.appendChild(e);
                return List.of(d);
            }
            Element holder = omml("m:e");
            appendSequence(holder, children);
            return XmlSupport.childElements(holder);
        }

        private Element script(String name, Element el, String... parts) {
            Element script = omml(name);
            for (int i = 0; i < parts.length; i++) {
                script.appendChild(wrap(parts[i], child(el, i)));
            }
            return script;
        }

        private Element fraction(Element el) {
            Element f = omml("m:f");
            if ("0".equals(el.getAttribute("linethickness"))) {
                Element fPr = omml("m:fPr");
                fPr.appendChild(valued("m:type", "noBar"));
                f.appendChild(fPr);
            }
            f.appendChild(wrap("m:num", child(el, 0)));
            f.appendChild(wrap("m:den", child(el, 1)));
            return f;
        }

        private Element radical(Element degree, Element radicand) {
            Element rad = omml("m:rad");
            Element deg = omml("m:deg");
            if (degree == null) {
                Element radPr = omml("m:radPr");
                radPr.appendChild(valued("m:degHide", "1"));
                rad.appendChild(radPr);
            } else {
                appendSequence(deg, List.of(degree));
            }
            rad.appendChild(deg);
            rad.appendChild(wrap("m:e", radicand));
            return rad;
        }

        private Element over(Element el) {
            Element base = child(el, 0);
            Element mark = child(el, 1);
            if ("true".equals(el.getAttribute("accent"))) {
                Element acc = omml("m:acc");
                Element accPr = omml("m:accPr");
                accPr.appendChild(valued("m:chr", mark.getTextContent()));
                acc.appendChild(accPr);
                acc.appendChild(wrap("m:e", base));
                return acc;
            }
            if ("true".equals(mark.getAttribute("stretchy")) && "¯".equals(mark.getTextContent())) {
                return bar("top", base);
            }
            return limit("m:limUpp", base, mark);
        }

        private Element under(Element el) {
            Element base = child(el, 0);
            Element mark = child(el, 1);
            if ("mo".equals(XmlSupport.localName(mark)) && "_".equals(mark.getTextContent())) {
                return bar("bot", base);
            }
            return limit("m:limLow", base, mark);
        }

        private Element bar(String position, Element base) {
            Element bar = omml("m:bar");
            Element barPr = omml("m:barPr");
            barPr.appendChild(valued("m:pos", position));
            bar.appendChild(barPr);
            bar.appendChild(wrap("m:e", base));
            return bar;
        }

        private Element limit(String name, Element base, Element lim) {
            Element el = omml(name);
            el.appendChild(wrap("m:e", base));
            el.appendChild(wrap("m:lim", lim));
            return el;
        }

        private Element nary(Element op, Element operand) {
            String kind = XmlSupport.localName(op);
            Element sign = kind.equals("mo") ? op : child(op, 0);
            Element lower = null;
            Element upper = null;
            switch (kind) {
                case "msub":
                case "munder":
                    lower = child(op, 1);
                    break;
                case "msup":
                case "mover":
                    upper = child(op, 1);
                    break;
                case "msubsup":
                case "munderover":
                    lower = child(op, 1);
                    upper = child(op, 2);
                    break;
                default:
                    break;
            }
            Element nary = omml("m:nary");
            Element naryPr = omml("m:naryPr");
            naryPr.appendChild(valued("m:chr", sign.getTextContent()));
            naryPr.appendChild(valued("m:limLoc", sign.hasAttribute(LatexToMathMlConverter.LIMITS_ATTR) ? "undOvr" : "subSup"));
            if (lower == null) {
                naryPr.appendChild(valued("m:subHide", "1"));
            }
            if (upper == null) {
                naryPr.appendChild(valued("m:supHide", "1"));
            }
            nary.appendChild(naryPr);
            nary.appendChild(lower == null ? omml("m:sub") : wrap("m:sub", lower));
            nary.appendChild(upper == null ? omml("m:sup") : wrap("m:sup", upper));
            nary.appendChild(operand == null ? omml("m:e") : wrap("m:e", operand));
            return nary;
        }

        private Element matrix(Element table) {
            Element m = omml("m:m");
            for (Element tr : XmlSupport.childElements(table)) {
                Element mr = omml("m:mr");
                for (Element td : XmlSupport.childElements(tr)) {
                    Element e = omml("m:e");
                    appendSequence(e, XmlSupport.childElements(td));
                    mr.appendChild(e);
                }
                m.appendChild(mr);
            }
            return m;
        }

        private Element run(Element token) {
            String name = XmlSupport.localName(token);
            String text = token.getTextContent();
            String variant = token.getAttribute("mathvariant");
            String sty = STYLE_VARIANTS.get(variant);
            String scr = SCRIPT_VARIANTS.get(variant);
            if (sty == null && scr == null && name.equals("mi") && text.codePointCount(0, text.length()) > 1) {
                sty = "p";
            }
            return textRun(text, sty, scr, name.equals("mtext"));
        }

        private Element textRun(String text, String sty, String scr, boolean normalText) {
            Element r = omml("m:r");
            if (sty != null || scr != null || normalText) {
                Element rPr = omml("m:rPr");
                if (normalText) {
                    rPr.appendChild(omml("m:nor"));
                }
                if (scr != null) {
                    rPr.appendChild(valued("m:scr", scr));
                }
                if (sty != null) {
                    rPr.appendChild(valued("m:sty", sty));
                }
                r.appendChild(rPr);
            }
            Element t = omml("m:t");
            t.setAttributeNS(XMLConstants.XML_NS_URI, "xml:space", "preserve");
            t.appendChild(doc.createTextNode(text));
            r.appendChild(t);
            return r;
        }

        private Element wrap(String name, Element content) {
            Element el = omml(name);
            appendSequence(el, List.of(content));
            return el;
        }

        private Element valued(String name, String value) {
            Element el = omml(name);
            el.setAttributeNS(OMML_NS, "m:val", value);
            return el;
        }

        private Element omml(String qualifiedName) {
            return doc.createElementNS(OMML_NS, qualifiedName);
        }

        private static boolean isFence(Element el) {
            return "mo".equals(XmlSupport.localName(el)) && "true".equals(el.getAttribute("fence"));
        }

        private static boolean isNary(Element el) {
            String name = XmlSupport.localName(el);
            Element sign = name.equals("mo") ? el : null;
            if (name.equals("msub") || name.equals("msup") || name.equals("msubsup")
                    || name.equals("munder") || name.equals("mover") || name.equals("munderover")) {
                List<Element> children = XmlSupport.childElements(el);
                sign = children.isEmpty() ? null : children.get(0);
            }
            return sign != null
                    && "mo".equals(XmlSupport.localName(sign))
                    && "true".equals(sign.getAttribute("largeop"));
        }

        private static Element child(Element parent, int index) {
            List<Element> children = XmlSupport.childElements(parent);
            if (index >= children.size()) {
                throw new MathConversionException("<" + XmlSupport.localName(parent) + "> is missing operand " + index);
            }
            return children.get(index);
        }
    }
}
