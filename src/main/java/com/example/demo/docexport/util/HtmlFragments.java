package com.example.demo.docexport.util;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;

/**
 * jsoup helpers for the HTML fragments found in content lists: text bodies
 * with inline markup, and table bodies.
 */
public final class HtmlFragments {

    private HtmlFragments() {
    }

    /**
     * Escapes {@code &}, {@code <} and {@code >}. Quotes are left alone.
     */
    public static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    /**
     * Text content of a fragment with every {@code <br>} turned into a newline.
     * Other whitespace is kept as is.
     */
    public static String toPlainText(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        Document doc = Jsoup.parseBodyFragment(html);
        for (Element br : doc.body().select("br")) {
            br.replaceWith(new TextNode("\n"));
        }
        return doc.body().wholeText();
    }

    /**
     * Text content with {@code <sup>x</sup>} written as {@code ^(x)} and
     * {@code <sub>x</sub>} as {@code _(x)}, whitespace collapsed and trimmed.
     */
    public static String normalizeInline(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        Document doc = Jsoup.parseBodyFragment(html);
        for (Element script : doc.body().select("sup, sub")) {
            if (script.parent() == null) {
                continue; // nested inside a script already replaced
            }
            String marker = script.normalName().equals("sup") ? "^(" : "_(";
            script.replaceWith(new TextNode(marker + script.wholeText() + ")"));
        }
        return doc.body().wholeText().replaceAll("\\s+", " ").trim();
    }

    /**
     * Inner HTML of every cell, row by row. Cells are the direct td/th
     * children of each row. Empty when the fragment has no rows.
     */
    public static List<List<String>> tableRows(String html) {
        List<List<String>> rows = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return rows;
        }
        Document doc = Jsoup.parseBodyFragment(html);
        for (Element tr : doc.body().select("tr")) {
            List<String> cells = new ArrayList<>();
            for (Element cell : tr.children()) {
                if (cell.normalName().equals("td") || cell.normalName().equals("th")) {
                    cells.add(cell.html());
                }
            }
            rows.add(cells);
        }
        return rows;
    }
}
