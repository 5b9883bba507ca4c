package com.example.demo.docexport.util;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a list renders as numbered or bulleted. The decision covers
 * the whole list: one unnumbered item makes every item a bullet.
 */
public final class ListClassifier {
    private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\s*\\d+[.)]");

    private ListClassifier() {
    }

    public static boolean isNumbered(List<String> items) {
        if (items == null || items.isEmpty()) {
            return false;
        }
        return items.stream().allMatch(item -> item != null && NUMBERED_ITEM.matcher(item).find());
    }
}
