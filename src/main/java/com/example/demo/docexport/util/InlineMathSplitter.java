package com.example.demo.docexport.util;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits running text into plain and math segments on {@code $$...$$} and
 * {@code $...$}. Matching is non-greedy and spans newlines; an unpaired
 * {@code $} stays in the surrounding text.
 */
public final class InlineMathSplitter {
    private static final Pattern MATH = Pattern.compile("\\$\\$.*?\\$\\$|\\$.*?\\$", Pattern.DOTALL);

    private InlineMathSplitter() {
    }

    @Value
    public static class Segment {
        String text;
        boolean math;
    }

    public static List<Segment> split(String text) {
        List<Segment> segments = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return segments;
        }
        Matcher m = MATH.matcher(text);
        int last = 0;
        while (m.find()) {
            if (m.start() > last) {
                segments.add(new Segment(text.substring(last, m.start()), false));
            }
            segments.add(new Segment(m.group(), true));
            last = m.end();
        }
        if (last < text.length()) {
            segments.add(new Segment(text.substring(last), false));
        }
        return segments;
    }
}
