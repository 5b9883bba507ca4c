package com.example.demo.docexport.util;

import com.example.demo.docexport.util.InlineMathSplitter.Segment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InlineMathSplitterTest {

    @Test
    public void testTextAndMathAlternate() {
        List<Segment> segments = InlineMathSplitter.split("Let $x$ be $$y^2$$ here");
        assertEquals(List.of(
                new Segment("Let ", false),
                new Segment("$x$", true),
                new Segment(" be ", false),
                new Segment("$$y^2$$", true),
                new Segment(" here", false)), segments);
    }

    @Test
    public void testMathSpansNewlines() {
        List<Segment> segments = InlineMathSplitter.split("$a\n+ b$");
        assertEquals(1, segments.size());
        assertTrue(segments.get(0).isMath());
    }

    @Test
    public void testUnpairedDollarStaysInText() {
        List<Segment> segments = InlineMathSplitter.split("costs 5$ only");
        assertEquals(List.of(new Segment("costs 5$ only", false)), segments);
    }

    @Test
    public void testEmptyInput() {
        assertTrue(InlineMathSplitter.split("").isEmpty());
        assertTrue(InlineMathSplitter.split(null).isEmpty());
    }
}
