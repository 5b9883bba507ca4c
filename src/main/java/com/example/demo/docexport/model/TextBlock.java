package com.example.demo.docexport.model;

import lombok.Builder;
import lombok.Value;

/**
 * Running text or a heading. The body may carry inline math delimited by
 * {@code $...$} or {@code $$...$$} and is treated as pre-escaped HTML.
 */
@Value
@Builder
public class TextBlock implements ContentBlock {
    public static final int MIN_HEADING_LEVEL = 1;
    public static final int MAX_HEADING_LEVEL = 4;

    @Builder.Default
    String text = "";

    /**
     * Heading level, or null for a plain paragraph
     */
    Integer level;

    public static TextBlock of(String text) {
        return TextBlock.builder().text(text).build();
    }

    public static TextBlock heading(String text, int level) {
        return TextBlock.builder().text(text).level(level).build();
    }

    public boolean isHeading() {
        return level != null && level >= MIN_HEADING_LEVEL && level <= MAX_HEADING_LEVEL;
    }

    @Override
    public BlockType getType() {
        return BlockType.TEXT;
    }
}
