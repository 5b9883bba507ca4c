package com.example.demo.docexport.model;

import java.util.Arrays;

/**
 * Kinds of content blocks produced by the upstream extraction pipeline.
 * The wire name is the {@code type} field of a content-list entry.
 */
public enum BlockType {
    TEXT("text"),
    EQUATION("equation"),
    LIST("list"),
    IMAGE("image"),
    TABLE("table"),
    CODE("code"),
    IGNORED(null);

    private final String wireName;

    BlockType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Resolve a wire name. Unknown or missing names map to {@link #IGNORED}.
     */
    public static BlockType fromWireName(String name) {
        if (name == null) {
            return IGNORED;
        }
        return Arrays.stream(values())
                .filter(t -> name.equals(t.wireName))
                .findFirst()
                .orElse(IGNORED);
    }
}
