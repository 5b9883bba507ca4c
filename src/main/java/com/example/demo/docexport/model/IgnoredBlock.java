package com.example.demo.docexport.model;

import lombok.Value;

/**
 * Placeholder for entries of a type no renderer understands (page headers,
 * footers, future block kinds). Kept so list positions stay stable.
 */
@Value
public class IgnoredBlock implements ContentBlock {
    String sourceType;

    @Override
    public BlockType getType() {
        return BlockType.IGNORED;
    }
}
