package com.example.demo.docexport.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CodeBlock implements ContentBlock {
    @Builder.Default
    String body = "";

    /**
     * Guessed source language, may be null
     */
    String language;

    @Singular
    List<String> captions;

    @Override
    public BlockType getType() {
        return BlockType.CODE;
    }
}
