package com.example.demo.docexport.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ImageBlock implements ContentBlock {
    String path;

    @Singular
    List<String> captions;

    @Override
    public BlockType getType() {
        return BlockType.IMAGE;
    }
}
