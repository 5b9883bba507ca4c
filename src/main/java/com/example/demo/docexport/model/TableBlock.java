package com.example.demo.docexport.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A table, either as an already rendered HTML {@code <table>} or, when that is
 * absent, as a path to a rasterized image of it.
 */
@Value
@Builder
public class TableBlock implements ContentBlock {
    String htmlBody;

    String path;

    @Singular
    List<String> captions;

    public boolean hasHtmlBody() {
        return htmlBody != null && !htmlBody.isBlank();
    }

    public boolean hasPath() {
        return path != null && !path.isBlank();
    }

    @Override
    public BlockType getType() {
        return BlockType.TABLE;
    }
}
