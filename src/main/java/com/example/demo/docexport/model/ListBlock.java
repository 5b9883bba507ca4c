package com.example.demo.docexport.model;

import lombok.Singular;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * An ordered sequence of list items. Whether the list is numbered is derived
 * from the items, see {@link com.example.demo.docexport.util.ListClassifier}.
 */
@Value
@Builder
public class ListBlock implements ContentBlock {
    @Singular
    List<String> items;

    public static ListBlock of(List<String> items) {
        return ListBlock.builder().items(items).build();
    }

    @Override
    public BlockType getType() {
        return BlockType.LIST;
    }
}
