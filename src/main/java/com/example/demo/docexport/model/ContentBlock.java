package com.example.demo.docexport.model;

/**
 * One entry of a content list. Implementations are immutable; renderers
 * dispatch on {@link #getType()}.
 */
public interface ContentBlock {

    BlockType getType();
}
