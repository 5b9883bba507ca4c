package com.example.demo.docexport.model;

import lombok.Value;

/**
 * Raw image bytes handed out by an {@link ImageLoader}. Owned by the caller
 * that requested it; renderers never keep a reference past embedding.
 */
@Value
public class RenderAsset {
    String name;
    byte[] data;
    String mime;
}
