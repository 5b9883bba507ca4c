package com.example.demo.docexport.model;

import java.util.Optional;

/**
 * Resolves an image path from the content list to its bytes. Implementations
 * must be safe for concurrent use when renders run in parallel.
 */
@FunctionalInterface
public interface ImageLoader {

    /**
     * @param path image path as it appears in the content list
     * @return the asset, or empty when the path cannot be resolved
     */
    Optional<RenderAsset> load(String path);

    static ImageLoader none() {
        return path -> Optional.empty();
    }
}
