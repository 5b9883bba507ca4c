package com.example.demo.docexport.model;

import lombok.Value;

import java.util.List;

/**
 * LaTeX source plus the image paths it references, in order of first use.
 * The caller bundles those files next to the {@code .tex} file.
 */
@Value
public class LatexExport {
    String source;
    List<String> referencedImages;
}
