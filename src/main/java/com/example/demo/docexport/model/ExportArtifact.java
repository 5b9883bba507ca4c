package com.example.demo.docexport.model;

import lombok.Value;

/**
 * A rendered output ready to be stored or streamed.
 */
@Value
public class ExportArtifact {
    ExportFormat format;
    String fileName;
    String mimeType;
    byte[] data;
}
