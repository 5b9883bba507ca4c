package com.example.demo.docexport.exception;

/**
 * Fatal failure of an output writer (document container, zip package).
 * Formatting problems never raise this; they degrade per block.
 */
public class ExportException extends RuntimeException {

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
