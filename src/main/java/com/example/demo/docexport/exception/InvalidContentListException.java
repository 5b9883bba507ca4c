package com.example.demo.docexport.exception;

/**
 * The content-list JSON is unreadable or not an array of entries.
 */
public class InvalidContentListException extends RuntimeException {

    public InvalidContentListException(String message) {
        super(message);
    }

    public InvalidContentListException(String message, Throwable cause) {
        super(message, cause);
    }
}
