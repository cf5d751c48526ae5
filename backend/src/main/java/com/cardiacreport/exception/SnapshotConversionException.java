package com.cardiacreport.exception;

/**
 * A stored or submitted snapshot could not be converted between JSON and records.
 */
public class SnapshotConversionException extends RuntimeException {

    public SnapshotConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
