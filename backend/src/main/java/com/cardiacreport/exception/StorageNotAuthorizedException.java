package com.cardiacreport.exception;

/**
 * An anonymous caller asked to store a study while authentication is enabled.
 */
public class StorageNotAuthorizedException extends RuntimeException {

    public StorageNotAuthorizedException() {
        super("Authentication is required to store studies; compose without persist or log in");
    }
}
