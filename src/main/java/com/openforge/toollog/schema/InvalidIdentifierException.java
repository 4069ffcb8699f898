package com.openforge.toollog.schema;

/** A table or tool identifier cannot be used as a SQL identifier. */
public class InvalidIdentifierException extends RuntimeException {

    public InvalidIdentifierException(String message) {
        super(message);
    }
}
