package org.wittpoly.ext.exceptions;

public class ExtensionalityException extends RuntimeException {
    public ExtensionalityException(String message) {
        super(message);
    }
}
