package org.wittpoly.ext.exceptions;

public class RepresentabilityViolationException extends RuntimeException {
    public RepresentabilityViolationException(String name, String detail) {
        super("变换 '" + name + "' 与它的见证不一致: " + detail);
    }
}
