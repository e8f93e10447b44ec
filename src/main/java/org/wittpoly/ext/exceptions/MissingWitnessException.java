package org.wittpoly.ext.exceptions;

public class MissingWitnessException extends RuntimeException {
    public MissingWitnessException(String name) {
        super("没有为变换 '" + name + "' 登记可表示性见证");
    }
}
