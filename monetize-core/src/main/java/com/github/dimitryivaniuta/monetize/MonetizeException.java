package com.github.dimitryivaniuta.monetize;

/** Base type for every failure raised while turning input into currency subunits. */
public class MonetizeException extends RuntimeException {
    public MonetizeException(String message) { super(message); }
    public MonetizeException(String message, Throwable cause) { super(message, cause); }
}
