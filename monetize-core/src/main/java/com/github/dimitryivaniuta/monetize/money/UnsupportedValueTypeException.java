package com.github.dimitryivaniuta.monetize.money;

import com.github.dimitryivaniuta.monetize.MonetizeException;

/** A numeric entry point was handed something that is not a finite number. */
public class UnsupportedValueTypeException extends MonetizeException {
    public UnsupportedValueTypeException(Object value) {
        super(describe(value));
    }

    public UnsupportedValueTypeException(Object value, Throwable cause) {
        super(describe(value), cause);
    }

    private static String describe(Object value) {
        return "'value' should be a finite Number, got "
                + (value == null ? "null" : value.getClass().getName() + " " + value);
    }
}
