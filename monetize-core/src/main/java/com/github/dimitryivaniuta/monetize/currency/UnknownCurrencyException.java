package com.github.dimitryivaniuta.monetize.currency;

import com.github.dimitryivaniuta.monetize.MonetizeException;

/** The registry has no entry for the requested currency identifier. */
public class UnknownCurrencyException extends MonetizeException {
    private final String code;

    public UnknownCurrencyException(String code) {
        super("Unknown currency '" + code + "'");
        this.code = code;
    }

    public String getCode() { return code; }
}
