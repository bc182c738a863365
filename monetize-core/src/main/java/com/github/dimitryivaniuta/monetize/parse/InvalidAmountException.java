package com.github.dimitryivaniuta.monetize.parse;

import com.github.dimitryivaniuta.monetize.MonetizeException;

/** Input text does not have the shape of a monetary amount. */
public class InvalidAmountException extends MonetizeException {
    private final String input;

    public InvalidAmountException(String message, String input) {
        super(message + ": '" + input + "'");
        this.input = input;
    }

    public InvalidAmountException(String message, String input, Throwable cause) {
        super(message + ": '" + input + "'", cause);
        this.input = input;
    }

    public String getInput() { return input; }
}
