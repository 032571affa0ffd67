package com.carlae.lang;

// malformed parenthesization or an empty program
public class CarlaeSyntaxError extends CarlaeError {
    CarlaeSyntaxError(int line, String message) {
        super(line, message);
    }

    @Override
    public String kind() {
        return "SyntaxError";
    }
}
