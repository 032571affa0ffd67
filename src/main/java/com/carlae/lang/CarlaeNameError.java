package com.carlae.lang;

public class CarlaeNameError extends CarlaeError {
    final String name;

    CarlaeNameError(Token token, String name) {
        super(token == null ? -1 : token.line, "Undefined name '" + name + "'.");
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String kind() {
        return "NameError";
    }
}
