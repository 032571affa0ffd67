package com.carlae.lang;

// base of every failure a Carlae program can raise; never thrown directly
public abstract class CarlaeError extends RuntimeException {
    final int line;

    CarlaeError(int line, String message) {
        super(message);
        this.line = line;
    }

    CarlaeError(String message) {
        this(-1, message);
    }

    // 1-based source line, or -1 when no token is involved
    public int getLine() {
        return line;
    }

    // "SyntaxError", "NameError", ...
    public abstract String kind();
}
