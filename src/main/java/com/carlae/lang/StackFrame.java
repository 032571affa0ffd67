package com.carlae.lang;

class StackFrame {
    final CarlaeCallable callable;
    final Token token;

    StackFrame(CarlaeCallable callable, Token tok) {
        this.callable = callable;
        this.token = tok;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(callable.toString());
        if (token != null) {
            builder.append(" at line " + token.line + ".");
        }
        return builder.toString();
    }
}
