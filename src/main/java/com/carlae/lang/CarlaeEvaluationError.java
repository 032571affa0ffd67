package com.carlae.lang;

// any evaluation failure that isn't a name lookup: calling a non-function,
// arity mismatch, malformed special form, bad arithmetic operand
public class CarlaeEvaluationError extends CarlaeError {
    CarlaeEvaluationError(Token token, String message) {
        super(token == null ? -1 : token.line, message);
    }

    CarlaeEvaluationError(String message) {
        super(message);
    }

    @Override
    public String kind() {
        return "EvaluationError";
    }
}
