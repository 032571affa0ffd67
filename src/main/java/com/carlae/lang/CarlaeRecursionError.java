package com.carlae.lang;

// the host call stack ran out while parsing or evaluating
public class CarlaeRecursionError extends CarlaeEvaluationError {
    final int depth;

    CarlaeRecursionError(int depth) {
        super("maximum recursion depth exceeded (" + depth + " active calls)");
        this.depth = depth;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public String kind() {
        return "RecursionError";
    }
}
