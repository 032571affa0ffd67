package com.carlae.lang;

import java.util.List;

// primitive implemented in Java; subclasses override _call
class CarlaeNativeCallable implements CarlaeCallable {
    final String name;
    final int arityMin;
    final int arityMax;

    CarlaeNativeCallable(String name, int arityMin, int arityMax) {
        this.name = name;
        this.arityMin = arityMin;
        this.arityMax = arityMax;
    }

    @Override
    public Object call(Interpreter interp, List<Object> args, Token tok) {
        if (!acceptsNArgs(args.size())) {
            String expected = arity() < 0 ? arityMin + " to n" : String.valueOf(arity());
            throw new CarlaeEvaluationError(tok,
                "Function " + this + " called with wrong number of arguments. Expected " +
                expected + ", got " + args.size() + ".");
        }
        return _call(interp, args, tok);
    }

    // to override in subclass
    protected Object _call(Interpreter interp, List<Object> args, Token tok) {
        throw new CarlaeEvaluationError(tok, name + " unimplemented!");
    }

    boolean acceptsNArgs(int nArgs) {
        int max = arityMax < 0 ? Integer.MAX_VALUE : arityMax;
        return nArgs >= arityMin && nArgs <= max;
    }

    @Override
    public int arity() {
        return arityMin == arityMax ? arityMin : -1;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "<fn " + getName() + ">";
    }
}
