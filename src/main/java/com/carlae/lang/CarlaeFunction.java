package com.carlae.lang;

import java.util.Collections;
import java.util.List;

// user-defined function: parameter names, body, and the environment it was
// created in
public class CarlaeFunction implements CarlaeCallable {
    final String name; // null when anonymous
    final List<String> params;
    final Expr body;
    final Environment closure;

    CarlaeFunction(String name, List<String> params, Expr body, Environment closure) {
        this.name = name;
        this.params = Collections.unmodifiableList(params);
        this.body = body;
        this.closure = closure;
    }

    @Override
    public Object call(Interpreter interpreter, List<Object> args, Token callToken) {
        if (args.size() != arity()) {
            throw new CarlaeEvaluationError(callToken,
                "Function " + this + " called with wrong number of arguments. Expected exactly " +
                arity() + ", got " + args.size() + ".");
        }
        // parent is the defining environment, not the caller's
        Environment environment = new Environment(closure);
        for (int i = 0; i < params.size(); i++) {
            environment.define(params.get(i), args.get(i));
        }

        interpreter.stack.push(new StackFrame(this, callToken));
        Object ret = interpreter.evaluate(body, environment);
        interpreter.stack.pop(); // left in place on error so the stack can be reported
        return ret;
    }

    @Override
    public int arity() {
        return params.size();
    }

    @Override
    public String getName() {
        if (name == null) {
            return "(anon)";
        }
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    public Expr getBody() {
        return body;
    }

    public Environment getClosure() {
        return closure;
    }

    @Override
    public String toString() {
        return "<fn " + getName() + ">";
    }
}
