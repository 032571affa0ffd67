package com.carlae.lang;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Stack;

import static com.carlae.lang.TokenType.*;

public class Interpreter implements Expr.Visitor<Object> {
    private static final int MAX_STACKTRACE_FRAMES = 20;

    // value of a run plus the environment it ran in, so callers can keep
    // their bindings for the next run
    public static class Result {
        public final Object value;
        public final Environment environment;

        Result(Object value, Environment environment) {
            this.value = value;
            this.environment = environment;
        }
    }

    final Stack<StackFrame> stack = new Stack<>();
    private Environment environment = null;

    // runs in a fresh environment chained under a fresh builtins root
    public Result run(String src) {
        Environment env = new Environment(Builtins.globals());
        Object value = run(src, env);
        return new Result(value, env);
    }

    public Object run(String src, Environment env) {
        stack.clear();
        try {
            Parser parser = Parser.newFromSource(src);
            Expr expr = parser.parse();
            if (CarlaeUtil.isDebugging("ast")) {
                CarlaeUtil.debug("ast", Printer.print(expr));
            }
            return evaluate(expr, env);
        } catch (StackOverflowError e) {
            int depth = stack.size();
            stack.clear();
            throw new CarlaeRecursionError(depth);
        }
    }

    public Object runFile(Path path, Environment env) throws IOException {
        return run(CarlaeUtil.readFile(path), env);
    }

    public Object evaluate(Expr expr, Environment env) {
        Environment previous = this.environment;
        try {
            this.environment = env;
            return expr.accept(this);
        } finally {
            this.environment = previous;
        }
    }

    private Object evaluate(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public Object visitNumberExpr(Expr.Number expr) {
        return expr.value;
    }

    @Override
    public Object visitSymbolExpr(Expr.Symbol expr) {
        return environment.get(expr.name, expr.token);
    }

    @Override
    public Object visitCombinationExpr(Expr.Combination expr) {
        if (expr.size() == 0) {
            return CarlaeUtil.EMPTY_LIST;
        }

        Expr head = expr.get(0);
        if (head instanceof Expr.Symbol) {
            Expr.Symbol keyword = (Expr.Symbol)head;
            if (keyword.isKeyword(ASSIGN)) {
                return evaluateAssign(expr);
            }
            if (keyword.isKeyword(FUNCTION)) {
                return evaluateFunction(expr);
            }
        }

        List<Object> values = new ArrayList<>(expr.size());
        for (Expr element : expr.elements) {
            values.add(evaluate(element));
        }
        if (values.size() == 1) {
            return values.get(0);
        }

        Object obj = values.get(0);
        if (!(obj instanceof CarlaeCallable)) {
            throw new CarlaeEvaluationError(expr.lparen,
                "Attempt to call a non-function: " + Printer.stringify(obj));
        }
        CarlaeCallable callable = (CarlaeCallable)obj;
        return callable.call(this, values.subList(1, values.size()), expr.lparen);
    }

    // (:= name expr) or (:= (name params...) body)
    private Object evaluateAssign(Expr.Combination expr) {
        if (expr.size() != 3) {
            throw new CarlaeEvaluationError(expr.lparen,
                "':=' expects a name and a value, got " + (expr.size() - 1) + " arguments");
        }
        Expr target = expr.get(1);
        if (target instanceof Expr.Combination) {
            Expr.Combination signature = (Expr.Combination)target;
            if (signature.size() == 0) {
                throw new CarlaeEvaluationError(signature.lparen,
                    "function definition needs a name");
            }
            String name = symbolName(signature.get(0), "function name");
            List<String> params = paramNames(signature.elements.subList(1, signature.size()));
            CarlaeFunction function = new CarlaeFunction(name, params, expr.get(2), environment);
            environment.define(name, function);
            return function;
        }

        String name = symbolName(target, "assignment target");
        Object value = evaluate(expr.get(2));
        environment.define(name, value);
        return value;
    }

    // (function (params...) body)
    private Object evaluateFunction(Expr.Combination expr) {
        if (expr.size() != 3) {
            throw new CarlaeEvaluationError(expr.lparen,
                "'function' expects a parameter list and a body, got " +
                (expr.size() - 1) + " arguments");
        }
        if (!(expr.get(1) instanceof Expr.Combination)) {
            throw new CarlaeEvaluationError(expr.lparen,
                "'function' parameters must be a parenthesized list");
        }
        List<String> params = paramNames(((Expr.Combination)expr.get(1)).elements);
        return new CarlaeFunction(null, params, expr.get(2), environment);
    }

    private List<String> paramNames(List<Expr> exprs) {
        List<String> names = new ArrayList<>(exprs.size());
        for (Expr param : exprs) {
            names.add(symbolName(param, "parameter"));
        }
        return names;
    }

    private String symbolName(Expr expr, String what) {
        if (expr instanceof Expr.Symbol) {
            return ((Expr.Symbol)expr).name;
        }
        Token tok = null;
        if (expr instanceof Expr.Number) {
            tok = ((Expr.Number)expr).token;
        } else if (expr instanceof Expr.Combination) {
            tok = ((Expr.Combination)expr).lparen;
        }
        throw new CarlaeEvaluationError(tok, what + " must be a symbol, got: " + Printer.print(expr));
    }

    // innermost call first
    public String stacktrace() {
        StringBuilder builder = new StringBuilder();
        int shown = 0;
        for (int i = stack.size() - 1; i >= 0; i--) {
            if (shown == MAX_STACKTRACE_FRAMES) {
                builder.append("  ... " + (i + 1) + " more\n");
                break;
            }
            builder.append("  " + stack.get(i).toString() + "\n");
            shown++;
        }
        return builder.toString();
    }

    public int stackDepth() {
        return stack.size();
    }

}
