package com.carlae.lang;

import java.util.List;

// primitive operations installed in the root environment
public class Builtins {

    private Builtins() {}

    // a fresh root environment holding every builtin
    public static Environment globals() {
        Environment env = new Environment();
        install(env);
        return env;
    }

    public static void install(Environment globalEnv) {
        globalEnv.define("+", new CarlaeNativeCallable("+", 0, -1) {
            @Override
            protected Object _call(Interpreter interp, List<Object> args, Token tok) {
                Object total = 0L;
                for (int i = 0; i < args.size(); i++) {
                    total = add(total, checkNumber(tok, args.get(i), "+", i + 1), tok);
                }
                return total;
            }
        });
        globalEnv.define("-", new CarlaeNativeCallable("-", 1, -1) {
            @Override
            protected Object _call(Interpreter interp, List<Object> args, Token tok) {
                Object first = checkNumber(tok, args.get(0), "-", 1);
                if (args.size() == 1) {
                    return negate(first, tok);
                }
                Object result = first;
                for (int i = 1; i < args.size(); i++) {
                    result = subtract(result, checkNumber(tok, args.get(i), "-", i + 1), tok);
                }
                return result;
            }
        });
        globalEnv.define("*", new CarlaeNativeCallable("*", 0, -1) {
            @Override
            protected Object _call(Interpreter interp, List<Object> args, Token tok) {
                Object product = 1L;
                for (int i = 0; i < args.size(); i++) {
                    product = multiply(product, checkNumber(tok, args.get(i), "*", i + 1), tok);
                }
                return product;
            }
        });
        globalEnv.define("/", new CarlaeNativeCallable("/", 1, -1) {
            @Override
            protected Object _call(Interpreter interp, List<Object> args, Token tok) {
                Object result = checkNumber(tok, args.get(0), "/", 1);
                for (int i = 1; i < args.size(); i++) {
                    result = divide(result, checkNumber(tok, args.get(i), "/", i + 1), tok);
                }
                return result;
            }
        });
    }

    static boolean isNumber(Object obj) {
        return (obj instanceof Long) || (obj instanceof Double);
    }

    static boolean isInteger(Object obj) {
        return obj instanceof Long;
    }

    static Object checkNumber(Token tok, Object obj, String fnName, int argNo) {
        if (!isNumber(obj)) {
            throw new CarlaeEvaluationError(tok, "Expected argument " + argNo +
                " of <fn " + fnName + "> to be a number, got: " + Printer.stringify(obj));
        }
        return obj;
    }

    static Object add(Object left, Object right, Token tok) {
        if (isInteger(left) && isInteger(right)) {
            try {
                return Math.addExact((Long)left, (Long)right);
            } catch (ArithmeticException e) {
                throw overflow(tok);
            }
        }
        return toDouble(left) + toDouble(right);
    }

    static Object subtract(Object left, Object right, Token tok) {
        if (isInteger(left) && isInteger(right)) {
            try {
                return Math.subtractExact((Long)left, (Long)right);
            } catch (ArithmeticException e) {
                throw overflow(tok);
            }
        }
        return toDouble(left) - toDouble(right);
    }

    static Object multiply(Object left, Object right, Token tok) {
        if (isInteger(left) && isInteger(right)) {
            try {
                return Math.multiplyExact((Long)left, (Long)right);
            } catch (ArithmeticException e) {
                throw overflow(tok);
            }
        }
        return toDouble(left) * toDouble(right);
    }

    // integer division stays integer only while it divides exactly
    static Object divide(Object left, Object right, Token tok) {
        if (toDouble(right) == 0.0) {
            throw new CarlaeEvaluationError(tok, "division by 0");
        }
        if (isInteger(left) && isInteger(right)) {
            long l = (Long)left;
            long r = (Long)right;
            if (l == Long.MIN_VALUE && r == -1) {
                throw overflow(tok);
            }
            if (l % r == 0) {
                return l / r;
            }
        }
        return toDouble(left) / toDouble(right);
    }

    static Object negate(Object num, Token tok) {
        if (isInteger(num)) {
            try {
                return Math.negateExact((Long)num);
            } catch (ArithmeticException e) {
                throw overflow(tok);
            }
        }
        return -(Double)num;
    }

    static double toDouble(Object num) {
        return ((Number)num).doubleValue();
    }

    private static CarlaeEvaluationError overflow(Token tok) {
        return new CarlaeEvaluationError(tok, "integer overflow");
    }
}
