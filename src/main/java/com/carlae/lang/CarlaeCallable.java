package com.carlae.lang;

import java.util.List;

public interface CarlaeCallable {
    public Object call(Interpreter interp, List<Object> args, Token callToken);
    public int arity(); // negative for variadic
    public String getName(); // ex: "square"
    public String toString(); // ex: "<fn square>"
}
