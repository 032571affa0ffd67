package com.carlae.lang;

import java.util.List;

// renders expression trees and values back to Carlae source form
public class Printer implements Expr.Visitor<String> {

    public static final String PARSE_ERROR = "!error!";

    public static String print(Expr expr) {
        return expr.accept(new Printer());
    }

    // parses src and prints the tree, or PARSE_ERROR when it doesn't parse
    public static String printSource(String src) {
        try {
            return print(Parser.newFromSource(src).parse());
        } catch (CarlaeSyntaxError e) {
            return PARSE_ERROR;
        }
    }

    public static String stringify(Object value) {
        if (value == null) {
            return "nil";
        }
        if (value instanceof List) {
            List<?> list = (List<?>)value;
            StringBuilder builder = new StringBuilder("(");
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) builder.append(" ");
                builder.append(stringify(list.get(i)));
            }
            return builder.append(")").toString();
        }
        return value.toString();
    }

    @Override
    public String visitNumberExpr(Expr.Number expr) {
        return expr.value.toString();
    }

    @Override
    public String visitSymbolExpr(Expr.Symbol expr) {
        return expr.name;
    }

    @Override
    public String visitCombinationExpr(Expr.Combination expr) {
        StringBuilder builder = new StringBuilder("(");
        for (int i = 0; i < expr.size(); i++) {
            if (i > 0) builder.append(" ");
            builder.append(expr.get(i).accept(this));
        }
        return builder.append(")").toString();
    }
}
