package com.carlae.lang;

import java.util.ArrayList;
import java.util.List;

import static com.carlae.lang.TokenType.*;

/*
 * Grammar:
 *
 * program     : expr ;
 * expr        : atom
 *             | "(" expr* ")" ;
 * atom        : INTEGER | FLOAT | SYMBOL | ":=" | "function" ;
 *
 * A program is exactly one expression. Parsing works on token slices: the
 * interior of a combination is split into top-level groups by paren depth
 * and every group is parsed on its own.
 */

public class Parser {
    private final List<Token> tokens;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Parser newFromSource(String source) {
        Scanner scanner = new Scanner(source);
        return new Parser(scanner.scanTokens());
    }

    public Expr parse() {
        if (tokens.isEmpty()) {
            throw new CarlaeSyntaxError(1, "empty program");
        }
        return parse(tokens);
    }

    private Expr parse(List<Token> toks) {
        Token first = toks.get(0);
        if (toks.size() == 1) {
            if (first.isParen()) {
                throw error(first, "unbalanced '" + first.lexeme + "'");
            }
            return atom(first);
        }

        Token last = toks.get(toks.size() - 1);
        if (first.type != LEFT_PAREN) {
            throw error(first, "expected '(' at start of expression");
        }
        if (last.type != RIGHT_PAREN) {
            throw error(last, "expected ')' at end of expression");
        }

        List<Expr> elements = new ArrayList<>();
        for (List<Token> group : groupTokens(toks.subList(1, toks.size() - 1), first)) {
            elements.add(parse(group));
        }
        return new Expr.Combination(first, elements);
    }

    // splits the inside of a combination into its top-level sub-expressions
    private List<List<Token>> groupTokens(List<Token> toks, Token lparen) {
        List<List<Token>> groups = new ArrayList<>();
        int depth = 0;
        int groupStart = -1;

        for (int i = 0; i < toks.size(); i++) {
            Token tok = toks.get(i);
            if (tok.type == LEFT_PAREN) {
                if (depth == 0) {
                    groupStart = i;
                }
                depth++;
                continue;
            }
            if (tok.type == RIGHT_PAREN) {
                depth--;
                if (depth < 0) {
                    throw error(tok, "unexpected ')'");
                }
                if (depth == 0) {
                    groups.add(toks.subList(groupStart, i + 1));
                    groupStart = -1;
                }
                continue;
            }
            if (depth == 0) {
                groups.add(toks.subList(i, i + 1));
            }
        }

        if (depth > 0) {
            throw error(lparen, "unclosed '('");
        }
        return groups;
    }

    static Expr atom(Token tok) {
        Object number = numberOrNull(tok.lexeme);
        if (number != null) {
            return new Expr.Number(tok, number);
        }
        return new Expr.Symbol(tok, tok.lexeme);
    }

    // Long first, then Double, null for symbol names
    static Object numberOrNull(String text) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            // not an integer, try a float
        }
        if (!looksNumeric(text)) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    // Double.parseDouble also accepts "NaN", "Infinity", "1f" and hex
    // literals, which are symbol names here
    private static boolean looksNumeric(String text) {
        boolean seenDigit = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (CarlaeUtil.isDigit(c)) {
                seenDigit = true;
            } else if (c != '.' && c != '-' && c != '+' && c != 'e' && c != 'E') {
                return false;
            }
        }
        return seenDigit;
    }

    private CarlaeSyntaxError error(Token token, String msg) {
        return new CarlaeSyntaxError(token.line, msg);
    }
}
