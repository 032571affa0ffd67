package com.carlae.lang;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.carlae.lang.TokenType.*;

public class Scanner {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final StringBuilder current = new StringBuilder();

    private int line = 1;
    private int tokenLine = 1;
    private boolean inComment = false;

    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put(":=",       ASSIGN);
        keywords.put("function", FUNCTION);
    }

    public Scanner(String source) {
        this.source = source;
    }

    // convenience for callers that only care about the lexemes
    public static List<String> tokenize(String source) {
        List<String> lexemes = new ArrayList<>();
        for (Token tok : new Scanner(source).scanTokens()) {
            lexemes.add(tok.lexeme);
        }
        return lexemes;
    }

    public List<Token> scanTokens() {
        tokens.clear();
        current.setLength(0);
        line = 1;
        inComment = false;
        for (int i = 0; i < source.length(); i++) {
            scanChar(source.charAt(i));
        }
        flush();
        return tokens;
    }

    private void scanChar(char c) {
        if (isDelimiter(c)) {
            flush();
        }

        if (isWhitespace(c)) {
            if (c == '\n') {
                line++;
                inComment = false;
            }
            return;
        }

        if (inComment) return;

        switch (c) {
            case '(': addToken(LEFT_PAREN, "("); return;
            case ')': addToken(RIGHT_PAREN, ")"); return;
            case '#': inComment = true; return;
        }

        if (current.length() == 0) {
            tokenLine = line;
        }
        current.append(c);

        // keywords don't need a delimiter after them
        String text = current.toString();
        TokenType ttype = keywords.get(text);
        if (ttype != null) {
            addToken(ttype, text);
            current.setLength(0);
        }
    }

    private void flush() {
        if (current.length() > 0) {
            tokens.add(new Token(ATOM, current.toString(), tokenLine));
            current.setLength(0);
        }
    }

    private void addToken(TokenType ttype, String text) {
        tokens.add(new Token(ttype, text, line));
    }

    private static boolean isDelimiter(char c) {
        return c == '(' || c == ')' || isWhitespace(c);
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\n';
    }

}
