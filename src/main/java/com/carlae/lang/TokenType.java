package com.carlae.lang;

public enum TokenType {
    LEFT_PAREN, RIGHT_PAREN,

    // keywords
    ASSIGN, FUNCTION,

    // numbers and symbol names, classified by the parser
    ATOM
}
