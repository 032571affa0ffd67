package com.carlae.lang;

public class Token {
  final TokenType type;
  final String lexeme;
  final int line;

  Token(TokenType type, String lexeme, int line) {
    this.type = type;
    this.lexeme = lexeme;
    this.line = line;
  }

  public TokenType getType() {
    return type;
  }

  public String getLexeme() {
    return lexeme;
  }

  public int getLine() {
    return line;
  }

  public boolean isParen() {
    return type == TokenType.LEFT_PAREN || type == TokenType.RIGHT_PAREN;
  }

  public String toString() {
    return type + " " + lexeme;
  }

}
