package com.carlae.lang;

import java.util.Collections;
import java.util.List;

public abstract class Expr {
  public interface Visitor<R> {
    R visitNumberExpr(Number expr);
    R visitSymbolExpr(Symbol expr);
    R visitCombinationExpr(Combination expr);
  }

  // integer (Long) or floating-point (Double) literal
  public static class Number extends Expr {
    Number(Token token, Object value) {
      this.token = token;
      this.value = value;
    }

    <R> R accept(Visitor<R> visitor) {
      return visitor.visitNumberExpr(this);
    }

    public final Token token;
    public final Object value;
  }

  public static class Symbol extends Expr {
    Symbol(Token token, String name) {
      this.token = token;
      this.name = name;
    }

    <R> R accept(Visitor<R> visitor) {
      return visitor.visitSymbolExpr(this);
    }

    boolean isKeyword(TokenType type) {
      return token != null && token.type == type;
    }

    public final Token token;
    public final String name;
  }

  public static class Combination extends Expr {
    Combination(Token lparen, List<Expr> elements) {
      this.lparen = lparen;
      this.elements = Collections.unmodifiableList(elements);
    }

    <R> R accept(Visitor<R> visitor) {
      return visitor.visitCombinationExpr(this);
    }

    public int size() {
      return elements.size();
    }

    public Expr get(int i) {
      return elements.get(i);
    }

    public final Token lparen;
    public final List<Expr> elements;
  }

  abstract <R> R accept(Visitor<R> visitor);
}
