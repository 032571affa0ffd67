package com.carlae.test;

import java.util.ArrayList;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import com.carlae.lang.CarlaeSyntaxError;
import com.carlae.lang.Expr;
import com.carlae.lang.Parser;
import com.carlae.lang.Printer;
import com.carlae.lang.Token;

public class ParserTest {

    private Expr parse(String code) {
        return Parser.newFromSource(code).parse();
    }

    @Test
    public void testSimpleCombination() {
        Expr expr = parse("(+ 2 3)");
        assertTrue(expr instanceof Expr.Combination);
        Expr.Combination combo = (Expr.Combination)expr;
        assertEquals(3, combo.size());
        assertEquals("+", ((Expr.Symbol)combo.get(0)).name);
        assertEquals(2L, ((Expr.Number)combo.get(1)).value);
        assertEquals(3L, ((Expr.Number)combo.get(2)).value);
    }

    @Test
    public void testNumberOrSymbol() {
        assertEquals(8L, ((Expr.Number)parse("8")).value);
        assertEquals(-5.32, ((Expr.Number)parse("-5.32")).value);
        assertEquals(1000.0, ((Expr.Number)parse("1e3")).value);
        assertEquals("1.2.3.4", ((Expr.Symbol)parse("1.2.3.4")).name);
        assertEquals("x", ((Expr.Symbol)parse("x")).name);
        assertEquals("-", ((Expr.Symbol)parse("-")).name);
    }

    @Test
    public void testJavaOnlyFloatSpellingsAreSymbols() {
        assertTrue(parse("NaN") instanceof Expr.Symbol);
        assertTrue(parse("Infinity") instanceof Expr.Symbol);
        assertTrue(parse("2f") instanceof Expr.Symbol);
    }

    @Test
    public void testHugeIntegerFallsBackToFloat() {
        assertEquals(1e20, ((Expr.Number)parse("100000000000000000000")).value);
    }

    @Test
    public void testNestedGroups() {
        assertEquals("(:= (square y) (* y y))", Printer.print(parse("(:= (square y) (* y y))")));
        assertEquals("(((a)) b (c (d)))", Printer.print(parse("(((a)) b (c (d)))")));
    }

    @Test
    public void testEmptyCombination() {
        Expr expr = parse("()");
        assertEquals(0, ((Expr.Combination)expr).size());
    }

    @Test
    public void testKeywordsParseAsSymbols() {
        Expr.Combination combo = (Expr.Combination)parse("(function (a b) (+ a b))");
        assertEquals("function", ((Expr.Symbol)combo.get(0)).name);
        assertEquals(2, ((Expr.Combination)combo.get(1)).size());
    }

    @Test
    public void testUnbalancedParens() {
        assertSyntaxError(")(spam)(");
        assertSyntaxError("(");
        assertSyntaxError(")");
        assertSyntaxError("(+ 1 2");
        assertSyntaxError("+ 1 2)");
        assertSyntaxError("(+ 1 2))");
        assertSyntaxError("((+ 1 2)");
        assertSyntaxError("(a) (b)");
        assertSyntaxError("x y");
    }

    @Test
    public void testEmptyProgram() {
        assertSyntaxError("");
        assertSyntaxError("# only a comment\n");
        assertSyntaxError("\n\n");
    }

    @Test(expected = CarlaeSyntaxError.class)
    public void testEmptyTokenList() {
        new Parser(new ArrayList<Token>()).parse();
    }

    @Test
    public void testSyntaxErrorLine() {
        try {
            parse("(+ 1\n 2))");
            fail("expected a syntax error");
        } catch (CarlaeSyntaxError e) {
            assertEquals("SyntaxError", e.kind());
            assertEquals(2, e.getLine());
        }
    }

    @Test
    public void testPrintSource() {
        assertEquals("(+ 1 (* 2 3.5))", Printer.printSource("(+ 1\n  (* 2 3.5)) # sum"));
        assertEquals(Printer.PARSE_ERROR, Printer.printSource("(+ 1"));
    }

    private void assertSyntaxError(String code) {
        try {
            parse(code);
            fail("expected a syntax error for: " + code);
        } catch (CarlaeSyntaxError e) {
            // expected
        }
    }
}
