package io.github.eutro.ir2coli.test;

import io.github.eutro.ir2coli.core.ir.Expr;
import io.github.eutro.ir2coli.core.ir.Type;
import org.junit.jupiter.api.Test;

import static io.github.eutro.ir2coli.core.ir.Exprs.*;
import static io.github.eutro.ir2coli.core.passes.Simplify.simplify;
import static org.junit.jupiter.api.Assertions.*;

public class SimplifyTest {
    private static final Expr X = var("x");

    @Test
    void testFoldsIntegers() {
        assertEquals("5", simplify(new Expr.Add(intConst(2), intConst(3))).toString());
        assertEquals("11", simplify(new Expr.Sub(new Expr.Mul(intConst(4), intConst(3)), intConst(1))).toString());
    }

    @Test
    void testWrapsToWidth() {
        Type i8 = Type.int_(8);
        Expr sum = simplify(new Expr.Add(makeConst(i8, 127), makeConst(i8, 1)));
        assertEquals(-128, asIntegral(sum));
        assertEquals(i8, sum.type);

        Type u8 = Type.uint(8);
        assertEquals(255, asIntegral(simplify(new Expr.Sub(makeConst(u8, 0), makeConst(u8, 1)))));
    }

    @Test
    void testDivisionRoundsDown() {
        assertEquals(-4, asIntegral(simplify(new Expr.Div(intConst(-7), intConst(2)))));
        assertEquals(1, asIntegral(simplify(new Expr.Mod(intConst(-7), intConst(2)))));
        assertEquals(1, asIntegral(simplify(new Expr.Mod(intConst(-7), intConst(-2)))));
    }

    @Test
    void testUnsignedDivision() {
        Type u64 = Type.uint(64);
        // 2^64 - 2 and 2^64 - 1
        Expr big = makeConst(u64, -2), max = makeConst(u64, -1);
        assertEquals(Long.MAX_VALUE, asIntegral(simplify(new Expr.Div(big, makeConst(u64, 2)))));
        assertEquals(5L, asIntegral(simplify(new Expr.Mod(max, makeConst(u64, 10)))));
        assertEquals(1L, asIntegral(simplify(new Expr.Div(max, big))));
        assertEquals(0L, asIntegral(simplify(new Expr.Div(makeConst(u64, 7), big))));

        Type u32 = Type.uint(32);
        assertEquals(2147483647L, asIntegral(simplify(new Expr.Div(makeConst(u32, 4294967295L), makeConst(u32, 2)))));
    }

    @Test
    void testDivisionByZeroKept() {
        Expr div = new Expr.Div(intConst(7), intConst(0));
        assertSame(div, simplify(div));
    }

    @Test
    void testIdentities() {
        assertSame(X, simplify(new Expr.Add(X, intConst(0))));
        assertSame(X, simplify(new Expr.Add(intConst(0), X)));
        assertSame(X, simplify(new Expr.Mul(X, intConst(1))));
        assertTrue(isZero(simplify(new Expr.Mul(X, intConst(0)))));
        assertTrue(isZero(simplify(new Expr.Sub(X, var("x")))));
        assertSame(X, simplify(new Expr.Div(X, intConst(1))));
    }

    @Test
    void testUnchangedIsSame() {
        Expr e = new Expr.Add(X, var("y"));
        assertSame(e, simplify(e));
    }

    @Test
    void testNestedConstantsFoldAroundVariables() {
        // (x + (1 + 2)) only folds the constant subterm
        Expr e = simplify(new Expr.Add(X, new Expr.Add(intConst(1), intConst(2))));
        assertEquals("(x + 3)", e.toString());
    }

    @Test
    void testComparisons() {
        assertTrue(isOne(simplify(new Expr.LT(intConst(1), intConst(2)))));
        assertTrue(isZero(simplify(new Expr.GE(intConst(1), intConst(2)))));
        assertTrue(isOne(simplify(new Expr.EQ(intConst(3), intConst(3)))));
        assertEquals(Type.bool(), simplify(new Expr.NE(intConst(3), intConst(3))).type);
        assertEquals(3, asIntegral(simplify(new Expr.Min(intConst(3), intConst(5)))));
        assertEquals(5, asIntegral(simplify(new Expr.Max(intConst(3), intConst(5)))));
    }

    @Test
    void testUnsignedComparison() {
        Type u32 = Type.uint(32);
        // 0xFFFFFFFF is the largest uint32, not -1
        Expr big = simplify(new Expr.Sub(makeConst(u32, 0), makeConst(u32, 1)));
        assertTrue(isOne(simplify(new Expr.GT(big, makeConst(u32, 1)))));
    }

    @Test
    void testBooleans() {
        Expr c = new Expr.LT(X, intConst(1));
        assertSame(c, simplify(new Expr.And(boolConst(true), c)));
        assertTrue(isZero(simplify(new Expr.And(c, boolConst(false)))));
        assertTrue(isOne(simplify(new Expr.Or(c, boolConst(true)))));
        assertSame(c, simplify(new Expr.Not(new Expr.Not(c))));
        assertTrue(isZero(simplify(new Expr.Not(boolConst(true)))));
    }

    @Test
    void testSelect() {
        Expr y = var("y");
        assertSame(X, simplify(new Expr.Select(boolConst(true), X, y)));
        assertSame(y, simplify(new Expr.Select(new Expr.LT(intConst(2), intConst(1)), X, y)));
    }

    @Test
    void testFloats() {
        Type f32 = Type.float_(32);
        Expr sum = simplify(new Expr.Add(new Expr.FloatImm(f32, 1.5), new Expr.FloatImm(f32, 2)));
        assertEquals("3.5f", sum.toString());
        Expr casted = simplify(new Expr.Cast(Type.float_(64), intConst(2)));
        assertEquals("2.0", casted.toString());
    }

    @Test
    void testLetOfConstantSubstituted() {
        Expr let = new Expr.Let("y", intConst(2), new Expr.Add(var("y"), X));
        assertEquals("(2 + x)", simplify(let).toString());

        Expr kept = new Expr.Let("y", new Expr.Add(X, intConst(1)), var("y"));
        assertSame(kept, simplify(kept));
    }
}
