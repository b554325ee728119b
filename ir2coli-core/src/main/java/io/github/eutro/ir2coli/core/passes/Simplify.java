package io.github.eutro.ir2coli.core.passes;

import io.github.eutro.ir2coli.core.ir.Expr;
import io.github.eutro.ir2coli.core.ir.Exprs;
import io.github.eutro.ir2coli.core.ir.Type;
import org.jetbrains.annotations.Nullable;

import java.util.function.LongBinaryOperator;

/**
 * A pass which folds constants and removes trivial arithmetic.
 * <p>
 * Integer arithmetic wraps to the width of its type. Division and modulus
 * of signed integers round towards negative infinity, and the modulus is never negative,
 * matching the semantics of the IR. Unsigned operands are divided as unsigned values
 * of their full width. Division by a constant zero is left alone.
 */
public class Simplify extends IRMutator {
    /**
     * An instance of this pass.
     */
    public static final Simplify INSTANCE = new Simplify();

    /**
     * Simplify an expression.
     *
     * @param e The expression.
     * @return The simplified expression.
     */
    public static Expr simplify(Expr e) {
        return INSTANCE.mutate(e);
    }

    private static long wrap(Type type, long value) {
        if (type.bits >= 64) return value;
        int shift = 64 - type.bits;
        if (type.isInt()) {
            return (value << shift) >> shift;
        }
        return value & (-1L >>> shift);
    }

    private static @Nullable Expr foldInt(Expr.BinOp op, Expr a, Expr b, LongBinaryOperator f) {
        Long x = Exprs.asIntegral(a), y = Exprs.asIntegral(b);
        if (x == null || y == null || a.type.isBool()) return null;
        return Exprs.makeConst(op.type, wrap(op.type, f.applyAsLong(x, y)));
    }

    private static @Nullable Double asFloat(Expr e) {
        return e instanceof Expr.FloatImm ? ((Expr.FloatImm) e).value : null;
    }

    private static Expr floatConst(Type type, double value) {
        return new Expr.FloatImm(type, type.bits == 32 ? (float) value : value);
    }

    private static @Nullable Expr compare(Expr a, Expr b, int sign0, int sign1) {
        // true iff signum(a - b) is sign0 or sign1
        int cmp;
        Long x = Exprs.asIntegral(a), y = Exprs.asIntegral(b);
        Double fx = asFloat(a), fy = asFloat(b);
        if (x != null && y != null) {
            cmp = a.type.code == Type.Code.UINT ? Long.compareUnsigned(x, y) : Long.compare(x, y);
        } else if (fx != null && fy != null) {
            cmp = Double.compare(fx, fy);
        } else {
            return null;
        }
        int signum = Integer.signum(cmp);
        return Exprs.boolConst(signum == sign0 || signum == sign1);
    }

    private static boolean isUnsigned(Expr.BinOp op) {
        return op.type.code == Type.Code.UINT;
    }

    private static long floorDiv(long a, long b) {
        return Math.floorDiv(a, b);
    }

    private static long euclidMod(long a, long b) {
        long r = a % b;
        return r < 0 ? r + Math.abs(b) : r;
    }

    @Override
    public Expr visit(Expr.Cast op) {
        Expr value = mutate(op.value);
        Long x = Exprs.asIntegral(value);
        if (x != null && !op.type.isHandle()) {
            if (op.type.isFloat()) return floatConst(op.type, x);
            return Exprs.makeConst(op.type, op.type.isBool() ? x : wrap(op.type, x));
        }
        Double fx = asFloat(value);
        if (fx != null && op.type.isFloat()) return floatConst(op.type, fx);
        if (value.type.equals(op.type)) return value;
        return value == op.value ? op : new Expr.Cast(op.type, value);
    }

    @Override
    public Expr visit(Expr.Add op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        Expr folded = foldInt(op, a, b, Long::sum);
        if (folded != null) return folded;
        Double fx = asFloat(a), fy = asFloat(b);
        if (fx != null && fy != null) return floatConst(op.type, fx + fy);
        if (Exprs.isZero(b)) return a;
        if (Exprs.isZero(a)) return b;
        return a == op.a && b == op.b ? op : new Expr.Add(a, b);
    }

    @Override
    public Expr visit(Expr.Sub op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        Expr folded = foldInt(op, a, b, (x, y) -> x - y);
        if (folded != null) return folded;
        Double fx = asFloat(a), fy = asFloat(b);
        if (fx != null && fy != null) return floatConst(op.type, fx - fy);
        if (Exprs.isZero(b)) return a;
        if (a instanceof Expr.Variable && b instanceof Expr.Variable
                && ((Expr.Variable) a).name.equals(((Expr.Variable) b).name)
                && !op.type.isFloat()) {
            return Exprs.makeConst(op.type, 0);
        }
        return a == op.a && b == op.b ? op : new Expr.Sub(a, b);
    }

    @Override
    public Expr visit(Expr.Mul op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        Expr folded = foldInt(op, a, b, (x, y) -> x * y);
        if (folded != null) return folded;
        Double fx = asFloat(a), fy = asFloat(b);
        if (fx != null && fy != null) return floatConst(op.type, fx * fy);
        if (Exprs.isOne(b)) return a;
        if (Exprs.isOne(a)) return b;
        if (!op.type.isFloat() && (Exprs.isZero(a) || Exprs.isZero(b))) {
            return Exprs.makeConst(op.type, 0);
        }
        return a == op.a && b == op.b ? op : new Expr.Mul(a, b);
    }

    @Override
    public Expr visit(Expr.Div op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        if (!Exprs.isZero(b)) {
            Expr folded = foldInt(op, a, b, isUnsigned(op) ? Long::divideUnsigned : Simplify::floorDiv);
            if (folded != null) return folded;
            Double fx = asFloat(a), fy = asFloat(b);
            if (fx != null && fy != null) return floatConst(op.type, fx / fy);
            if (Exprs.isOne(b)) return a;
        }
        return a == op.a && b == op.b ? op : new Expr.Div(a, b);
    }

    @Override
    public Expr visit(Expr.Mod op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        if (!Exprs.isZero(b)) {
            Expr folded = foldInt(op, a, b, isUnsigned(op) ? Long::remainderUnsigned : Simplify::euclidMod);
            if (folded != null) return folded;
            if (Exprs.isOne(b) && !op.type.isFloat()) return Exprs.makeConst(op.type, 0);
        }
        return a == op.a && b == op.b ? op : new Expr.Mod(a, b);
    }

    @Override
    public Expr visit(Expr.Min op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        Expr le = compare(a, b, -1, 0);
        if (le != null) return Exprs.isOne(le) ? a : b;
        return a == op.a && b == op.b ? op : new Expr.Min(a, b);
    }

    @Override
    public Expr visit(Expr.Max op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        Expr ge = compare(a, b, 1, 0);
        if (ge != null) return Exprs.isOne(ge) ? a : b;
        return a == op.a && b == op.b ? op : new Expr.Max(a, b);
    }

    @Override
    public Expr visit(Expr.EQ op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        Expr folded = compare(a, b, 0, 0);
        if (folded != null) return folded;
        return a == op.a && b == op.b ? op : new Expr.EQ(a, b);
    }

    @Override
    public Expr visit(Expr.NE op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        Expr folded = compare(a, b, -1, 1);
        if (folded != null) return folded;
        return a == op.a && b == op.b ? op : new Expr.NE(a, b);
    }

    @Override
    public Expr visit(Expr.LT op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        Expr folded = compare(a, b, -1, -1);
        if (folded != null) return folded;
        return a == op.a && b == op.b ? op : new Expr.LT(a, b);
    }

    @Override
    public Expr visit(Expr.LE op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        Expr folded = compare(a, b, -1, 0);
        if (folded != null) return folded;
        return a == op.a && b == op.b ? op : new Expr.LE(a, b);
    }

    @Override
    public Expr visit(Expr.GT op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        Expr folded = compare(a, b, 1, 1);
        if (folded != null) return folded;
        return a == op.a && b == op.b ? op : new Expr.GT(a, b);
    }

    @Override
    public Expr visit(Expr.GE op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        Expr folded = compare(a, b, 1, 0);
        if (folded != null) return folded;
        return a == op.a && b == op.b ? op : new Expr.GE(a, b);
    }

    @Override
    public Expr visit(Expr.And op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        if (Exprs.isZero(a) || Exprs.isZero(b)) return Exprs.boolConst(false);
        if (Exprs.isOne(a)) return b;
        if (Exprs.isOne(b)) return a;
        return a == op.a && b == op.b ? op : new Expr.And(a, b);
    }

    @Override
    public Expr visit(Expr.Or op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        if (Exprs.isOne(a) || Exprs.isOne(b)) return Exprs.boolConst(true);
        if (Exprs.isZero(a)) return b;
        if (Exprs.isZero(b)) return a;
        return a == op.a && b == op.b ? op : new Expr.Or(a, b);
    }

    @Override
    public Expr visit(Expr.Not op) {
        Expr a = mutate(op.a);
        if (Exprs.isConst(a)) return Exprs.boolConst(Exprs.isZero(a));
        if (a instanceof Expr.Not) return ((Expr.Not) a).a;
        return a == op.a ? op : new Expr.Not(a);
    }

    @Override
    public Expr visit(Expr.Select op) {
        Expr cond = mutate(op.condition);
        Expr t = mutate(op.trueValue), f = mutate(op.falseValue);
        if (Exprs.isConst(cond)) return Exprs.isZero(cond) ? f : t;
        return cond == op.condition && t == op.trueValue && f == op.falseValue
                ? op
                : new Expr.Select(cond, t, f);
    }

    @Override
    public Expr visit(Expr.Let op) {
        Expr value = mutate(op.value);
        if (Exprs.isConst(value) || value instanceof Expr.Variable) {
            return mutate(Substitute.substitute(op.name, value, op.body));
        }
        Expr body = mutate(op.body);
        return value == op.value && body == op.body ? op : new Expr.Let(op.name, value, body);
    }
}
