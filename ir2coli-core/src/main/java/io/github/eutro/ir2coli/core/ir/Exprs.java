package io.github.eutro.ir2coli.core.ir;

import org.jetbrains.annotations.Nullable;

/**
 * Constructors for constant expressions, and predicates over them.
 */
public final class Exprs {
    private Exprs() {
    }

    /**
     * Make a 32-bit signed integer constant.
     *
     * @param value The value.
     * @return The constant expression.
     */
    public static Expr intConst(long value) {
        return makeConst(Type.int_(32), value);
    }

    /**
     * Make a boolean constant.
     *
     * @param value The value.
     * @return The constant expression.
     */
    public static Expr boolConst(boolean value) {
        return new Expr.UIntImm(Type.bool(), value ? 1 : 0);
    }

    /**
     * Make a constant of the given type with the given integral value.
     *
     * @param type  The type.
     * @param value The value.
     * @return The constant expression.
     */
    public static Expr makeConst(Type type, long value) {
        switch (type.code) {
            case INT:
                return new Expr.IntImm(type, value);
            case UINT:
                return new Expr.UIntImm(type, type.isBool() ? (value != 0 ? 1 : 0) : value);
            case FLOAT:
                return new Expr.FloatImm(type, value);
            default:
                throw new IllegalArgumentException("cannot make a constant of type " + type);
        }
    }

    /**
     * Make a 32-bit signed integer variable reference.
     *
     * @param name The name of the variable.
     * @return The variable expression.
     */
    public static Expr var(String name) {
        return new Expr.Variable(Type.int_(32), name);
    }

    /**
     * Returns whether the expression is a literal scalar constant.
     *
     * @param e The expression.
     * @return Whether it is a constant.
     */
    public static boolean isConst(Expr e) {
        return e instanceof Expr.IntImm
                || e instanceof Expr.UIntImm
                || e instanceof Expr.FloatImm
                || (e instanceof Expr.Broadcast && isConst(((Expr.Broadcast) e).value));
    }

    /**
     * Returns whether the expression is a literal zero.
     *
     * @param e The expression.
     * @return Whether it is zero.
     */
    public static boolean isZero(Expr e) {
        if (e instanceof Expr.IntImm) return ((Expr.IntImm) e).value == 0;
        if (e instanceof Expr.UIntImm) return ((Expr.UIntImm) e).value == 0;
        if (e instanceof Expr.FloatImm) return ((Expr.FloatImm) e).value == 0;
        return false;
    }

    /**
     * Returns whether the expression is a literal one.
     *
     * @param e The expression.
     * @return Whether it is one.
     */
    public static boolean isOne(Expr e) {
        if (e instanceof Expr.IntImm) return ((Expr.IntImm) e).value == 1;
        if (e instanceof Expr.UIntImm) return ((Expr.UIntImm) e).value == 1;
        if (e instanceof Expr.FloatImm) return ((Expr.FloatImm) e).value == 1;
        return false;
    }

    /**
     * Get the value of an integral constant.
     *
     * @param e The expression.
     * @return The value, or null if the expression is not an integral constant.
     */
    public static @Nullable Long asIntegral(Expr e) {
        if (e instanceof Expr.IntImm) return ((Expr.IntImm) e).value;
        if (e instanceof Expr.UIntImm) return ((Expr.UIntImm) e).value;
        return null;
    }
}
