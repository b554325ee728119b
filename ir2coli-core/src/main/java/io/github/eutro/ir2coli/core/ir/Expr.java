package io.github.eutro.ir2coli.core.ir;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An expression in the IR.
 * <p>
 * Expressions are immutable trees. The set of expression kinds is closed:
 * every kind is a final nested class of this one, and each has a matching
 * method in {@link ExprVisitor}.
 *
 * @see Stmt
 */
public abstract class Expr {
    /**
     * The type of the value this expression computes.
     */
    public final Type type;

    private Expr(@NotNull Type type) {
        this.type = Objects.requireNonNull(type);
    }

    /**
     * Dispatch on the kind of this expression.
     *
     * @param visitor The visitor.
     * @param <R>     The result type of the visitor.
     * @return The result of the matching visit method.
     */
    public abstract <R> R accept(ExprVisitor<R> visitor);

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }

    /**
     * A signed integer literal.
     */
    public static final class IntImm extends Expr {
        public final long value;

        public IntImm(Type type, long value) {
            super(type);
            if (!type.isInt()) throw new IllegalArgumentException("IntImm of type " + type);
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * An unsigned integer literal. Boolean literals are unsigned literals of width 1.
     */
    public static final class UIntImm extends Expr {
        public final long value;

        public UIntImm(Type type, long value) {
            super(type);
            if (type.code != Type.Code.UINT) throw new IllegalArgumentException("UIntImm of type " + type);
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A floating point literal.
     */
    public static final class FloatImm extends Expr {
        public final double value;

        public FloatImm(Type type, double value) {
            super(type);
            if (!type.isFloat()) throw new IllegalArgumentException("FloatImm of type " + type);
            this.value = value;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A string literal, typed as a handle.
     */
    public static final class StringImm extends Expr {
        public final String value;

        public StringImm(String value) {
            super(Type.handle());
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A conversion of a value to another type.
     */
    public static final class Cast extends Expr {
        public final Expr value;

        public Cast(Type type, Expr value) {
            super(type);
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A reference to a named variable: a loop index, or a let-bound name.
     */
    public static final class Variable extends Expr {
        public final String name;

        public Variable(Type type, String name) {
            super(type);
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A binary operator. The concrete kinds are the nested subclasses of {@link Expr}.
     */
    public abstract static class BinOp extends Expr {
        public final Expr a;
        public final Expr b;

        private BinOp(Type type, Expr a, Expr b) {
            super(type);
            this.a = Objects.requireNonNull(a);
            this.b = Objects.requireNonNull(b);
        }
    }

    public static final class Add extends BinOp {
        public Add(Expr a, Expr b) {
            super(a.type, a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Sub extends BinOp {
        public Sub(Expr a, Expr b) {
            super(a.type, a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Mul extends BinOp {
        public Mul(Expr a, Expr b) {
            super(a.type, a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Div extends BinOp {
        public Div(Expr a, Expr b) {
            super(a.type, a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Mod extends BinOp {
        public Mod(Expr a, Expr b) {
            super(a.type, a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Min extends BinOp {
        public Min(Expr a, Expr b) {
            super(a.type, a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Max extends BinOp {
        public Max(Expr a, Expr b) {
            super(a.type, a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class EQ extends BinOp {
        public EQ(Expr a, Expr b) {
            super(Type.bool(), a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class NE extends BinOp {
        public NE(Expr a, Expr b) {
            super(Type.bool(), a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class LT extends BinOp {
        public LT(Expr a, Expr b) {
            super(Type.bool(), a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class LE extends BinOp {
        public LE(Expr a, Expr b) {
            super(Type.bool(), a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class GT extends BinOp {
        public GT(Expr a, Expr b) {
            super(Type.bool(), a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class GE extends BinOp {
        public GE(Expr a, Expr b) {
            super(Type.bool(), a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class And extends BinOp {
        public And(Expr a, Expr b) {
            super(Type.bool(), a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static final class Or extends BinOp {
        public Or(Expr a, Expr b) {
            super(Type.bool(), a, b);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Boolean negation.
     */
    public static final class Not extends Expr {
        public final Expr a;

        public Not(Expr a) {
            super(Type.bool());
            this.a = Objects.requireNonNull(a);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A ternary conditional: {@code condition ? trueValue : falseValue}.
     */
    public static final class Select extends Expr {
        public final Expr condition;
        public final Expr trueValue;
        public final Expr falseValue;

        public Select(Expr condition, Expr trueValue, Expr falseValue) {
            super(trueValue.type);
            this.condition = Objects.requireNonNull(condition);
            this.trueValue = trueValue;
            this.falseValue = Objects.requireNonNull(falseValue);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A load from a flat buffer at a computed address.
     */
    public static final class Load extends Expr {
        public final String name;
        public final Expr index;

        public Load(Type type, String name, Expr index) {
            super(type);
            this.name = Objects.requireNonNull(name);
            this.index = Objects.requireNonNull(index);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A vector of {@code lanes} values {@code base, base + stride, ...}.
     */
    public static final class Ramp extends Expr {
        public final Expr base;
        public final Expr stride;
        public final int lanes;

        public Ramp(Expr base, Expr stride, int lanes) {
            super(base.type);
            this.base = base;
            this.stride = Objects.requireNonNull(stride);
            this.lanes = lanes;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A vector of {@code lanes} copies of a scalar.
     */
    public static final class Broadcast extends Expr {
        public final Expr value;
        public final int lanes;

        public Broadcast(Expr value, int lanes) {
            super(value.type);
            this.value = value;
            this.lanes = lanes;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A call to a named function.
     */
    public static final class Call extends Expr {
        /**
         * What a {@link Call} refers to.
         */
        public enum CallType {
            /**
             * A function of the pipeline, addressed by its pure arguments.
             */
            FUNCTION,
            /**
             * An input image, addressed by its coordinates.
             */
            IMAGE,
            /**
             * An external C function.
             */
            EXTERN,
            /**
             * A compiler intrinsic.
             */
            INTRINSIC,
        }

        public final String name;
        public final List<Expr> args;
        public final CallType callType;

        public Call(Type type, String name, List<Expr> args, CallType callType) {
            super(type);
            this.name = Objects.requireNonNull(name);
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
            this.callType = Objects.requireNonNull(callType);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * An expression-level binding of {@code name} to {@code value} within {@code body}.
     */
    public static final class Let extends Expr {
        public final String name;
        public final Expr value;
        public final Expr body;

        public Let(String name, Expr value, Expr body) {
            super(body.type);
            this.name = Objects.requireNonNull(name);
            this.value = Objects.requireNonNull(value);
            this.body = body;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
