package io.github.eutro.ir2coli.core.ir;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A statement in the IR.
 * <p>
 * Like {@link Expr}, statements are immutable and the set of kinds is closed,
 * with one method per kind in {@link StmtVisitor}.
 */
public abstract class Stmt {
    private Stmt() {
    }

    /**
     * Dispatch on the kind of this statement.
     *
     * @param visitor The visitor.
     * @param <R>     The result type of the visitor.
     * @return The result of the matching visit method.
     */
    public abstract <R> R accept(StmtVisitor<R> visitor);

    @Override
    public String toString() {
        return IRPrinter.print(this);
    }

    /**
     * A statement-level binding of {@code name} to {@code value} within {@code body}.
     */
    public static final class LetStmt extends Stmt {
        public final String name;
        public final Expr value;
        public final Stmt body;

        public LetStmt(String name, Expr value, Stmt body) {
            this.name = Objects.requireNonNull(name);
            this.value = Objects.requireNonNull(value);
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A runtime check that {@code condition} holds.
     */
    public static final class AssertStmt extends Stmt {
        public final Expr condition;
        public final Expr message;

        public AssertStmt(Expr condition, Expr message) {
            this.condition = Objects.requireNonNull(condition);
            this.message = Objects.requireNonNull(message);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Marks {@code body} as producing, or consuming, the function {@code name}.
     */
    public static final class ProducerConsumer extends Stmt {
        public final String name;
        public final boolean isProducer;
        public final Stmt body;

        public ProducerConsumer(String name, boolean isProducer, Stmt body) {
            this.name = Objects.requireNonNull(name);
            this.isProducer = isProducer;
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A loop of {@code name} over {@code [min, min + extent)}.
     */
    public static final class For extends Stmt {
        /**
         * How the iterations of a loop may be executed.
         */
        public enum ForType {
            SERIAL,
            PARALLEL,
            VECTORIZED,
            UNROLLED,
        }

        public final String name;
        public final Expr min;
        public final Expr extent;
        public final ForType forType;
        public final Stmt body;

        public For(String name, Expr min, Expr extent, ForType forType, Stmt body) {
            this.name = Objects.requireNonNull(name);
            this.min = Objects.requireNonNull(min);
            this.extent = Objects.requireNonNull(extent);
            this.forType = Objects.requireNonNull(forType);
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A store to a flat buffer at a computed address.
     */
    public static final class Store extends Stmt {
        public final String name;
        public final Expr value;
        public final Expr index;

        public Store(String name, Expr value, Expr index) {
            this.name = Objects.requireNonNull(name);
            this.value = Objects.requireNonNull(value);
            this.index = Objects.requireNonNull(index);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A store of one or more values to the multi-dimensional function {@code name} at {@code args}.
     */
    public static final class Provide extends Stmt {
        public final String name;
        public final List<Expr> values;
        public final List<Expr> args;

        public Provide(String name, List<Expr> values, List<Expr> args) {
            this.name = Objects.requireNonNull(name);
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
            this.args = Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A flat allocation of {@code name}, live within {@code body}.
     */
    public static final class Allocate extends Stmt {
        public final String name;
        public final Type type;
        public final List<Expr> extents;
        public final Expr condition;
        public final Stmt body;

        public Allocate(String name, Type type, List<Expr> extents, Expr condition, Stmt body) {
            this.name = Objects.requireNonNull(name);
            this.type = Objects.requireNonNull(type);
            this.extents = Collections.unmodifiableList(new ArrayList<>(extents));
            this.condition = Objects.requireNonNull(condition);
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Frees the flat allocation {@code name}.
     */
    public static final class Free extends Stmt {
        public final String name;

        public Free(String name) {
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A multi-dimensional allocation of the function {@code name}, over {@code bounds},
     * live within {@code body}. There is one type per value of the function.
     */
    public static final class Realize extends Stmt {
        public final String name;
        public final List<Type> types;
        public final List<Range> bounds;
        public final Expr condition;
        public final Stmt body;

        public Realize(String name, List<Type> types, List<Range> bounds, Expr condition, Stmt body) {
            this.name = Objects.requireNonNull(name);
            this.types = Collections.unmodifiableList(new ArrayList<>(types));
            this.bounds = Collections.unmodifiableList(new ArrayList<>(bounds));
            this.condition = Objects.requireNonNull(condition);
            this.body = Objects.requireNonNull(body);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Two statements in sequence. {@code rest} may be absent.
     */
    public static final class Block extends Stmt {
        public final Stmt first;
        public final @Nullable Stmt rest;

        public Block(@NotNull Stmt first, @Nullable Stmt rest) {
            this.first = Objects.requireNonNull(first);
            this.rest = rest;
        }

        /**
         * Chain statements into a right-nested sequence of blocks.
         *
         * @param stmts The statements, at least one.
         * @return The statement running all of them in order.
         */
        public static Stmt of(Stmt... stmts) {
            if (stmts.length == 0) {
                throw new IllegalArgumentException("empty block");
            }
            Stmt acc = stmts[stmts.length - 1];
            for (int i = stmts.length - 2; i >= 0; i--) {
                acc = new Block(stmts[i], acc);
            }
            return acc;
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * A conditional. {@code elseCase} may be absent.
     */
    public static final class IfThenElse extends Stmt {
        public final Expr condition;
        public final Stmt thenCase;
        public final @Nullable Stmt elseCase;

        public IfThenElse(Expr condition, Stmt thenCase, @Nullable Stmt elseCase) {
            this.condition = Objects.requireNonNull(condition);
            this.thenCase = Objects.requireNonNull(thenCase);
            this.elseCase = elseCase;
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Evaluates an expression for its side effects.
     */
    public static final class Evaluate extends Stmt {
        public final Expr value;

        public Evaluate(Expr value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
