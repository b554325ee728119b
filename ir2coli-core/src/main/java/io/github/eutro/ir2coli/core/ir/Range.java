package io.github.eutro.ir2coli.core.ir;

import java.util.Objects;

/**
 * A half-open interval {@code [min, min + extent)} along one dimension of a {@link Stmt.Realize}.
 */
public final class Range {
    public final Expr min;
    public final Expr extent;

    public Range(Expr min, Expr extent) {
        this.min = Objects.requireNonNull(min);
        this.extent = Objects.requireNonNull(extent);
    }

    @Override
    public String toString() {
        return "[" + min + ", " + extent + "]";
    }
}
