package io.github.eutro.ir2coli.codegen;

import io.github.eutro.ir2coli.core.ir.Expr;
import io.github.eutro.ir2coli.core.ir.Exprs;
import io.github.eutro.ir2coli.core.ir.IRPrinter;
import io.github.eutro.ir2coli.core.passes.Simplify;

import java.util.Objects;

/**
 * One active loop axis: the index {@code name} ranges over {@code [min, min + extent)}.
 */
public final class LoopDim {
    public final String name;
    public final Expr min;
    public final Expr extent;

    public LoopDim(String name, Expr min, Expr extent) {
        this.name = Objects.requireNonNull(name);
        this.min = Objects.requireNonNull(min);
        this.extent = Objects.requireNonNull(extent);
    }

    /**
     * Render the range of this axis as a predicate in the set notation
     * of iteration domains, e.g. {@code 0 <= x <= 3}.
     *
     * @return The predicate.
     */
    public String predicate() {
        Expr max = Simplify.simplify(new Expr.Sub(new Expr.Add(min, extent), Exprs.makeConst(extent.type, 1)));
        return IRPrinter.print(min) + " <= " + name + " <= " + IRPrinter.print(max);
    }

    @Override
    public String toString() {
        return predicate();
    }
}
