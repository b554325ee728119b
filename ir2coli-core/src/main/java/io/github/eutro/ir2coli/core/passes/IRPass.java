package io.github.eutro.ir2coli.core.passes;

import io.github.eutro.ir2coli.core.ir.Expr;
import io.github.eutro.ir2coli.core.ir.Stmt;
import io.github.eutro.ir2coli.core.passes.misc.ChainedPass;

/**
 * A pass to run on some part of the IR (e.g. a {@link Stmt} tree, or an {@link Expr}),
 * producing a rewritten tree, or converting it to a different form.
 * <p>
 * The IR is immutable, so passes never modify their input; a pass that
 * changes nothing may return its input unchanged.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 * @see io.github.eutro.ir2coli.core.ir
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @return The composed pass.
     * @param <C> The result type.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
