package io.github.eutro.ir2coli.core.passes;

import io.github.eutro.ir2coli.core.ir.Expr;

/**
 * A pass which eliminates every expression-level {@link Expr.Let} by substituting
 * its value into its body.
 * <p>
 * Statement-level lets are kept, but the expressions inside them are still rewritten.
 */
public class InlineLets extends IRMutator {
    /**
     * An instance of this pass.
     */
    public static final InlineLets INSTANCE = new InlineLets();

    @Override
    public Expr visit(Expr.Let op) {
        Expr value = mutate(op.value);
        Expr body = mutate(op.body);
        return Substitute.substitute(op.name, value, body);
    }
}
