package io.github.eutro.ir2coli.core.passes.misc;

import io.github.eutro.ir2coli.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sequence of passes, each given the result of the one before.
 * <p>
 * Chaining a chain splices its passes in, so a pipeline built with repeated
 * {@link IRPass#then(IRPass)} runs as one flat loop. A pass that throws has the
 * failing stage recorded as a suppressed exception.
 *
 * @param <A> The input type.
 * @param <C> The output type.
 */
public class ChainedPass<A, C> implements IRPass<A, C> {
    private final List<IRPass<?, ?>> passes;

    /**
     * Construct a chained pass.
     *
     * @param firstPass The first pass to run.
     * @param nextPass  The pass to run on its result.
     * @param <B>       The intermediate type.
     */
    public <B> ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        addFlattened(passes, firstPass);
        addFlattened(passes, nextPass);
        this.passes = Collections.unmodifiableList(passes);
    }

    private static void addFlattened(List<IRPass<?, ?>> passes, IRPass<?, ?> pass) {
        if (pass instanceof ChainedPass) {
            passes.addAll(((ChainedPass<?, ?>) pass).passes);
        } else {
            passes.add(pass);
        }
    }

    /**
     * Get the passes of this chain, in the order they run.
     *
     * @return The passes.
     */
    public List<IRPass<?, ?>> passes() {
        return passes;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        Object acc = a;
        for (int i = 0; i < passes.size(); i++) {
            IRPass<Object, Object> pass = (IRPass<Object, Object>) passes.get(i);
            try {
                acc = pass.run(acc);
            } catch (RuntimeException e) {
                e.addSuppressed(new IllegalStateException("in pass " + (i + 1) + " of " + passes.size()
                        + " (" + pass.getClass().getSimpleName() + ")"));
                throw e;
            }
        }
        return (C) acc;
    }
}
