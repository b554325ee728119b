package io.github.eutro.ir2coli.codegen;

import io.github.eutro.ir2coli.core.ir.Expr;
import io.github.eutro.ir2coli.core.ir.Exprs;
import io.github.eutro.ir2coli.core.ir.IRPrinter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The stack of loop axes enclosing the statement being generated, outermost first.
 */
public class LoopDims {
    private final List<LoopDim> dims = new ArrayList<>();

    public void push(String name, Expr min, Expr extent) {
        dims.add(new LoopDim(name, min, extent));
    }

    /**
     * Pop the innermost axis.
     *
     * @throws IllegalStateException If there is no axis.
     */
    public void pop() {
        if (dims.isEmpty()) {
            throw new IllegalStateException("pop from empty loop stack");
        }
        dims.remove(dims.size() - 1);
    }

    public int depth() {
        return dims.size();
    }

    /**
     * Get the active axes, outermost first.
     *
     * @return An unmodifiable view of the axes.
     */
    public List<LoopDim> dims() {
        return Collections.unmodifiableList(dims);
    }

    /**
     * Copy the current axes, to {@link #restore(List) restore} later.
     *
     * @return The copy.
     */
    public List<LoopDim> snapshot() {
        return new ArrayList<>(dims);
    }

    /**
     * Replace the current axes with a snapshot.
     *
     * @param snapshot The snapshot.
     */
    public void restore(List<LoopDim> snapshot) {
        dims.clear();
        dims.addAll(snapshot);
    }

    /**
     * Get the bounds of the active axes that aren't constants, in push order:
     * the min of each axis, then its extent.
     * These are the symbolic parameters of the iteration domain.
     *
     * @return The non-constant bounds.
     */
    public List<Expr> boundVars() {
        List<Expr> ret = new ArrayList<>();
        for (LoopDim dim : dims) {
            if (!Exprs.isConst(dim.min)) ret.add(dim.min);
            if (!Exprs.isConst(dim.extent)) ret.add(dim.extent);
        }
        return ret;
    }

    /**
     * Render {@link #boundVars()} as a parameter list, {@code [a, b]}, or the empty
     * string if there are none.
     *
     * @return The parameter list.
     */
    public String boundVarsString() {
        List<Expr> vars = boundVars();
        return vars.isEmpty() ? "" : IRPrinter.printList(vars);
    }

    /**
     * Render the conjunction of the ranges of the active axes, outermost first,
     * as {@code (p0) and (p1)}. With no axes, this is {@code ()}.
     *
     * @return The conjunction.
     */
    public String boundPredicate() {
        return dims.stream()
                .map(LoopDim::predicate)
                .collect(Collectors.joining(") and (", "(", ")"));
    }

    /**
     * Render an iteration domain over the active axes.
     *
     * @param name The name of the computation.
     * @param dims The rendered iteration indices, {@code [x, y]}.
     * @return The domain, {@code [params]->{name[x, y]: predicate}}.
     */
    public String domain(String name, String dims) {
        return domainHead(name, dims) + boundPredicate() + "}";
    }

    /**
     * Render the part of {@link #domain(String, String)} up to the predicate.
     *
     * @param name The name of the computation.
     * @param dims The rendered iteration indices.
     * @return The head of the domain.
     */
    public String domainHead(String name, String dims) {
        String params = boundVarsString();
        return (params.isEmpty() ? "" : params + "->") + "{" + name + dims + ": ";
    }
}
