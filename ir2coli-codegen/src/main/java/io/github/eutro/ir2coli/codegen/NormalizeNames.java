package io.github.eutro.ir2coli.codegen;

import io.github.eutro.ir2coli.core.ir.Expr;
import io.github.eutro.ir2coli.core.ir.Stmt;
import io.github.eutro.ir2coli.core.passes.IRMutator;

/**
 * A pass which {@link Names#printName(String) sanitizes} the names of loops,
 * lets and variables, so that they can be used as identifiers in the generated program.
 * <p>
 * Names of functions, in calls and provides, are left alone.
 */
public class NormalizeNames extends IRMutator {
    /**
     * An instance of this pass.
     */
    public static final NormalizeNames INSTANCE = new NormalizeNames();

    @Override
    public Stmt visit(Stmt.For op) {
        String name = Names.printName(op.name);
        Expr min = mutate(op.min), extent = mutate(op.extent);
        Stmt body = mutate(op.body);
        return name.equals(op.name) && min == op.min && extent == op.extent && body == op.body
                ? op
                : new Stmt.For(name, min, extent, op.forType, body);
    }

    @Override
    public Expr visit(Expr.Let op) {
        String name = Names.printName(op.name);
        Expr value = mutate(op.value), body = mutate(op.body);
        return name.equals(op.name) && value == op.value && body == op.body
                ? op
                : new Expr.Let(name, value, body);
    }

    @Override
    public Stmt visit(Stmt.LetStmt op) {
        String name = Names.printName(op.name);
        Expr value = mutate(op.value);
        Stmt body = mutate(op.body);
        return name.equals(op.name) && value == op.value && body == op.body
                ? op
                : new Stmt.LetStmt(name, value, body);
    }

    @Override
    public Expr visit(Expr.Variable op) {
        String name = Names.printName(op.name);
        return name.equals(op.name) ? op : new Expr.Variable(op.type, name);
    }
}
