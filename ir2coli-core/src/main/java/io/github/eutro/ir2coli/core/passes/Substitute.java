package io.github.eutro.ir2coli.core.passes;

import io.github.eutro.ir2coli.core.ir.Expr;
import io.github.eutro.ir2coli.core.ir.Stmt;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A pass which replaces free references to variables by the expressions they map to.
 * <p>
 * A name bound by a let or a loop inside the tree shadows the replacement
 * for that name within the binding's body.
 */
public class Substitute extends IRMutator {
    private final Map<String, Expr> replacements;

    /**
     * Construct a substitution.
     *
     * @param replacements The expression to replace each name by.
     */
    public Substitute(Map<String, Expr> replacements) {
        this.replacements = new HashMap<>(replacements);
    }

    /**
     * Substitute in an expression.
     *
     * @param replacements The expression to replace each name by.
     * @param e            The expression.
     * @return The expression with the replacements made.
     */
    public static Expr substitute(Map<String, Expr> replacements, Expr e) {
        return replacements.isEmpty() ? e : new Substitute(replacements).mutate(e);
    }

    /**
     * Substitute a single name in an expression.
     *
     * @param name  The name to replace.
     * @param value The replacement.
     * @param e     The expression.
     * @return The expression with the replacement made.
     */
    public static Expr substitute(String name, Expr value, Expr e) {
        return new Substitute(Collections.singletonMap(name, value)).mutate(e);
    }

    @Override
    public Expr visit(Expr.Variable op) {
        Expr replacement = replacements.get(op.name);
        return replacement == null ? op : replacement;
    }

    @Override
    public Expr visit(Expr.Let op) {
        Expr value = mutate(op.value);
        Expr shadowed = replacements.remove(op.name);
        Expr body;
        try {
            body = mutate(op.body);
        } finally {
            if (shadowed != null) replacements.put(op.name, shadowed);
        }
        return value == op.value && body == op.body ? op : new Expr.Let(op.name, value, body);
    }

    @Override
    public Stmt visit(Stmt.LetStmt op) {
        Expr value = mutate(op.value);
        Expr shadowed = replacements.remove(op.name);
        Stmt body;
        try {
            body = mutate(op.body);
        } finally {
            if (shadowed != null) replacements.put(op.name, shadowed);
        }
        return value == op.value && body == op.body ? op : new Stmt.LetStmt(op.name, value, body);
    }

    @Override
    public Stmt visit(Stmt.For op) {
        Expr min = mutate(op.min), extent = mutate(op.extent);
        Expr shadowed = replacements.remove(op.name);
        Stmt body;
        try {
            body = mutate(op.body);
        } finally {
            if (shadowed != null) replacements.put(op.name, shadowed);
        }
        return min == op.min && extent == op.extent && body == op.body
                ? op
                : new Stmt.For(op.name, min, extent, op.forType, body);
    }
}
