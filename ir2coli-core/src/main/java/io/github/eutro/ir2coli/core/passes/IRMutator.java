package io.github.eutro.ir2coli.core.passes;

import io.github.eutro.ir2coli.core.ir.*;

import java.util.ArrayList;
import java.util.List;

/**
 * A pass which rebuilds a tree bottom-up.
 * <p>
 * By default every node is rebuilt from its mutated children. Whenever no child
 * changed, the original node is returned, so an unchanged subtree keeps its identity.
 * Subclasses override the visit methods for the kinds they rewrite.
 */
public class IRMutator implements ExprVisitor<Expr>, StmtVisitor<Stmt>, IRPass<Stmt, Stmt> {
    /**
     * Mutate an expression.
     *
     * @param e The expression.
     * @return The rewritten expression.
     */
    public Expr mutate(Expr e) {
        return e.accept(this);
    }

    /**
     * Mutate a statement.
     *
     * @param s The statement, may be null.
     * @return The rewritten statement, null if {@code s} was.
     */
    public Stmt mutate(Stmt s) {
        return s == null ? null : s.accept(this);
    }

    @Override
    public Stmt run(Stmt stmt) {
        return mutate(stmt);
    }

    /**
     * Mutate every expression of a list.
     *
     * @param exprs The expressions.
     * @return The original list if nothing changed, otherwise a new list.
     */
    protected List<Expr> mutateAll(List<Expr> exprs) {
        List<Expr> ret = null;
        for (int i = 0; i < exprs.size(); i++) {
            Expr old = exprs.get(i);
            Expr mutated = mutate(old);
            if (ret == null && mutated != old) {
                ret = new ArrayList<>(exprs.subList(0, i));
            }
            if (ret != null) ret.add(mutated);
        }
        return ret == null ? exprs : ret;
    }

    @Override
    public Expr visit(Expr.IntImm op) {
        return op;
    }

    @Override
    public Expr visit(Expr.UIntImm op) {
        return op;
    }

    @Override
    public Expr visit(Expr.FloatImm op) {
        return op;
    }

    @Override
    public Expr visit(Expr.StringImm op) {
        return op;
    }

    @Override
    public Expr visit(Expr.Cast op) {
        Expr value = mutate(op.value);
        return value == op.value ? op : new Expr.Cast(op.type, value);
    }

    @Override
    public Expr visit(Expr.Variable op) {
        return op;
    }

    @Override
    public Expr visit(Expr.Add op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.Add(a, b);
    }

    @Override
    public Expr visit(Expr.Sub op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.Sub(a, b);
    }

    @Override
    public Expr visit(Expr.Mul op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.Mul(a, b);
    }

    @Override
    public Expr visit(Expr.Div op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.Div(a, b);
    }

    @Override
    public Expr visit(Expr.Mod op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.Mod(a, b);
    }

    @Override
    public Expr visit(Expr.Min op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.Min(a, b);
    }

    @Override
    public Expr visit(Expr.Max op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.Max(a, b);
    }

    @Override
    public Expr visit(Expr.EQ op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.EQ(a, b);
    }

    @Override
    public Expr visit(Expr.NE op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.NE(a, b);
    }

    @Override
    public Expr visit(Expr.LT op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.LT(a, b);
    }

    @Override
    public Expr visit(Expr.LE op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.LE(a, b);
    }

    @Override
    public Expr visit(Expr.GT op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.GT(a, b);
    }

    @Override
    public Expr visit(Expr.GE op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.GE(a, b);
    }

    @Override
    public Expr visit(Expr.And op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.And(a, b);
    }

    @Override
    public Expr visit(Expr.Or op) {
        Expr a = mutate(op.a), b = mutate(op.b);
        return a == op.a && b == op.b ? op : new Expr.Or(a, b);
    }

    @Override
    public Expr visit(Expr.Not op) {
        Expr a = mutate(op.a);
        return a == op.a ? op : new Expr.Not(a);
    }

    @Override
    public Expr visit(Expr.Select op) {
        Expr cond = mutate(op.condition);
        Expr t = mutate(op.trueValue);
        Expr f = mutate(op.falseValue);
        return cond == op.condition && t == op.trueValue && f == op.falseValue
                ? op
                : new Expr.Select(cond, t, f);
    }

    @Override
    public Expr visit(Expr.Load op) {
        Expr index = mutate(op.index);
        return index == op.index ? op : new Expr.Load(op.type, op.name, index);
    }

    @Override
    public Expr visit(Expr.Ramp op) {
        Expr base = mutate(op.base), stride = mutate(op.stride);
        return base == op.base && stride == op.stride ? op : new Expr.Ramp(base, stride, op.lanes);
    }

    @Override
    public Expr visit(Expr.Broadcast op) {
        Expr value = mutate(op.value);
        return value == op.value ? op : new Expr.Broadcast(value, op.lanes);
    }

    @Override
    public Expr visit(Expr.Call op) {
        List<Expr> args = mutateAll(op.args);
        return args == op.args ? op : new Expr.Call(op.type, op.name, args, op.callType);
    }

    @Override
    public Expr visit(Expr.Let op) {
        Expr value = mutate(op.value), body = mutate(op.body);
        return value == op.value && body == op.body ? op : new Expr.Let(op.name, value, body);
    }

    @Override
    public Stmt visit(Stmt.LetStmt op) {
        Expr value = mutate(op.value);
        Stmt body = mutate(op.body);
        return value == op.value && body == op.body ? op : new Stmt.LetStmt(op.name, value, body);
    }

    @Override
    public Stmt visit(Stmt.AssertStmt op) {
        Expr cond = mutate(op.condition), message = mutate(op.message);
        return cond == op.condition && message == op.message ? op : new Stmt.AssertStmt(cond, message);
    }

    @Override
    public Stmt visit(Stmt.ProducerConsumer op) {
        Stmt body = mutate(op.body);
        return body == op.body ? op : new Stmt.ProducerConsumer(op.name, op.isProducer, body);
    }

    @Override
    public Stmt visit(Stmt.For op) {
        Expr min = mutate(op.min), extent = mutate(op.extent);
        Stmt body = mutate(op.body);
        return min == op.min && extent == op.extent && body == op.body
                ? op
                : new Stmt.For(op.name, min, extent, op.forType, body);
    }

    @Override
    public Stmt visit(Stmt.Store op) {
        Expr value = mutate(op.value), index = mutate(op.index);
        return value == op.value && index == op.index ? op : new Stmt.Store(op.name, value, index);
    }

    @Override
    public Stmt visit(Stmt.Provide op) {
        List<Expr> values = mutateAll(op.values);
        List<Expr> args = mutateAll(op.args);
        return values == op.values && args == op.args ? op : new Stmt.Provide(op.name, values, args);
    }

    @Override
    public Stmt visit(Stmt.Allocate op) {
        List<Expr> extents = mutateAll(op.extents);
        Expr cond = mutate(op.condition);
        Stmt body = mutate(op.body);
        return extents == op.extents && cond == op.condition && body == op.body
                ? op
                : new Stmt.Allocate(op.name, op.type, extents, cond, body);
    }

    @Override
    public Stmt visit(Stmt.Free op) {
        return op;
    }

    @Override
    public Stmt visit(Stmt.Realize op) {
        boolean changed = false;
        List<Range> bounds = new ArrayList<>(op.bounds.size());
        for (Range bound : op.bounds) {
            Expr min = mutate(bound.min), extent = mutate(bound.extent);
            if (min != bound.min || extent != bound.extent) {
                changed = true;
                bounds.add(new Range(min, extent));
            } else {
                bounds.add(bound);
            }
        }
        Expr cond = mutate(op.condition);
        Stmt body = mutate(op.body);
        return !changed && cond == op.condition && body == op.body
                ? op
                : new Stmt.Realize(op.name, op.types, bounds, cond, body);
    }

    @Override
    public Stmt visit(Stmt.Block op) {
        Stmt first = mutate(op.first), rest = mutate(op.rest);
        return first == op.first && rest == op.rest ? op : new Stmt.Block(first, rest);
    }

    @Override
    public Stmt visit(Stmt.IfThenElse op) {
        Expr cond = mutate(op.condition);
        Stmt thenCase = mutate(op.thenCase), elseCase = mutate(op.elseCase);
        return cond == op.condition && thenCase == op.thenCase && elseCase == op.elseCase
                ? op
                : new Stmt.IfThenElse(cond, thenCase, elseCase);
    }

    @Override
    public Stmt visit(Stmt.Evaluate op) {
        Expr value = mutate(op.value);
        return value == op.value ? op : new Stmt.Evaluate(value);
    }
}
