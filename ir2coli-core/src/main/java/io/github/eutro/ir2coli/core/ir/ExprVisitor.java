package io.github.eutro.ir2coli.core.ir;

/**
 * A visitor over every kind of {@link Expr}.
 *
 * @param <R> The result type.
 */
public interface ExprVisitor<R> {
    R visit(Expr.IntImm op);

    R visit(Expr.UIntImm op);

    R visit(Expr.FloatImm op);

    R visit(Expr.StringImm op);

    R visit(Expr.Cast op);

    R visit(Expr.Variable op);

    R visit(Expr.Add op);

    R visit(Expr.Sub op);

    R visit(Expr.Mul op);

    R visit(Expr.Div op);

    R visit(Expr.Mod op);

    R visit(Expr.Min op);

    R visit(Expr.Max op);

    R visit(Expr.EQ op);

    R visit(Expr.NE op);

    R visit(Expr.LT op);

    R visit(Expr.LE op);

    R visit(Expr.GT op);

    R visit(Expr.GE op);

    R visit(Expr.And op);

    R visit(Expr.Or op);

    R visit(Expr.Not op);

    R visit(Expr.Select op);

    R visit(Expr.Load op);

    R visit(Expr.Ramp op);

    R visit(Expr.Broadcast op);

    R visit(Expr.Call op);

    R visit(Expr.Let op);
}
