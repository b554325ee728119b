package io.github.eutro.ir2coli.core.ir;

/**
 * A visitor over every kind of {@link Stmt}.
 *
 * @param <R> The result type.
 */
public interface StmtVisitor<R> {
    R visit(Stmt.LetStmt op);

    R visit(Stmt.AssertStmt op);

    R visit(Stmt.ProducerConsumer op);

    R visit(Stmt.For op);

    R visit(Stmt.Store op);

    R visit(Stmt.Provide op);

    R visit(Stmt.Allocate op);

    R visit(Stmt.Free op);

    R visit(Stmt.Realize op);

    R visit(Stmt.Block op);

    R visit(Stmt.IfThenElse op);

    R visit(Stmt.Evaluate op);
}
