/**
 * This package defines the intermediate representation (IR) consumed by ir2coli:
 * a tree of {@link io.github.eutro.ir2coli.core.ir.Stmt statements} describing
 * nested loops, and the {@link io.github.eutro.ir2coli.core.ir.Expr expressions}
 * computed at each iteration.
 * <p>
 * The IR is expected in its <i>unflattened</i> form: multi-dimensional functions are
 * written with {@link io.github.eutro.ir2coli.core.ir.Stmt.Provide} and read with
 * {@link io.github.eutro.ir2coli.core.ir.Expr.Call}, and allocated with
 * {@link io.github.eutro.ir2coli.core.ir.Stmt.Realize}. The flat forms
 * ({@link io.github.eutro.ir2coli.core.ir.Stmt.Store},
 * {@link io.github.eutro.ir2coli.core.ir.Expr.Load},
 * {@link io.github.eutro.ir2coli.core.ir.Stmt.Allocate}) exist so that such trees can
 * be represented and rejected.
 * <p>
 * Both node hierarchies are closed. Code that must handle every kind should
 * implement {@link io.github.eutro.ir2coli.core.ir.ExprVisitor} or
 * {@link io.github.eutro.ir2coli.core.ir.StmtVisitor}, so that adding a kind
 * is a compile error until it is handled.
 */
package io.github.eutro.ir2coli.core.ir;
