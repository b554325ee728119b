/**
 * Generation of COLi programs from the loop nests of a pipeline.
 * <p>
 * {@link io.github.eutro.ir2coli.codegen.ColiCompiler} is the entry point.
 * {@link io.github.eutro.ir2coli.codegen.ColiCodeGen} does the translation, turning each
 * {@link io.github.eutro.ir2coli.core.ir.Stmt.Provide} into a computation over the
 * iteration domain of its enclosing loops, each
 * {@link io.github.eutro.ir2coli.core.ir.Stmt.Realize} into a temporary buffer,
 * and the bounds of each loop into constants.
 * <p>
 * Translation is best-effort in one respect: of an
 * {@link io.github.eutro.ir2coli.core.ir.Stmt.IfThenElse}, only the then case is
 * translated. Everything else that cannot be translated fails with a
 * {@link io.github.eutro.ir2coli.codegen.CodegenException}.
 */
package io.github.eutro.ir2coli.codegen;
