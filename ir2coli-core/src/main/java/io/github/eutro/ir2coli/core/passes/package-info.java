/**
 * Passes that rewrite the IR: substitution, let inlining and simplification.
 *
 * @see io.github.eutro.ir2coli.core.passes.IRPass
 */
package io.github.eutro.ir2coli.core.passes;
