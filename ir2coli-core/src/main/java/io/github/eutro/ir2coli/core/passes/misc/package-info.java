/**
 * Passes that combine or adapt other passes.
 */
package io.github.eutro.ir2coli.core.passes.misc;
