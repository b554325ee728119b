package io.github.eutro.ir2coli.codegen;

/**
 * The part a buffer plays in the generated function.
 */
public enum BufferRole {
    INPUT("coli::a_input"),
    OUTPUT("coli::a_output"),
    TEMPORARY("coli::a_temporary"),
    ;

    /**
     * The name of the argument type constant in the generated program.
     */
    public final String coliName;

    BufferRole(String coliName) {
        this.coliName = coliName;
    }
}
