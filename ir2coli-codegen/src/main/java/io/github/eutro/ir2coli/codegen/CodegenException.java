package io.github.eutro.ir2coli.codegen;

/**
 * Thrown when the input IR uses something that cannot be translated.
 * <p>
 * Translation stops at the first such error, and no output is produced.
 * Violations of the generator's own assumptions about the shape of its
 * input are reported as {@link IllegalStateException} instead.
 */
public class CodegenException extends RuntimeException {
    /**
     * Why translation failed.
     */
    public enum Reason {
        UNSUPPORTED_CONSTRUCT,
        UNSUPPORTED_WIDTH,
        UNSUPPORTED_TYPE,
        DUPLICATE_BUFFER,
        DUPLICATE_COMPUTATION,
        DUPLICATE_CONSTANT,
        UNKNOWN_COMPUTATION,
        MISSING_BUFFER,
        MALFORMED_STORE,
        UNSUPPORTED_REALIZE,
        UNSUPPORTED_UPDATE,
        TOO_DEEP,
    }

    public final Reason reason;

    public CodegenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
