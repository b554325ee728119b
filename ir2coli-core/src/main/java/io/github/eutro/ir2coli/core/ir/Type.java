package io.github.eutro.ir2coli.core.ir;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * The scalar type of an {@link Expr}.
 * <p>
 * A type is a {@link Code kind} plus a bit width. Booleans are
 * unsigned integers of width 1.
 */
public final class Type {
    /**
     * The kind of a type.
     */
    public enum Code {
        /**
         * A signed integer.
         */
        INT,
        /**
         * An unsigned integer, or a boolean if the width is 1.
         */
        UINT,
        /**
         * An IEEE floating point number.
         */
        FLOAT,
        /**
         * An opaque pointer.
         */
        HANDLE,
    }

    /**
     * The kind of this type.
     */
    public final Code code;
    /**
     * The width of this type, in bits.
     */
    public final int bits;

    private Type(Code code, int bits) {
        this.code = code;
        this.bits = bits;
    }

    /**
     * Create a type.
     *
     * @param code The kind of the type.
     * @param bits The width of the type.
     * @return The type.
     */
    public static Type of(@NotNull Code code, int bits) {
        if (bits <= 0) {
            throw new IllegalArgumentException("bad type width: " + bits);
        }
        return new Type(Objects.requireNonNull(code), bits);
    }

    public static Type int_(int bits) {
        return of(Code.INT, bits);
    }

    public static Type uint(int bits) {
        return of(Code.UINT, bits);
    }

    public static Type float_(int bits) {
        return of(Code.FLOAT, bits);
    }

    public static Type bool() {
        return of(Code.UINT, 1);
    }

    public static Type handle() {
        return of(Code.HANDLE, 64);
    }

    public boolean isInt() {
        return code == Code.INT;
    }

    public boolean isUInt() {
        return code == Code.UINT && bits != 1;
    }

    public boolean isFloat() {
        return code == Code.FLOAT;
    }

    public boolean isBool() {
        return code == Code.UINT && bits == 1;
    }

    public boolean isHandle() {
        return code == Code.HANDLE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Type type = (Type) o;
        return bits == type.bits && code == type.code;
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, bits);
    }

    @Override
    public String toString() {
        if (isBool()) return "bool";
        switch (code) {
            case INT:
                return "int" + bits;
            case UINT:
                return "uint" + bits;
            case FLOAT:
                return "float" + bits;
            default:
                return "handle";
        }
    }
}
