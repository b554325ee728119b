package io.github.eutro.ir2coli.codegen;

import io.github.eutro.ir2coli.core.ir.Type;

import static io.github.eutro.ir2coli.codegen.CodegenException.Reason.UNSUPPORTED_TYPE;
import static io.github.eutro.ir2coli.codegen.CodegenException.Reason.UNSUPPORTED_WIDTH;

/**
 * Names of the primitive types of the generated program.
 */
public final class ColiTypes {
    private ColiTypes() {
    }

    private static boolean isStandardWidth(int bits) {
        return bits == 8 || bits == 16 || bits == 32 || bits == 64;
    }

    /**
     * Get the primitive type constant for an IR type.
     *
     * @param type The IR type.
     * @return The name of the constant, e.g. {@code coli::p_int32}.
     * @throws CodegenException If the type has no counterpart.
     */
    public static String typeName(Type type) {
        if (type.isBool()) {
            return "coli::p_boolean";
        }
        switch (type.code) {
            case INT:
            case UINT:
                if (!isStandardWidth(type.bits)) {
                    throw new CodegenException(UNSUPPORTED_WIDTH,
                            "Integers of " + type.bits + " bits are not supported in COLi.");
                }
                return (type.isInt() ? "coli::p_int" : "coli::p_uint") + type.bits;
            case FLOAT:
                if (type.bits != 32 && type.bits != 64) {
                    throw new CodegenException(UNSUPPORTED_WIDTH,
                            "Floats other than 32 and 64 bits are not supported in COLi.");
                }
                return "coli::p_float" + type.bits;
            default:
                throw new CodegenException(UNSUPPORTED_TYPE,
                        "Type " + type + " cannot be translated to a COLi type.");
        }
    }

    /**
     * Get the C cast prefix used to tag an integer literal with its width, e.g. {@code (int32_t)}.
     *
     * @param type The integer type.
     * @return The cast.
     * @throws CodegenException If the width has no counterpart.
     */
    public static String literalCast(Type type) {
        if (!isStandardWidth(type.bits)) {
            throw new CodegenException(UNSUPPORTED_WIDTH,
                    "Integer literals of " + type.bits + " bits are not supported in COLi.");
        }
        return (type.isInt() ? "(int" : "(uint") + type.bits + "_t)";
    }
}
