package io.github.eutro.ir2coli.codegen;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static io.github.eutro.ir2coli.codegen.CodegenException.Reason.*;

/**
 * The names declared so far in the generated program: buffers, computations and constants.
 * <p>
 * Each name is declared at most once, and declarations are never removed.
 * Computations and constants share a namespace, since both become variables
 * of the generated function.
 */
public class Declarations {
    private static final Logger LOG = LoggerFactory.getLogger(Declarations.class);

    private final Map<String, BufferRole> buffers = new LinkedHashMap<>();
    private final Set<String> computations = new LinkedHashSet<>();
    private final Set<String> constants = new LinkedHashSet<>();

    /**
     * Declare a buffer.
     *
     * @param name The name of the buffer.
     * @param role The role of the buffer.
     * @throws CodegenException If the buffer was already declared.
     */
    public void declareBuffer(String name, BufferRole role) {
        if (buffers.containsKey(name)) {
            throw new CodegenException(DUPLICATE_BUFFER,
                    "Duplicate allocation of buffer " + name + " is not supported.");
        }
        buffers.put(name, role);
        LOG.debug("declared {} buffer {}", role, name);
    }

    /**
     * Declare a computation.
     *
     * @param name The name of the computation.
     * @throws CodegenException If the name was already declared as a computation or constant.
     */
    public void declareComputation(String name) {
        if (computations.contains(name)) {
            throw new CodegenException(DUPLICATE_COMPUTATION,
                    "Duplicate computation " + name + " is not supported.");
        }
        if (constants.contains(name)) {
            throw new CodegenException(DUPLICATE_COMPUTATION,
                    "Computation " + name + " has the same name as a constant.");
        }
        computations.add(name);
        LOG.debug("declared computation {}", name);
    }

    /**
     * Declare a constant.
     *
     * @param name The name of the constant.
     * @throws CodegenException If the name was already declared as a constant or computation.
     */
    public void declareConstant(String name) {
        if (constants.contains(name)) {
            throw new CodegenException(DUPLICATE_CONSTANT,
                    "Redefinition of constant " + name + " is not supported.");
        }
        if (computations.contains(name)) {
            throw new CodegenException(DUPLICATE_CONSTANT,
                    "Constant " + name + " has the same name as a computation.");
        }
        constants.add(name);
        LOG.debug("declared constant {}", name);
    }

    public boolean isBuffer(String name) {
        return buffers.containsKey(name);
    }

    public @Nullable BufferRole bufferRole(String name) {
        return buffers.get(name);
    }

    public boolean isComputation(String name) {
        return computations.contains(name);
    }

    public boolean isConstant(String name) {
        return constants.contains(name);
    }

    /**
     * Get the buffers with a given role, in declaration order.
     *
     * @param role The role.
     * @return The names of the buffers.
     */
    public List<String> buffers(BufferRole role) {
        List<String> ret = new ArrayList<>();
        buffers.forEach((name, r) -> {
            if (r == role) ret.add(name);
        });
        return ret;
    }

    public Set<String> computations() {
        return Collections.unmodifiableSet(computations);
    }

    public Set<String> constants() {
        return Collections.unmodifiableSet(constants);
    }
}
