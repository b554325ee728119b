package io.github.eutro.ir2coli.codegen;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * A lexically scoped table of names to values.
 * <p>
 * Pushing a name shadows any existing binding of it until the matching pop.
 *
 * @param <T> The type of the bound values.
 */
public class Scope<T> {
    private final Map<String, Deque<T>> table = new LinkedHashMap<>();

    /**
     * Bind a name, shadowing any existing binding.
     *
     * @param name  The name.
     * @param value The value.
     */
    public void push(@NotNull String name, @NotNull T value) {
        table.computeIfAbsent(name, $ -> new ArrayDeque<>()).push(Objects.requireNonNull(value));
    }

    /**
     * Remove the innermost binding of a name.
     *
     * @param name The name.
     * @throws IllegalStateException If the name is not bound.
     */
    public void pop(String name) {
        Deque<T> stack = table.get(name);
        if (stack == null) {
            throw new IllegalStateException("name '" + name + "' popped from scope without being pushed");
        }
        stack.pop();
        if (stack.isEmpty()) table.remove(name);
    }

    /**
     * Get the innermost binding of a name.
     *
     * @param name The name.
     * @return The bound value.
     * @throws IllegalStateException If the name is not bound.
     */
    public @NotNull T get(String name) {
        Deque<T> stack = table.get(name);
        if (stack == null) {
            throw new IllegalStateException("name '" + name + "' not found in scope");
        }
        return stack.peek();
    }

    /**
     * Returns whether a name is bound.
     *
     * @param name The name.
     * @return Whether it is bound.
     */
    public boolean contains(String name) {
        return table.containsKey(name);
    }

    /**
     * Get the innermost binding of every bound name, in the order the names were first bound.
     *
     * @return A snapshot of the visible bindings.
     */
    public Map<String, T> bindings() {
        Map<String, T> ret = new LinkedHashMap<>();
        table.forEach((name, stack) -> ret.put(name, stack.peek()));
        return ret;
    }

    public boolean isEmpty() {
        return table.isEmpty();
    }
}
