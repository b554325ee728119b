package io.github.eutro.ir2coli.codegen;

import io.github.eutro.ir2coli.core.ir.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Describes an input or output of a pipeline: its name, element type and
 * the extent of each of its dimensions.
 */
public final class BufferSpec {
    public final String name;
    public final Type type;
    public final List<Integer> extents;

    /**
     * Construct a buffer description.
     *
     * @param name    The name of the function or image.
     * @param type    The element type.
     * @param extents The extent of each dimension.
     * @throws IllegalArgumentException If an extent is negative.
     */
    public BufferSpec(String name, Type type, List<Integer> extents) {
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        for (Integer extent : extents) {
            if (extent < 0) {
                throw new IllegalArgumentException("negative extent " + extent + " for buffer " + name);
            }
        }
        this.extents = Collections.unmodifiableList(new ArrayList<>(extents));
    }

    public static BufferSpec of(String name, Type type, int... extents) {
        List<Integer> list = new ArrayList<>(extents.length);
        for (int extent : extents) list.add(extent);
        return new BufferSpec(name, type, list);
    }

    public int rank() {
        return extents.size();
    }

    @Override
    public String toString() {
        return name + extents + ":" + type;
    }
}
