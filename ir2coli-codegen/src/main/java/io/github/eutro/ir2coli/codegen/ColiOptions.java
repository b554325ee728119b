package io.github.eutro.ir2coli.codegen;

import java.util.Objects;

/**
 * Options for generating a COLi program. Instances should be created with {@link #builder()}.
 */
public final class ColiOptions {
    /**
     * The default options.
     */
    public static final ColiOptions DEFAULT = builder().build();

    public final int tabSize;
    public final String objectFileFormat;
    public final int maxDepth;
    public final boolean normalizeNames;

    private ColiOptions(Builder builder) {
        this.tabSize = builder.tabSize;
        this.objectFileFormat = builder.objectFileFormat;
        this.maxDepth = builder.maxDepth;
        this.normalizeNames = builder.normalizeNames;
    }

    /**
     * Start a {@link Builder} with the default options.
     *
     * @return The new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder for {@link ColiOptions}.
     */
    public static class Builder {
        private int tabSize = 4;
        private String objectFileFormat = "build/generated_%s_test.o";
        private int maxDepth = 512;
        private boolean normalizeNames = true;

        /**
         * Set the number of spaces per indentation level. Defaults to 4.
         *
         * @param tabSize The number of spaces.
         * @return This builder, for convenience.
         */
        public Builder setTabSize(int tabSize) {
            if (tabSize < 0) throw new IllegalArgumentException("negative tab size");
            this.tabSize = tabSize;
            return this;
        }

        /**
         * Set the path of the object file the generated program writes, as a format
         * string receiving the pipeline name. Defaults to {@code build/generated_%s_test.o}.
         *
         * @param objectFileFormat The format string.
         * @return This builder, for convenience.
         */
        public Builder setObjectFileFormat(String objectFileFormat) {
            this.objectFileFormat = Objects.requireNonNull(objectFileFormat);
            return this;
        }

        /**
         * Set the deepest nesting of IR nodes that will be translated. Defaults to 512.
         *
         * @param maxDepth The depth.
         * @return This builder, for convenience.
         */
        public Builder setMaxDepth(int maxDepth) {
            if (maxDepth <= 0) throw new IllegalArgumentException("max depth must be positive");
            this.maxDepth = maxDepth;
            return this;
        }

        /**
         * Set whether names in the IR are sanitized before generation. Defaults to true.
         * <p>
         * The bounds of outputs are always bound under sanitized names, so IR generated
         * without normalization must already use sanitized names.
         *
         * @param normalizeNames Whether to sanitize names.
         * @return This builder, for convenience.
         */
        public Builder setNormalizeNames(boolean normalizeNames) {
            this.normalizeNames = normalizeNames;
            return this;
        }

        public ColiOptions build() {
            return new ColiOptions(this);
        }
    }
}
