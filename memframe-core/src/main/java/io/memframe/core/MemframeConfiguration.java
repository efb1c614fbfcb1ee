package io.memframe.core;

import java.util.Objects;

/**
 * Immutable configuration for table construction.
 * <p>
 * Use the builder to create custom configurations:
 * <pre>
 * MemframeConfiguration config = MemframeConfiguration.builder()
 *     .defaultColumnType(ColumnType.LONG)
 *     .generatedNamePrefix("col")
 *     .build();
 * </pre>
 * <p>
 * A table keeps the configuration it was built with, and tables derived from it
 * (copies, selections, concatenations) inherit it.
 */
public final class MemframeConfiguration {

    private static final MemframeConfiguration DEFAULTS = builder().build();

    // Element type for all-NA columns created without an explicit type
    private final ColumnType defaultColumnType;

    // Naming
    private final String generatedNamePrefix;
    private final String uniqueNameSeparator;

    // head()/tail()
    private final int headSize;

    private MemframeConfiguration(Builder builder) {
        this.defaultColumnType = builder.defaultColumnType;
        this.generatedNamePrefix = builder.generatedNamePrefix;
        this.uniqueNameSeparator = builder.uniqueNameSeparator;
        this.headSize = builder.headSize;
    }

    /**
     * Create a new builder for MemframeConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shared configuration with every option at its default.
     */
    public static MemframeConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the element type used for all-NA columns that have no type of their own,
     * such as an NA scalar assigned to a new column.
     *
     * @return the default column type (default: DOUBLE)
     */
    public ColumnType defaultColumnType() {
        return defaultColumnType;
    }

    /**
     * Get the prefix of generated column names ({@code x1, x2, ...}).
     *
     * @return the prefix (default: "x")
     */
    public String generatedNamePrefix() {
        return generatedNamePrefix;
    }

    /**
     * Get the separator placed between a duplicated name and its numeric suffix.
     *
     * @return the separator (default: "_")
     */
    public String uniqueNameSeparator() {
        return uniqueNameSeparator;
    }

    /**
     * Get the number of rows returned by {@code head()} and {@code tail()}.
     *
     * @return head size (default: 6)
     */
    public int headSize() {
        return headSize;
    }

    /**
     * Generated name for the column at the given 0-based position.
     */
    public String generatedName(int position) {
        return generatedNamePrefix + (position + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MemframeConfiguration other)) {
            return false;
        }
        return defaultColumnType == other.defaultColumnType
                && headSize == other.headSize
                && generatedNamePrefix.equals(other.generatedNamePrefix)
                && uniqueNameSeparator.equals(other.uniqueNameSeparator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(defaultColumnType, generatedNamePrefix, uniqueNameSeparator, headSize);
    }

    /**
     * Builder for MemframeConfiguration.
     */
    public static class Builder {
        private ColumnType defaultColumnType = ColumnType.DOUBLE;
        private String generatedNamePrefix = "x";
        private String uniqueNameSeparator = "_";
        private int headSize = 6;

        private Builder() {
        }

        /**
         * Set the element type of all-NA columns created without a type.
         *
         * @param defaultColumnType the column type
         * @return this builder for method chaining
         */
        public Builder defaultColumnType(ColumnType defaultColumnType) {
            this.defaultColumnType = Objects.requireNonNull(defaultColumnType, "defaultColumnType");
            return this;
        }

        /**
         * Set the prefix of generated column names.
         *
         * @param generatedNamePrefix non-empty prefix
         * @return this builder for method chaining
         */
        public Builder generatedNamePrefix(String generatedNamePrefix) {
            if (generatedNamePrefix == null || generatedNamePrefix.isEmpty()) {
                throw new IllegalArgumentException("generatedNamePrefix must be non-empty");
            }
            this.generatedNamePrefix = generatedNamePrefix;
            return this;
        }

        public Builder uniqueNameSeparator(String uniqueNameSeparator) {
            this.uniqueNameSeparator = Objects.requireNonNull(uniqueNameSeparator, "uniqueNameSeparator");
            return this;
        }

        public Builder headSize(int headSize) {
            if (headSize < 0) {
                throw new IllegalArgumentException("headSize must be non-negative: " + headSize);
            }
            this.headSize = headSize;
            return this;
        }

        /**
         * Build the immutable MemframeConfiguration.
         *
         * @return a new MemframeConfiguration instance
         */
        public MemframeConfiguration build() {
            return new MemframeConfiguration(this);
        }
    }
}
