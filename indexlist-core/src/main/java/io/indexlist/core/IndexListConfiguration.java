package io.indexlist.core;

/**
 * Immutable configuration for an index list.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * IndexListConfiguration config = IndexListConfiguration.builder()
 *     .initialCapacity(4096)
 *     .failFastIteration(false)
 *     .build();
 * </pre>
 *
 * @see io.indexlist.kernel.IndexList
 */
public final class IndexListConfiguration {

    private static final IndexListConfiguration DEFAULTS = builder().build();

    // Slot array sizing (hint only)
    private final int initialCapacity;

    // Borrowing iterator checks for structural mutation
    private final boolean failFastIteration;

    private IndexListConfiguration(Builder builder) {
        this.initialCapacity = builder.initialCapacity;
        this.failFastIteration = builder.failFastIteration;
    }

    /**
     * Create a new builder for IndexListConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the shared default configuration.
     *
     * @return configuration with zero initial capacity and fail-fast iteration
     */
    public static IndexListConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the number of slots reserved up front.
     * Growth beyond this value is always allowed.
     *
     * @return initial slot capacity
     */
    public int initialCapacity() {
        return initialCapacity;
    }

    /**
     * Check if borrowing iterators fail on structural mutation.
     *
     * @return true if iterators throw ConcurrentModificationException (default: true)
     */
    public boolean failFastIteration() {
        return failFastIteration;
    }

    @Override
    public String toString() {
        return "IndexListConfiguration{initialCapacity=" + initialCapacity
                + ", failFastIteration=" + failFastIteration + "}";
    }

    /**
     * Builder for IndexListConfiguration.
     */
    public static class Builder {
        private int initialCapacity = 0;
        private boolean failFastIteration = true;

        private Builder() {
        }

        /**
         * Set the number of slots to reserve when the list is created.
         *
         * @param initialCapacity expected element count (must be non-negative)
         * @return this builder for method chaining
         */
        public Builder initialCapacity(int initialCapacity) {
            this.initialCapacity = initialCapacity;
            return this;
        }

        /**
         * Enable or disable fail-fast borrowing iteration.
         *
         * @param failFastIteration true to detect structural mutation during iteration
         * @return this builder for method chaining
         */
        public Builder failFastIteration(boolean failFastIteration) {
            this.failFastIteration = failFastIteration;
            return this;
        }

        /**
         * Build the immutable IndexListConfiguration.
         *
         * @return a new IndexListConfiguration instance
         * @throws IllegalArgumentException if initialCapacity is negative
         */
        public IndexListConfiguration build() {
            if (initialCapacity < 0) {
                throw new IllegalArgumentException("initialCapacity must be non-negative: " + initialCapacity);
            }
            return new IndexListConfiguration(this);
        }
    }
}
