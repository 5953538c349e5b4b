package io.github.reugn.arbitrary4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied replacement values, keyed by field name.
 *
 * <p>Keys are component names of the generated record, or dotted paths into nested records:
 * <pre>{@code
 * Order order = generator.generate(Order.class, OverrideSet.builder()
 *         .set("quantity", 3)
 *         .set("customer.email", "x@y.com")
 *         .build());
 * }</pre>
 *
 * <p>A path may not be both replaced and descended into: {@code "customer"} and
 * {@code "customer.email"} in the same set are rejected. Values may be {@code null} for
 * reference-typed fields. Instances are immutable.
 */
public final class OverrideSet {

    private static final OverrideSet EMPTY = new OverrideSet(Map.of());

    private final Map<String, Object> values;

    private OverrideSet(Map<String, Object> values) {
        this.values = values;
    }

    public static OverrideSet empty() {
        return EMPTY;
    }

    public static OverrideSet of(String path, Object value) {
        return builder().set(path, value).build();
    }

    public static OverrideSet of(String path1, Object value1, String path2, Object value2) {
        return builder().set(path1, value1).set(path2, value2).build();
    }

    public static OverrideSet of(Map<String, ?> values) {
        Builder builder = builder();
        values.forEach(builder::set);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the overrides in insertion order; unmodifiable
     */
    public Map<String, Object> values() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OverrideSet other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "OverrideSet" + values;
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @param path  a field name or dotted path such as {@code customer.email}
         * @param value the replacement value
         * @return this builder
         * @throws IllegalArgumentException if the path is malformed, repeated, or overlaps another path
         */
        public Builder set(String path, Object value) {
            Objects.requireNonNull(path, "path");
            validatePath(path);
            if (values.containsKey(path)) {
                throw new IllegalArgumentException("Duplicate override for '" + path + "'");
            }
            for (String existing : values.keySet()) {
                if (existing.startsWith(path + ".") || path.startsWith(existing + ".")) {
                    throw new IllegalArgumentException("Override '" + path + "' conflicts with '" + existing + "'");
                }
            }
            values.put(path, value);
            return this;
        }

        public OverrideSet build() {
            return values.isEmpty() ? EMPTY : new OverrideSet(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }

        private static void validatePath(String path) {
            if (path.isBlank()) {
                throw new IllegalArgumentException("Override path must not be blank");
            }
            for (String segment : path.split("\\.", -1)) {
                if (segment.isBlank()) {
                    throw new IllegalArgumentException("Malformed override path '" + path + "'");
                }
            }
        }
    }
}
