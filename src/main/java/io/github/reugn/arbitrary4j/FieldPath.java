package io.github.reugn.arbitrary4j;

import java.util.Objects;

/**
 * Dotted location of a field below the requested root type, e.g. {@code Order.customer.email},
 * together with the record that declares the last segment.
 */
final class FieldPath {

    private final Class<?> owner;
    private final String path;

    private FieldPath(Class<?> owner, String path) {
        this.owner = owner;
        this.path = path;
    }

    static FieldPath root(Class<?> type) {
        return new FieldPath(type, type.getSimpleName());
    }

    /**
     * @return the path of a field declared by the current owner
     */
    FieldPath field(String name) {
        return new FieldPath(owner, path + "." + name);
    }

    /**
     * @return the same path, now owned by the nested record stored at it
     */
    FieldPath enter(Class<?> nestedType) {
        return new FieldPath(nestedType, path);
    }

    Class<?> owner() {
        return owner;
    }

    String ownerName() {
        return owner.getSimpleName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldPath other)) return false;
        return owner.equals(other.owner) && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, path);
    }

    @Override
    public String toString() {
        return path;
    }
}
