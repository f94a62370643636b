package io.difflite.storage;

import java.util.ArrayList;
import java.util.List;

/**
 * Address of a (possibly nested) bucket: the list of bucket names from the root.
 * Nested buckets live in their own key space; they are never mixed with the
 * parent's key/value entries.
 */
record BucketPath(List<String> names) {

    BucketPath {
        if (names == null || names.isEmpty()) throw new IllegalArgumentException("bucket path must not be empty");
        for (String n : names) {
            if (n == null || n.isEmpty()) throw new IllegalArgumentException("bucket name must not be empty");
        }
        names = List.copyOf(names);
    }

    static BucketPath root(String name) {
        return new BucketPath(List.of(name));
    }

    BucketPath child(String name) {
        var out = new ArrayList<>(names);
        out.add(name);
        return new BucketPath(out);
    }

    String leaf() {
        return names.get(names.size() - 1);
    }

    int depth() {
        return names.size();
    }

    /** True for this path itself and every path nested below it. */
    boolean isWithin(BucketPath ancestor) {
        return names.size() >= ancestor.names.size()
                && names.subList(0, ancestor.names.size()).equals(ancestor.names);
    }

    /** True if this path is a direct child of {@code parent}; a null parent means the root. */
    boolean isChildOf(BucketPath parent) {
        if (parent == null) return names.size() == 1;
        return names.size() == parent.names.size() + 1 && isWithin(parent);
    }

    @Override public String toString() {
        return String.join("/", names);
    }
}
