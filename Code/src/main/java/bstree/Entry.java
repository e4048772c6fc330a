package bstree;

import java.util.Objects;

/**
 * One logical item of a tree: a key and, in key/value trees, its value.
 * The value is {@code null} in key-only trees.
 */
public final class Entry<K, V> {
    private final K key;
    private final V value;

    public Entry(final K key, final V value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = value;
    }

    public static <K> Entry<K, Void> ofKey(final K key) {
        return new Entry<>(key, null);
    }

    public K getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Entry)) return false;
        Entry<?, ?> other = (Entry<?, ?>) o;
        return key.equals(other.key) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "(" + key + ")" : "(" + key + ", " + value + ")";
    }
}
