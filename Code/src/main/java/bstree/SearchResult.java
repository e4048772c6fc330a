package bstree;

import java.util.Objects;

/**
 * Outcome of a search or of a min/max query. A negative result carries
 * {@code null} key and value.
 */
public final class SearchResult<K, V> {
    private final boolean found;
    private final K key;
    private final V value;

    private SearchResult(final boolean found, final K key, final V value) {
        this.found = found;
        this.key = key;
        this.value = value;
    }

    static <K, V> SearchResult<K, V> of(final Entry<K, V> entry) {
        return new SearchResult<>(true, entry.getKey(), entry.getValue());
    }

    public static <K, V> SearchResult<K, V> notFound() {
        return new SearchResult<>(false, null, null);
    }

    public boolean isFound() {
        return found;
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
        if (!(o instanceof SearchResult)) return false;
        SearchResult<?, ?> other = (SearchResult<?, ?>) o;
        return found == other.found && Objects.equals(key, other.key) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(found, key, value);
    }

    @Override
    public String toString() {
        return found ? "Found" + new Entry<>(key, value) : "NotFound";
    }
}
