package bstree;

import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;

/**
 * Node of the AVL tree. Rotations may move a node's descendants anywhere, so
 * entries sharing this node's key are not stored as extra nodes but appended
 * to {@link #duplicates}, oldest first.
 */
public final class BalancingNode<K extends Comparable<? super K>, V> extends Node<K, V, BalancingNode<K, V>> {
    int balanceFactor;
    final LinkedList<Entry<K, V>> duplicates = new LinkedList<>();

    BalancingNode(final K key, final V value) {
        super(key, value);
    }

    public int getBalanceFactor() {
        return balanceFactor;
    }

    /**
     * Appends {@code (key, value)} to the duplicates iff {@code key} equals
     * this node's key.
     */
    public boolean addDuplicate(final K key, final V value) {
        if (this.key.compareTo(key) != 0) {
            return false;
        }
        duplicates.addLast(new Entry<>(key, value));
        return true;
    }

    /** Most recently added duplicate, or this node's own entry if there is none. */
    public Entry<K, V> lastEntry() {
        return duplicates.isEmpty() ? entry() : duplicates.getLast();
    }

    /**
     * Looks for an entry of this node whose value equals {@code value}. The
     * first match scans the own entry then the duplicates in order; the last
     * match scans the duplicates backwards and falls back to the own entry.
     */
    public SearchResult<K, V> findByValue(final V value, final boolean lastEncounter) {
        if (lastEncounter) {
            Iterator<Entry<K, V>> it = duplicates.descendingIterator();
            while (it.hasNext()) {
                Entry<K, V> e = it.next();
                if (Objects.equals(e.getValue(), value)) return SearchResult.of(e);
            }
            return Objects.equals(this.value, value) ? SearchResult.of(entry()) : SearchResult.notFound();
        }
        if (Objects.equals(this.value, value)) return SearchResult.of(entry());
        for (Entry<K, V> e : duplicates) {
            if (Objects.equals(e.getValue(), value)) return SearchResult.of(e);
        }
        return SearchResult.notFound();
    }

    @Override
    public int entryCount() {
        return 1 + duplicates.size();
    }

    /** Number of entries (own and duplicates) holding {@code value}. */
    public int countValue(final V value) {
        int c = Objects.equals(this.value, value) ? 1 : 0;
        for (Entry<K, V> e : duplicates) {
            if (Objects.equals(e.getValue(), value)) c++;
        }
        return c;
    }

    /** Drops the own entry by moving the oldest duplicate into its place. */
    void promoteFirstDuplicate() {
        Entry<K, V> first = duplicates.removeFirst();
        key = first.getKey();
        value = first.getValue();
    }

    /** Removes the first (or every) duplicate holding {@code value}; the own entry is untouched. */
    int removeDuplicates(final V value, final boolean all) {
        int removed = 0;
        Iterator<Entry<K, V>> it = duplicates.iterator();
        while (it.hasNext()) {
            if (Objects.equals(it.next().getValue(), value)) {
                it.remove();
                removed++;
                if (!all) break;
            }
        }
        return removed;
    }

    @Override
    void appendEntries(List<Entry<K, V>> out) {
        out.add(entry());
        out.addAll(duplicates);
    }

    @Override
    void appendAscending(List<Entry<K, V>> out) {
        Iterator<Entry<K, V>> it = duplicates.descendingIterator();
        while (it.hasNext()) {
            out.add(it.next());
        }
        out.add(entry());
    }

    @Override
    void appendRenderSuffix(StringBuilder sb) {
        sb.append(", BF = ").append(balanceFactor).append(", C = ").append(entryCount());
    }
}
