package bstree;

import java.util.List;

/**
 * Node of the unbalanced tree. Every inserted entry gets its own node; the
 * stamp records insertion order so that same-key nodes can be told apart
 * chronologically wherever removals have moved them.
 */
public final class SimpleNode<K extends Comparable<? super K>, V> extends Node<K, V, SimpleNode<K, V>> {
    final long stamp;

    SimpleNode(final K key, final V value, final long stamp) {
        super(key, value);
        this.stamp = stamp;
    }

    @Override
    public int entryCount() {
        return 1;
    }

    @Override
    void appendEntries(List<Entry<K, V>> out) {
        out.add(entry());
    }

    @Override
    void appendAscending(List<Entry<K, V>> out) {
        out.add(entry());
    }
}
