package bstree;

import java.util.List;

/**
 * One key position of a tree. A node exclusively owns its two children: a
 * child is referenced from exactly one slot, either a parent's left/right
 * field or the tree root.
 */
public abstract class Node<K extends Comparable<? super K>, V, N extends Node<K, V, N>> {
    K key;
    V value;
    N left;
    N right;

    Node(final K key, final V value) {
        this.key = key;
        this.value = value;
    }

    public K getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    /** The representative entry held in this node. */
    public Entry<K, V> entry() {
        return new Entry<>(key, value);
    }

    /** Number of logical entries this node stands for. */
    public abstract int entryCount();

    /** Appends this node's entries in insertion order. */
    abstract void appendEntries(List<Entry<K, V>> out);

    /** Appends this node's entries in ascending traversal order (newest first). */
    abstract void appendAscending(List<Entry<K, V>> out);

    /**
     * Returns {@code <K = k[, V = v][, BF = b, C = c]>}. The value part is
     * left out in key-only trees, the balance part for unbalanced nodes.
     */
    public String render() {
        StringBuilder sb = new StringBuilder("<K = ").append(key);
        if (value != null) {
            sb.append(", V = ").append(value);
        }
        appendRenderSuffix(sb);
        return sb.append('>').toString();
    }

    void appendRenderSuffix(StringBuilder sb) {
    }

    @Override
    public String toString() {
        return render();
    }
}
