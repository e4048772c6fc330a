package bstree.io;

import java.util.Collections;
import java.util.List;

import bstree.Entry;

/**
 * Content of a tree file: the duplicate-key policy and the items in the
 * order they were written.
 */
public final class TreeImage<K, V> {
    private final boolean allowDuplicateKeys;
    private final List<Entry<K, V>> items;

    public TreeImage(final boolean allowDuplicateKeys, final List<Entry<K, V>> items) {
        this.allowDuplicateKeys = allowDuplicateKeys;
        this.items = Collections.unmodifiableList(items);
    }

    public boolean allowsDuplicates() {
        return allowDuplicateKeys;
    }

    public List<Entry<K, V>> getItems() {
        return items;
    }
}
