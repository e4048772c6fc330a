package bstree;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;

import bstree.io.Codec;
import bstree.io.TreeImage;
import bstree.io.TreeSerializer;

/**
 * Unbalanced binary search tree. Each inserted entry gets its own node; an
 * entry whose key is already present is placed in the left subtree of the
 * equal node, so newer duplicates sort before older ones.
 */
public class BSTree<K extends Comparable<? super K>, V> extends AbstractBinaryTree<K, V, SimpleNode<K, V>> {

    private static final Comparator<Match<?, ?>> OLDEST_FIRST = Comparator.comparingLong(m -> m.node.stamp);

    private long nextStamp;

    public BSTree(final boolean allowDuplicateKeys) {
        this(allowDuplicateKeys, false);
    }

    BSTree(final boolean allowDuplicateKeys, final boolean keyOnly) {
        super(allowDuplicateKeys, keyOnly);
    }

    public static <K extends Comparable<? super K>> BSTree<K, Void> keysOnly(final boolean allowDuplicateKeys) {
        return new BSTree<>(allowDuplicateKeys, true);
    }

    public static <K extends Comparable<? super K>> BSTree<K, Void> ofKeys(final Iterable<? extends K> keys,
                                                                       final boolean allowDuplicateKeys) {
        BSTree<K, Void> tree = keysOnly(allowDuplicateKeys);
        tree.insertKeys(keys);
        return tree;
    }

    public static <K extends Comparable<? super K>, V> BSTree<K, V> ofEntries(final Iterable<Entry<K, V>> entries,
                                                                          final boolean allowDuplicateKeys) {
        BSTree<K, V> tree = new BSTree<>(allowDuplicateKeys);
        tree.insertEntries(entries);
        return tree;
    }

    /** Rebuilds a key/value tree written by {@link #serialize}. */
    public static <K extends Comparable<? super K>, V> BSTree<K, V> deserialize(final Path path, final Codec<K> keyCodec,
                                                                            final Codec<V> valueCodec) throws IOException {
        TreeImage<K, V> image = new TreeSerializer<>(keyCodec, valueCodec).load(path);
        return ofEntries(image.getItems(), image.allowsDuplicates());
    }

    /** Rebuilds a key-only tree written by {@link #serialize}. */
    public static <K extends Comparable<? super K>> BSTree<K, Void> deserializeKeys(final Path path,
                                                                                final Codec<K> keyCodec) throws IOException {
        TreeImage<K, Void> image = new TreeSerializer<K, Void>(keyCodec, null).load(path);
        BSTree<K, Void> tree = keysOnly(image.allowsDuplicates());
        tree.insertEntries(image.getItems());
        return tree;
    }

    @Override
    public TreeKind kind() {
        return TreeKind.UNBALANCED;
    }

    @Override
    SimpleNode<K, V> newNode(final K key, final V value) {
        return new SimpleNode<>(key, value, nextStamp++);
    }

    @Override
    boolean absorbDuplicate(final SimpleNode<K, V> node, final K key, final V value) {
        return false;
    }

    @Override
    void afterShapeChange() {
    }

    /** Deep copy built by re-inserting every item into a fresh tree. */
    public BSTree<K, V> copy() {
        BSTree<K, V> tree = new BSTree<>(allowDuplicateKeys, keyOnly);
        tree.insertEntries(items());
        return tree;
    }

    /** Moves the content into a new tree and leaves this one empty. */
    public BSTree<K, V> move() {
        BSTree<K, V> tree = new BSTree<>(allowDuplicateKeys, keyOnly);
        tree.nextStamp = nextStamp;
        transferTo(tree);
        return tree;
    }

    //--------------------------------------------------------------------------------
    // PUBLIC METHODS:
    // - search : SearchResult
    // - remove : int
    // - count  : int
    //--------------------------------------------------------------------------------

    @Override
    public SearchResult<K, V> search(final K key, final boolean lastEncounter) {
        List<Match<K, V>> matches = matches(key);
        if (matches.isEmpty()) return SearchResult.notFound();
        Match<K, V> m = lastEncounter ? matches.get(matches.size() - 1) : matches.get(0);
        return SearchResult.of(m.node.entry());
    }

    @Override
    public SearchResult<K, V> searchValue(final K key, final V value, final boolean lastEncounter) {
        List<Match<K, V>> matches = withValue(matches(key), value);
        if (matches.isEmpty()) return SearchResult.notFound();
        Match<K, V> m = lastEncounter ? matches.get(matches.size() - 1) : matches.get(0);
        return SearchResult.of(m.node.entry());
    }

    @Override
    public int remove(final K key, final boolean all) {
        int removed = 0;
        while (true) {
            List<Match<K, V>> matches = matches(key);
            if (matches.isEmpty()) break;
            Match<K, V> oldest = matches.get(0);
            removed += removeNode(oldest.node, oldest.parent);
            if (!all) break;
        }
        return removed;
    }

    @Override
    public int removeValue(final K key, final V value, final boolean all) {
        int removed = 0;
        while (true) {
            List<Match<K, V>> matches = withValue(matches(key), value);
            if (matches.isEmpty()) break;
            Match<K, V> oldest = matches.get(0);
            removed += removeNode(oldest.node, oldest.parent);
            if (!all) break;
        }
        return removed;
    }

    @Override
    public int count(final K key) {
        return matches(key).size();
    }

    @Override
    public int countValue(final K key, final V value) {
        return withValue(matches(key), value).size();
    }

    @Override
    public SearchResult<K, V> minKey() {
        SimpleNode<K, V> n = leftmost();
        return n == null ? SearchResult.notFound() : search(n.key, true);
    }

    @Override
    public SearchResult<K, V> maxKey() {
        SimpleNode<K, V> n = rightmost();
        return n == null ? SearchResult.notFound() : search(n.key, false);
    }

    /**
     * Level order, except that with duplicates allowed all entries of one key
     * are emitted together, oldest first, where the key first shows up.
     */
    @Override
    public List<Entry<K, V>> items() {
        if (!allowDuplicateKeys) return super.items();

        List<SimpleNode<K, V>> nodes = levelOrderNodes();
        TreeMap<K, List<SimpleNode<K, V>>> groups = new TreeMap<>();
        for (SimpleNode<K, V> n : nodes) {
            groups.computeIfAbsent(n.key, k -> new ArrayList<>()).add(n);
        }
        List<Entry<K, V>> out = new ArrayList<>(count);
        for (SimpleNode<K, V> n : nodes) {
            List<SimpleNode<K, V>> group = groups.remove(n.key);
            if (group == null) continue;
            group.sort(Comparator.comparingLong(g -> g.stamp));
            for (SimpleNode<K, V> g : group) {
                out.add(g.entry());
            }
        }
        return out;
    }

    /** In-order, with every run of equal keys put newest first. */
    @Override
    List<Entry<K, V>> ascendingEntries() {
        List<SimpleNode<K, V>> nodes = inOrderNodes();
        List<Entry<K, V>> out = new ArrayList<>(nodes.size());
        int i = 0;
        while (i < nodes.size()) {
            int j = i + 1;
            while (j < nodes.size() && nodes.get(j).key.compareTo(nodes.get(i).key) == 0) j++;
            List<SimpleNode<K, V>> run = new ArrayList<>(nodes.subList(i, j));
            if (run.size() > 1) run.sort(Comparator.comparingLong((SimpleNode<K, V> n) -> n.stamp).reversed());
            for (SimpleNode<K, V> n : run) {
                out.add(n.entry());
            }
            i = j;
        }
        return out;
    }

    //--------------------------------------------------------------------------------
    // PRIVATE METHODS
    //--------------------------------------------------------------------------------

    private static final class Match<K extends Comparable<? super K>, V> {
        final SimpleNode<K, V> node;
        final SimpleNode<K, V> parent;

        Match(final SimpleNode<K, V> node, final SimpleNode<K, V> parent) {
            this.node = node;
            this.parent = parent;
        }
    }

    /**
     * Every node holding {@code key}, with its parent, oldest first. Equal
     * keys normally sit in the left subtree of an equal node, but a two-child
     * removal can lift a newer duplicate above older ones, so both sides of an
     * equal node are searched. Without duplicates the walk stops at the first hit.
     */
    private List<Match<K, V>> matches(final K key) {
        Objects.requireNonNull(key, "key");
        List<Match<K, V>> found = new ArrayList<>();
        ArrayDeque<Match<K, V>> pending = new ArrayDeque<>();
        if (root != null) pending.push(new Match<>(root, null));
        while (!pending.isEmpty()) {
            Match<K, V> m = pending.pop();
            SimpleNode<K, V> n = m.node;
            int c = key.compareTo(n.key);
            if (c == 0) {
                found.add(m);
                if (!allowDuplicateKeys) break;
            }
            if (c <= 0 && n.left != null) pending.push(new Match<>(n.left, n));
            if (c >= 0 && n.right != null) pending.push(new Match<>(n.right, n));
        }
        found.sort(OLDEST_FIRST);
        return found;
    }

    private static <K extends Comparable<? super K>, V> List<Match<K, V>> withValue(final List<Match<K, V>> matches,
                                                                                final V value) {
        List<Match<K, V>> out = new ArrayList<>(matches.size());
        for (Match<K, V> m : matches) {
            if (Objects.equals(m.node.value, value)) out.add(m);
        }
        return out;
    }
}
