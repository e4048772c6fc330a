package bstree;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import bstree.io.Codec;
import bstree.io.TreeImage;
import bstree.io.TreeSerializer;

/**
 * Height-balanced (AVL) tree. One node per distinct key; further entries
 * with that key go to the node's duplicate list and never change the shape.
 * After every shape change all balance factors are recomputed and the
 * deepest node with |balance factor| &gt; 1 is fixed by a single or double
 * rotation.
 */
public class AVLTree<K extends Comparable<? super K>, V> extends AbstractBinaryTree<K, V, BalancingNode<K, V>> {
    private static final Logger log = LoggerFactory.getLogger(AVLTree.class);

    // result of the last balance factor pass
    private BalancingNode<K, V> imbalanced;
    private BalancingNode<K, V> imbalancedParent;

    public AVLTree(final boolean allowDuplicateKeys) {
        this(allowDuplicateKeys, false);
    }

    AVLTree(final boolean allowDuplicateKeys, final boolean keyOnly) {
        super(allowDuplicateKeys, keyOnly);
    }

    public static <K extends Comparable<? super K>> AVLTree<K, Void> keysOnly(final boolean allowDuplicateKeys) {
        return new AVLTree<>(allowDuplicateKeys, true);
    }

    public static <K extends Comparable<? super K>> AVLTree<K, Void> ofKeys(final Iterable<? extends K> keys,
                                                                        final boolean allowDuplicateKeys) {
        AVLTree<K, Void> tree = keysOnly(allowDuplicateKeys);
        tree.insertKeys(keys);
        return tree;
    }

    public static <K extends Comparable<? super K>, V> AVLTree<K, V> ofEntries(final Iterable<Entry<K, V>> entries,
                                                                           final boolean allowDuplicateKeys) {
        AVLTree<K, V> tree = new AVLTree<>(allowDuplicateKeys);
        tree.insertEntries(entries);
        return tree;
    }

    /** Rebuilds a key/value tree written by {@link #serialize}. */
    public static <K extends Comparable<? super K>, V> AVLTree<K, V> deserialize(final Path path, final Codec<K> keyCodec,
                                                                             final Codec<V> valueCodec) throws IOException {
        TreeImage<K, V> image = new TreeSerializer<>(keyCodec, valueCodec).load(path);
        return ofEntries(image.getItems(), image.allowsDuplicates());
    }

    /** Rebuilds a key-only tree written by {@link #serialize}. */
    public static <K extends Comparable<? super K>> AVLTree<K, Void> deserializeKeys(final Path path,
                                                                                 final Codec<K> keyCodec) throws IOException {
        TreeImage<K, Void> image = new TreeSerializer<K, Void>(keyCodec, null).load(path);
        AVLTree<K, Void> tree = keysOnly(image.allowsDuplicates());
        tree.insertEntries(image.getItems());
        return tree;
    }

    @Override
    public TreeKind kind() {
        return TreeKind.BALANCED;
    }

    @Override
    BalancingNode<K, V> newNode(final K key, final V value) {
        return new BalancingNode<>(key, value);
    }

    @Override
    boolean absorbDuplicate(final BalancingNode<K, V> node, final K key, final V value) {
        return node.addDuplicate(key, value);
    }

    @Override
    void afterShapeChange() {
        balance();
    }

    /** Deep copy built by re-inserting every item into a fresh tree. */
    public AVLTree<K, V> copy() {
        AVLTree<K, V> tree = new AVLTree<>(allowDuplicateKeys, keyOnly);
        tree.insertEntries(items());
        return tree;
    }

    /** Moves the content into a new tree and leaves this one empty. */
    public AVLTree<K, V> move() {
        AVLTree<K, V> tree = new AVLTree<>(allowDuplicateKeys, keyOnly);
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
        BalancingNode<K, V> n = find(key);
        if (n == null) return SearchResult.notFound();
        if (!allowDuplicateKeys || !lastEncounter) return SearchResult.of(n.entry());
        return SearchResult.of(n.lastEntry());
    }

    @Override
    public SearchResult<K, V> searchValue(final K key, final V value, final boolean lastEncounter) {
        BalancingNode<K, V> n = find(key);
        return n == null ? SearchResult.notFound() : n.findByValue(value, lastEncounter);
    }

    @Override
    public int remove(final K key, final boolean all) {
        Objects.requireNonNull(key, "key");

        /** SEARCH **/
        BalancingNode<K, V> p = null;
        BalancingNode<K, V> l = root;
        while (l != null && key.compareTo(l.key) != 0) {
            p = l;
            l = key.compareTo(l.key) < 0 ? l.left : l.right;
        }
        /** END SEARCH **/

        if (l == null) return 0;
        if (all || l.duplicates.isEmpty()) {
            return removeNode(l, p);
        }
        // the oldest duplicate takes over the node, shape is unchanged
        l.promoteFirstDuplicate();
        count--;
        return 1;
    }

    @Override
    public int removeValue(final K key, final V value, final boolean all) {
        Objects.requireNonNull(key, "key");

        /** SEARCH **/
        BalancingNode<K, V> p = null;
        BalancingNode<K, V> l = root;
        while (l != null && key.compareTo(l.key) != 0) {
            p = l;
            l = key.compareTo(l.key) < 0 ? l.left : l.right;
        }
        /** END SEARCH **/

        if (l == null) return 0;
        int removed = 0;
        while (Objects.equals(l.value, value)) {
            if (l.duplicates.isEmpty()) {
                return removed + removeNode(l, p);
            }
            l.promoteFirstDuplicate();
            count--;
            removed++;
            if (!all) return removed;
        }
        int dropped = l.removeDuplicates(value, all);
        count -= dropped;
        return removed + dropped;
    }

    @Override
    public int count(final K key) {
        BalancingNode<K, V> n = find(key);
        return n == null ? 0 : n.entryCount();
    }

    @Override
    public int countValue(final K key, final V value) {
        BalancingNode<K, V> n = find(key);
        return n == null ? 0 : n.countValue(value);
    }

    @Override
    public SearchResult<K, V> minKey() {
        BalancingNode<K, V> n = leftmost();
        return n == null ? SearchResult.notFound() : SearchResult.of(n.lastEntry());
    }

    @Override
    public SearchResult<K, V> maxKey() {
        BalancingNode<K, V> n = rightmost();
        return n == null ? SearchResult.notFound() : SearchResult.of(n.entry());
    }

    //--------------------------------------------------------------------------------
    // PRIVATE METHODS
    // - find
    // - balance
    // - rotateLeft / rotateRight
    //--------------------------------------------------------------------------------

    private BalancingNode<K, V> find(final K key) {
        Objects.requireNonNull(key, "key");
        BalancingNode<K, V> n = root;
        while (n != null) {
            int c = key.compareTo(n.key);
            if (c == 0) return n;
            n = c < 0 ? n.left : n.right;
        }
        return null;
    }

    /**
     * Recomputes the balance factors and rotates at the deepest unbalanced
     * node until none is left. An insertion needs at most one fix; a removal
     * can shorten a subtree enough to need another one higher up.
     */
    private void balance() {
        while (updateBalanceFactors() != null) {
            BalancingNode<K, V> x = imbalanced;
            BalancingNode<K, V> parent = imbalancedParent;
            BalancingNode<K, V> y;
            if (x.balanceFactor > 1) {
                // right heavy; right-left case needs the child turned first
                if (x.right.balanceFactor < 0) {
                    x.right = rotateRight(x.right);
                }
                y = rotateLeft(x);
            } else {
                // left heavy; left-right case needs the child turned first
                if (x.left.balanceFactor > 0) {
                    x.left = rotateLeft(x.left);
                }
                y = rotateRight(x);
            }
            replaceChild(parent, x, y);
        }
    }

    /** Returns the deepest node with |balance factor| &gt; 1, or null. */
    BalancingNode<K, V> updateBalanceFactors() {
        imbalanced = null;
        imbalancedParent = null;
        updateBalanceFactors(root, null);
        return imbalanced;
    }

    /**
     * Post-order pass returning the subtree height. The first violation met is
     * kept: one in the left subtree wins over one in the right subtree, and
     * either wins over the node itself.
     */
    private int updateBalanceFactors(final BalancingNode<K, V> node, final BalancingNode<K, V> parent) {
        if (node == null) return 0;
        int hl = updateBalanceFactors(node.left, node);
        int hr = updateBalanceFactors(node.right, node);
        node.balanceFactor = hr - hl;
        if (imbalanced == null && Math.abs(node.balanceFactor) > 1) {
            imbalanced = node;
            imbalancedParent = parent;
        }
        return 1 + Math.max(hl, hr);
    }

    /**
     * <pre>
     *       x                  y
     *     /   \              /   \
     *    T1    y     ==&gt;    x     T3
     *        /   \        /   \
     *       T2   T3      T1   T2
     * </pre>
     */
    private BalancingNode<K, V> rotateLeft(final BalancingNode<K, V> x) {
        if (log.isTraceEnabled()) {
            log.trace(String.format("rotate left at %s", x.key));
        }
        BalancingNode<K, V> y = x.right;
        x.right = y.left;
        y.left = x;
        return y;
    }

    /** Mirror image of {@link #rotateLeft}. */
    private BalancingNode<K, V> rotateRight(final BalancingNode<K, V> x) {
        if (log.isTraceEnabled()) {
            log.trace(String.format("rotate right at %s", x.key));
        }
        BalancingNode<K, V> y = x.left;
        x.left = y.right;
        y.right = x;
        return y;
    }
}
