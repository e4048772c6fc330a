package bstree;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import bstree.io.Codec;
import bstree.io.TreeSerializer;

/**
 * Ordered key/value index shared by the unbalanced and the AVL tree.
 *
 * <p>This class owns the root, the entry count, the duplicate-key policy and
 * a lazily recomputed height. It implements the walk used for insertion, the
 * three-case structural removal, level enumeration and every traversal; the
 * subclasses plug in how equal keys are stored and whether the shape is
 * rebalanced after a change.
 *
 * <p>Not thread-safe. {@link #height()} may refresh the cached height even
 * though it does not change the tree.
 */
public abstract class AbstractBinaryTree<K extends Comparable<? super K>, V, N extends Node<K, V, N>> {
    /** Highest tree still drawn as a diagram by {@link #toString()}. */
    public static final int MAX_DIAGRAM_HEIGHT = 16;

    N root;
    final boolean allowDuplicateKeys;
    final boolean keyOnly;
    int count;
    private int height;
    private boolean heightValid = true;

    AbstractBinaryTree(final boolean allowDuplicateKeys, final boolean keyOnly) {
        this.allowDuplicateKeys = allowDuplicateKeys;
        this.keyOnly = keyOnly;
    }

    //--------------------------------------------------------------------------------
    // STRATEGY HOOKS
    //--------------------------------------------------------------------------------

    public abstract TreeKind kind();

    abstract N newNode(K key, V value);

    /**
     * Called when insertion meets a node with an equal key and duplicates are
     * allowed. Returns true if the entry was stored in that node; false makes
     * the walk continue into the left subtree.
     */
    abstract boolean absorbDuplicate(N node, K key, V value);

    /** Called after every change of shape (new node, structural removal). */
    abstract void afterShapeChange();

    //--------------------------------------------------------------------------------
    // PUBLIC METHODS: properties
    //--------------------------------------------------------------------------------

    public boolean isEmpty() {
        return root == null;
    }

    public boolean allowsDuplicates() {
        return allowDuplicateKeys;
    }

    /** True when the tree stores keys only. */
    public boolean isKeyOnly() {
        return keyOnly;
    }

    /** Total number of logical entries. */
    public int count() {
        return count;
    }

    /** Number of nodes on the longest root-to-leaf path (0 when empty). */
    public int height() {
        if (!heightValid) {
            height = computeHeight();
            heightValid = true;
        }
        return height;
    }

    public void clear() {
        root = null;
        count = 0;
        height = 0;
        heightValid = true;
    }

    //--------------------------------------------------------------------------------
    // PUBLIC METHODS: insertion
    //--------------------------------------------------------------------------------

    /** Inserts a key into a key-only tree. Returns false if the duplicate policy rejects it. */
    public boolean insert(final K key) {
        if (!keyOnly) throw new IllegalStateException("tree stores values, use insert(key, value)");
        return insertEntry(key, null);
    }

    /** Inserts a key/value pair. Returns false if the duplicate policy rejects it. */
    public boolean insert(final K key, final V value) {
        if (keyOnly) throw new IllegalStateException("tree stores keys only, use insert(key)");
        Objects.requireNonNull(value, "value");
        return insertEntry(key, value);
    }

    /** Inserts every key of a key-only tree; returns how many were accepted. */
    public int insertKeys(final Iterable<? extends K> keys) {
        int inserted = 0;
        for (K key : keys) {
            if (insert(key)) inserted++;
        }
        return inserted;
    }

    /** Inserts every entry (values are ignored by key-only trees); returns how many were accepted. */
    public int insertEntries(final Iterable<Entry<K, V>> entries) {
        int inserted = 0;
        for (Entry<K, V> e : entries) {
            boolean ok = keyOnly ? insertEntry(e.getKey(), null) : insert(e.getKey(), e.getValue());
            if (ok) inserted++;
        }
        return inserted;
    }

    private boolean insertEntry(final K key, final V value) {
        Objects.requireNonNull(key, "key");

        /** SEARCH **/
        N p = null;
        N l = root;
        boolean onLeft = false;
        while (l != null) {
            int c = key.compareTo(l.key);
            if (c == 0) {
                if (!allowDuplicateKeys) return false;
                if (absorbDuplicate(l, key, value)) {
                    // entry joined an existing node, shape is unchanged
                    count++;
                    return true;
                }
                c = -1;
            }
            p = l;
            onLeft = c < 0;
            l = onLeft ? l.left : l.right;
        }
        /** END SEARCH **/

        N node = newNode(key, value);
        if (p == null) root = node;
        else if (onLeft) p.left = node;
        else p.right = node;

        count++;
        invalidateHeight();
        afterShapeChange();
        return true;
    }

    //--------------------------------------------------------------------------------
    // PUBLIC METHODS: search, removal, counting (kind specific)
    //--------------------------------------------------------------------------------

    public SearchResult<K, V> search(final K key) {
        return search(key, false);
    }

    /**
     * Looks up {@code key}. With {@code lastEncounter} the most recently
     * inserted entry of that key is returned, otherwise the earliest one.
     */
    public abstract SearchResult<K, V> search(K key, boolean lastEncounter);

    public SearchResult<K, V> searchValue(final K key, final V value) {
        return searchValue(key, value, false);
    }

    /** Like {@link #search(Comparable, boolean)} but the value has to match too. */
    public abstract SearchResult<K, V> searchValue(K key, V value, boolean lastEncounter);

    public int remove(final K key) {
        return remove(key, false);
    }

    /**
     * Removes the earliest entry of {@code key}, or all of them. Returns the
     * number of entries removed.
     */
    public abstract int remove(K key, boolean all);

    public int removeValue(final K key, final V value) {
        return removeValue(key, value, false);
    }

    /** Removes the earliest (or every) entry matching both key and value. */
    public abstract int removeValue(K key, V value, boolean all);

    public int removeKeys(final Iterable<? extends K> keys, final boolean all) {
        int removed = 0;
        for (K key : keys) {
            removed += remove(key, all);
        }
        return removed;
    }

    public int removeEntries(final Iterable<Entry<K, V>> entries, final boolean all) {
        int removed = 0;
        for (Entry<K, V> e : entries) {
            removed += removeValue(e.getKey(), e.getValue(), all);
        }
        return removed;
    }

    /** Number of entries with this key. */
    public abstract int count(K key);

    /** Number of entries with this key and value. */
    public abstract int countValue(K key, V value);

    /** Smallest key; among equal keys the most recently inserted entry. */
    public abstract SearchResult<K, V> minKey();

    /** Largest key; among equal keys the earliest inserted entry. */
    public abstract SearchResult<K, V> maxKey();

    //--------------------------------------------------------------------------------
    // PUBLIC METHODS: traversal and export
    //--------------------------------------------------------------------------------

    /** Every key in order, one per entry. */
    public List<K> sortedKeys(final boolean reverse) {
        List<Entry<K, V>> entries = sortedEntries(reverse);
        List<K> keys = new ArrayList<>(entries.size());
        for (Entry<K, V> e : entries) {
            keys.add(e.getKey());
        }
        return keys;
    }

    /**
     * Every entry in key order. Ascending order lists equal keys newest
     * first; descending order is its exact reverse.
     */
    public List<Entry<K, V>> sortedEntries(final boolean reverse) {
        List<Entry<K, V>> out = ascendingEntries();
        if (reverse) Collections.reverse(out);
        return out;
    }

    /**
     * Every entry in level order, the entries of one node in insertion order.
     * Re-inserting the result into an empty tree rebuilds the same content.
     */
    public List<Entry<K, V>> items() {
        List<Entry<K, V>> out = new ArrayList<>(count);
        for (N n : levelOrderNodes()) {
            n.appendEntries(out);
        }
        return out;
    }

    List<Entry<K, V>> ascendingEntries() {
        List<Entry<K, V>> out = new ArrayList<>(count);
        for (N n : inOrderNodes()) {
            n.appendAscending(out);
        }
        return out;
    }

    /** Nodes in in-order, iteratively since unbalanced trees can be deep. */
    List<N> inOrderNodes() {
        List<N> out = new ArrayList<>();
        ArrayDeque<N> stack = new ArrayDeque<>();
        N n = root;
        while (n != null || !stack.isEmpty()) {
            while (n != null) {
                stack.push(n);
                n = n.left;
            }
            n = stack.pop();
            out.add(n);
            n = n.right;
        }
        return out;
    }

    /** Nodes in breadth-first order without gaps. */
    List<N> levelOrderNodes() {
        List<N> out = new ArrayList<>();
        if (root == null) return out;
        ArrayDeque<N> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            N n = queue.poll();
            out.add(n);
            if (n.left != null) queue.add(n.left);
            if (n.right != null) queue.add(n.right);
        }
        return out;
    }

    /**
     * The {@code 2^level} slots of one level, {@code null} where there is no
     * node, so that the children of slot {@code i} sit at {@code 2i} and
     * {@code 2i + 1} of the next level. {@code previous} may hold the level
     * above; when empty the walk starts from the root.
     */
    List<N> nodesAtLevel(final int level, final List<N> previous) {
        if (level == 0) return Collections.singletonList(root);
        List<N> slots;
        int from;
        if (previous != null && previous.size() == 1 << (level - 1)) {
            slots = previous;
            from = level;
        } else {
            slots = Collections.singletonList(root);
            from = 1;
        }
        for (int i = from; i <= level; i++) {
            List<N> next = new ArrayList<>(slots.size() * 2);
            for (N n : slots) {
                next.add(n == null ? null : n.left);
                next.add(n == null ? null : n.right);
            }
            slots = next;
        }
        return slots;
    }

    //--------------------------------------------------------------------------------
    // PUBLIC METHODS: move, persistence
    //--------------------------------------------------------------------------------

    /** Hands root, count and cached height to {@code target} and leaves this tree empty. */
    void transferTo(final AbstractBinaryTree<K, V, N> target) {
        target.root = root;
        target.count = count;
        target.height = height;
        target.heightValid = heightValid;
        clear();
    }

    /**
     * Writes the tree to {@code path}. Returns false if the file could not be
     * written; with {@code deleteOnFailure} a partially written file is removed.
     */
    public boolean serialize(final Path path, final Codec<K> keyCodec, final Codec<V> valueCodec,
                             final boolean deleteOnFailure) {
        return new TreeSerializer<>(keyCodec, keyOnly ? null : valueCodec).save(this, path, deleteOnFailure);
    }

    /** Key-only variant of {@link #serialize(Path, Codec, Codec, boolean)}. */
    public boolean serialize(final Path path, final Codec<K> keyCodec, final boolean deleteOnFailure) {
        return serialize(path, keyCodec, null, deleteOnFailure);
    }

    //--------------------------------------------------------------------------------
    // PRIVATE METHODS
    // - structural removal
    // - height
    //--------------------------------------------------------------------------------

    final void invalidateHeight() {
        heightValid = false;
    }

    /**
     * Unlinks {@code node} (child of {@code parent}, or the root) with all its
     * entries and returns how many entries were dropped.
     */
    final int removeNode(final N node, final N parent) {
        replaceChild(parent, node, detach(node));

        int removed = node.entryCount();
        count -= removed;
        invalidateHeight();
        afterShapeChange();
        return removed;
    }

    /** Points the slot holding {@code child} (under {@code parent}, or the root) at {@code replacement}. */
    final void replaceChild(final N parent, final N child, final N replacement) {
        if (parent == null) root = replacement;
        else if (parent.left == child) parent.left = replacement;
        else parent.right = replacement;
    }

    /**
     * Returns the subtree that takes the place of {@code node}: nothing for a
     * leaf, the only child, or the in-order successor (leftmost node of the
     * right subtree) carrying both original children.
     */
    private N detach(final N node) {
        N replacement;
        if (node.left != null && node.right != null) {
            N successorParent = null;
            N successor = node.right;
            while (successor.left != null) {
                successorParent = successor;
                successor = successor.left;
            }
            if (successorParent != null) {
                successorParent.left = successor.right;
                successor.right = node.right;
            }
            successor.left = node.left;
            replacement = successor;
        } else {
            replacement = node.left != null ? node.left : node.right;
        }
        node.left = null;
        node.right = null;
        return replacement;
    }

    private int computeHeight() {
        if (root == null) return 0;
        int levels = 0;
        ArrayDeque<N> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            levels++;
            for (int i = queue.size(); i > 0; i--) {
                N n = queue.poll();
                if (n.left != null) queue.add(n.left);
                if (n.right != null) queue.add(n.right);
            }
        }
        return levels;
    }

    final N leftmost() {
        N n = root;
        while (n != null && n.left != null) n = n.left;
        return n;
    }

    final N rightmost() {
        N n = root;
        while (n != null && n.right != null) n = n.right;
        return n;
    }

    //--------------------------------------------------------------------------------
    // RENDERING
    //--------------------------------------------------------------------------------

    /**
     * ASCII diagram, one line per level, every node right-aligned in a cell as
     * wide as the widest rendered node. The last level alone has
     * {@code 2^(height-1)} cells, so trees higher than
     * {@link #MAX_DIAGRAM_HEIGHT} are listed level by level without gaps instead.
     */
    @Override
    public String toString() {
        if (root == null) {
            return "Empty-Tree<Size = 0, Height = 0>";
        }
        int h = height();
        StringBuilder sb = new StringBuilder("Tree<Size = ").append(count)
                .append(", Height = ").append(h).append(">:\n");
        if (h > MAX_DIAGRAM_HEIGHT) {
            appendLevelListing(sb);
            return sb.toString();
        }
        int width = 0;
        for (N n : levelOrderNodes()) {
            width = Math.max(width, n.render().length());
        }
        long[][] spacing = paddingAndInterSpacing(h);
        List<N> nodes = null;
        for (int level = 0; level < h; level++) {
            nodes = nodesAtLevel(level, nodes);
            sb.append(levelString(nodes, Math.toIntExact(spacing[level][0] * width),
                    Math.toIntExact(spacing[level][1] * width), width)).append('\n');
        }
        return sb.toString();
    }

    /** One line per level, the nodes present separated by a single space. */
    private void appendLevelListing(final StringBuilder sb) {
        ArrayDeque<N> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            StringBuilder line = new StringBuilder();
            for (int i = queue.size(); i > 0; i--) {
                N n = queue.poll();
                if (line.length() > 0) line.append(' ');
                line.append(n.render());
                if (n.left != null) queue.add(n.left);
                if (n.right != null) queue.add(n.right);
            }
            sb.append(line).append('\n');
        }
    }

    /** Per level, in cell widths: the leading padding and the gap between two cells. */
    private static long[][] paddingAndInterSpacing(final int height) {
        long[][] spacing = new long[height][2];
        spacing[height - 1][0] = 0;
        spacing[height - 1][1] = 1;
        for (int level = height - 2; level >= 0; level--) {
            long padding = spacing[level + 1][0] + (spacing[level + 1][1] - 1) / 2 + 1;
            long inter = 0;
            if (level > 0) {
                inter = ((1L << height) - (1L << level) - (2 * padding + 1)) / ((1L << level) - 1);
            }
            spacing[level][0] = padding;
            spacing[level][1] = Math.max(0, inter);
        }
        return spacing;
    }

    private static String levelString(final List<? extends Node<?, ?, ?>> nodes, final int padding,
                                      final int inter, final int width) {
        StringBuilder sb = new StringBuilder(" ".repeat(padding));
        for (Node<?, ?, ?> n : nodes) {
            String cell = n == null ? "" : n.render();
            sb.append(" ".repeat(width - cell.length())).append(cell).append(" ".repeat(inter));
        }
        int end = sb.length();
        while (end > 0 && sb.charAt(end - 1) == ' ') end--;
        sb.setLength(end);
        return sb.toString();
    }
}
