package bstree;

import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Random insert/remove sequences checked against a TreeMap of per-key lists
 * (oldest entry first) for both tree kinds.
 */
class TreeInvariantsTest {

    private static final int OPS = 400;
    private static final int KEY_RANGE = 40;
    private static final String[] VALUES = {"a", "b", "c"};

    @RepeatedTest(15)
    void unbalancedMatchesModel(RepetitionInfo info) {
        runAgainstModel(TreeKind.UNBALANCED, true, new Random(1000L + info.getCurrentRepetition()));
    }

    @RepeatedTest(15)
    void balancedMatchesModel(RepetitionInfo info) {
        runAgainstModel(TreeKind.BALANCED, true, new Random(2000L + info.getCurrentRepetition()));
    }

    @RepeatedTest(5)
    void uniqueKeysMatchModel(RepetitionInfo info) {
        runAgainstModel(TreeKind.UNBALANCED, false, new Random(3000L + info.getCurrentRepetition()));
        runAgainstModel(TreeKind.BALANCED, false, new Random(4000L + info.getCurrentRepetition()));
    }

    private void runAgainstModel(TreeKind kind, boolean allowDuplicateKeys, Random rnd) {
        AbstractBinaryTree<Integer, String, ?> tree = kind.newTree(allowDuplicateKeys);
        TreeMap<Integer, List<String>> model = new TreeMap<>();

        for (int op = 0; op < OPS; op++) {
            int key = rnd.nextInt(KEY_RANGE);
            String value = VALUES[rnd.nextInt(VALUES.length)];
            List<String> entries = model.computeIfAbsent(key, k -> new ArrayList<>());
            int dice = rnd.nextInt(10);

            if (dice < 6) {
                boolean accepted = allowDuplicateKeys || entries.isEmpty();
                assertEquals(accepted, tree.insert(key, value));
                if (accepted) entries.add(value);
            } else if (dice < 8) {
                boolean all = rnd.nextBoolean();
                int expected = all ? entries.size() : Math.min(1, entries.size());
                assertEquals(expected, tree.remove(key, all));
                if (all) entries.clear();
                else if (!entries.isEmpty()) entries.remove(0);
                assertEquals(entries.size(), tree.count(key));
            } else {
                boolean all = rnd.nextBoolean();
                int matching = Collections.frequency(entries, value);
                int expected = all ? matching : Math.min(1, matching);
                assertEquals(expected, tree.removeValue(key, value, all));
                if (all) entries.removeIf(value::equals);
                else entries.remove(value);
            }
            if (entries.isEmpty()) model.remove(key);

            assertEquals(size(model), tree.count());
            assertEquals(height(tree.root), tree.height());
            if (kind.isBalanced()) {
                AVLTreeTest.assertBalanced(((AVLTree<Integer, String>) tree).root);
            }
        }

        assertContentMatches(tree, model);
        AbstractBinaryTree<Integer, String, ?> copy;
        if (kind.isBalanced()) {
            copy = ((AVLTree<Integer, String>) tree).copy();
        } else {
            copy = ((BSTree<Integer, String>) tree).copy();
        }
        assertContentMatches(copy, model);

        // removing everything twice: the second pass finds nothing
        List<Integer> keys = new ArrayList<>(model.keySet());
        assertEquals(size(model), tree.removeKeys(keys, true));
        assertEquals(0, tree.removeKeys(keys, true));
        assertTrue(tree.isEmpty());
        assertEquals(0, tree.height());
    }

    private static void assertContentMatches(AbstractBinaryTree<Integer, String, ?> tree,
                                             TreeMap<Integer, List<String>> model) {
        List<Entry<Integer, String>> ascending = new ArrayList<>();
        for (Map.Entry<Integer, List<String>> e : model.entrySet()) {
            List<String> values = e.getValue();
            for (int i = values.size() - 1; i >= 0; i--) {
                ascending.add(new Entry<>(e.getKey(), values.get(i)));
            }
            assertEquals(values.get(0), tree.search(e.getKey()).getValue());
            assertEquals(values.get(values.size() - 1), tree.search(e.getKey(), true).getValue());
            assertEquals(values.size(), tree.count(e.getKey()));
            for (String v : VALUES) {
                assertEquals(Collections.frequency(values, v), tree.countValue(e.getKey(), v));
            }
        }
        assertEquals(ascending, tree.sortedEntries(false));
        List<Entry<Integer, String>> descending = new ArrayList<>(ascending);
        Collections.reverse(descending);
        assertEquals(descending, tree.sortedEntries(true));
        assertEquals(ascending.size(), tree.items().size());

        if (model.isEmpty()) {
            assertFalse(tree.minKey().isFound());
        } else {
            List<String> first = model.firstEntry().getValue();
            List<String> last = model.lastEntry().getValue();
            assertEquals(model.firstKey(), tree.minKey().getKey());
            assertEquals(first.get(first.size() - 1), tree.minKey().getValue());
            assertEquals(model.lastKey(), tree.maxKey().getKey());
            assertEquals(last.get(0), tree.maxKey().getValue());
        }
    }

    private static int size(TreeMap<Integer, List<String>> model) {
        int n = 0;
        for (List<String> values : model.values()) {
            n += values.size();
        }
        return n;
    }

    private static int height(Node<?, ?, ?> n) {
        if (n == null) return 0;
        return 1 + Math.max(height(n.left), height(n.right));
    }
}
