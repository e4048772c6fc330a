package bstree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    @Test
    void render_showsValueOnlyWhenPresent() {
        assertEquals("<K = 4, V = pear>", new SimpleNode<>(4, "pear", 0).render());
        assertEquals("<K = 4>", new SimpleNode<Integer, Void>(4, null, 0).render());
        assertEquals("<K = 4, BF = 0, C = 1>", new BalancingNode<Integer, Void>(4, null).render());
    }

    @Test
    void addDuplicate_acceptsOnlyEqualKeys() {
        BalancingNode<Integer, String> n = new BalancingNode<>(40, "a");
        assertTrue(n.addDuplicate(40, "b"));
        assertTrue(n.addDuplicate(40, "c"));
        assertFalse(n.addDuplicate(41, "d"));

        assertEquals(3, n.entryCount());
        assertEquals("<K = 40, V = a, BF = 0, C = 3>", n.render());
        assertEquals(new Entry<>(40, "a"), n.entry());
        assertEquals(new Entry<>(40, "c"), n.lastEntry());
    }

    @Test
    void findByValue_scansInBothDirections() {
        BalancingNode<Integer, String> n = new BalancingNode<>(1, "x");
        n.addDuplicate(1, "y");
        n.addDuplicate(1, "x");

        assertEquals("x", n.findByValue("x", false).getValue());
        assertEquals("x", n.findByValue("x", true).getValue());
        assertEquals("y", n.findByValue("y", true).getValue());
        assertFalse(n.findByValue("z", false).isFound());
        assertFalse(n.findByValue("z", true).isFound());
        assertEquals(2, n.countValue("x"));
        assertEquals(0, n.countValue("z"));
    }

    @Test
    void promoteAndRemoveDuplicates_keepInsertionOrder() {
        BalancingNode<Integer, String> n = new BalancingNode<>(1, "a");
        n.addDuplicate(1, "b");
        n.addDuplicate(1, "c");
        n.addDuplicate(1, "b");

        assertEquals(1, n.removeDuplicates("b", false));
        List<Entry<Integer, String>> items = new ArrayList<>();
        n.appendEntries(items);
        assertEquals(List.of(new Entry<>(1, "a"), new Entry<>(1, "c"), new Entry<>(1, "b")), items);

        n.promoteFirstDuplicate();
        assertEquals("c", n.getValue());
        assertEquals(2, n.entryCount());

        List<Entry<Integer, String>> ascending = new ArrayList<>();
        n.appendAscending(ascending);
        assertEquals(List.of(new Entry<>(1, "b"), new Entry<>(1, "c")), ascending);
    }

    @Test
    void searchResult_notFoundCarriesNulls() {
        SearchResult<Integer, String> r = SearchResult.notFound();
        assertFalse(r.isFound());
        assertNull(r.getKey());
        assertNull(r.getValue());
        assertEquals("NotFound", r.toString());
        assertEquals(r, SearchResult.<String, Integer>notFound());
        assertEquals("Found(3, c)", SearchResult.of(new Entry<>(3, "c")).toString());
    }
}
