package de.dreamcube.treasuremaze.structures;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrderedTreeTest {

    @Test
    void findsInsertedValues() {
        OrderedTree<Integer, String> tree = new OrderedTree<>();
        tree.insert(5, "five");
        tree.insert(2, "two");
        tree.insert(9, "nine");

        assertEquals("two", tree.find(2));
        assertEquals("nine", tree.find(9));
        assertNull(tree.find(7));
        assertTrue(tree.contains(5));
        assertFalse(tree.contains(6));
        assertEquals(3, tree.size());
    }

    @Test
    void insertingExistingKeyReplacesValue() {
        OrderedTree<Integer, String> tree = new OrderedTree<>();
        tree.insert(1, "old");
        tree.insert(1, "new");

        assertEquals(1, tree.size());
        assertEquals("new", tree.find(1));
    }

    @Test
    void removeReturnsValueAndShrinks() {
        OrderedTree<Integer, String> tree = new OrderedTree<>();
        for (int i = 1; i <= 7; i++) {
            tree.insert(i, "v" + i);
        }

        assertEquals("v4", tree.remove(4));
        assertEquals(6, tree.size());
        assertNull(tree.find(4));
        assertEquals(List.of(1, 2, 3, 5, 6, 7), tree.keys());
        assertTrue(tree.isBalanced());
    }

    @Test
    void removingMissingKeyThrows() {
        OrderedTree<Integer, String> tree = new OrderedTree<>();
        tree.insert(1, "one");
        tree.remove(1);

        KeyNotFoundException e = assertThrows(KeyNotFoundException.class, () -> tree.remove(1));
        assertEquals(1, e.getKey());
        assertTrue(tree.isEmpty());
    }

    @Test
    void nullKeyIsRejected() {
        OrderedTree<Integer, String> tree = new OrderedTree<>();
        assertThrows(IllegalArgumentException.class, () -> tree.insert(null, "x"));
        assertThrows(IllegalArgumentException.class, () -> tree.find(null));
    }

    @Test
    void minimumAndMaximumKeys() {
        OrderedTree<String, Integer> tree = new OrderedTree<>();
        assertThrows(NoSuchElementException.class, tree::minimumKey);

        for (String key : List.of("m", "c", "x", "a", "q")) {
            tree.insert(key, key.length());
        }
        assertEquals("a", tree.minimumKey());
        assertEquals("x", tree.maximumKey());
    }

    @Test
    void iteratesValuesInKeyOrder() {
        OrderedTree<Integer, String> tree = new OrderedTree<>();
        tree.insert(30, "c");
        tree.insert(10, "a");
        tree.insert(20, "b");

        List<String> seen = new ArrayList<>();
        for (String value : tree) {
            seen.add(value);
        }
        assertEquals(List.of("a", "b", "c"), seen);
        assertEquals(seen, tree.inOrder());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 7, 100, 1000})
    void sortedInsertionStaysBalanced(int count) {
        OrderedTree<Integer, Integer> tree = new OrderedTree<>();
        for (int i = 0; i < count; i++) {
            tree.insert(i, i);
        }

        assertTrue(tree.isBalanced());
        assertTrue(tree.height() <= maxAvlHeight(count), "height " + tree.height() + " for " + count);
    }

    @Test
    void randomOperationsKeepOrderAndBalance() {
        Random random = new Random(7L);
        OrderedTree<Integer, Integer> tree = new OrderedTree<>();
        TreeMap<Integer, Integer> reference = new TreeMap<>();

        for (int step = 0; step < 5000; step++) {
            int key = random.nextInt(500);
            if (random.nextInt(3) == 0) {
                if (reference.containsKey(key)) {
                    assertEquals(reference.remove(key), tree.remove(key));
                } else {
                    assertThrows(KeyNotFoundException.class, () -> tree.remove(key));
                }
            } else {
                tree.insert(key, step);
                reference.put(key, step);
            }

            if (step % 50 == 0) {
                assertTrue(tree.isBalanced(), "unbalanced at step " + step);
                assertTrue(tree.height() <= maxAvlHeight(tree.size()));
            }
        }

        assertEquals(new ArrayList<>(reference.keySet()), tree.keys());
        assertEquals(new ArrayList<>(reference.values()), tree.inOrder());
        assertEquals(reference.size(), tree.size());
    }

    @Test
    void removingEverythingLeavesEmptyTree() {
        OrderedTree<Integer, Integer> tree = new OrderedTree<>();
        for (int i = 0; i < 64; i++) {
            tree.insert(i, i);
        }
        for (int i = 63; i >= 0; i -= 2) {
            tree.remove(i);
        }
        for (int i = 0; i < 64; i += 2) {
            tree.remove(i);
        }

        assertTrue(tree.isEmpty());
        assertEquals(0, tree.height());
        assertEquals(List.of(), tree.inOrder());
    }

    private static double maxAvlHeight(int n) {
        return 1.44 * (Math.log(n + 2) / Math.log(2));
    }
}
