package de.dreamcube.treasuremaze.structures;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Self-balancing binary search tree (AVL) mapping comparable keys to values.
 *
 * <p>After every insertion and removal the tree is rebalanced with single or double rotations,
 * so that for every node the heights of its two subtrees differ by at most one. This bounds the
 * tree height by roughly {@code 1.44 * log2(n + 2)} and keeps all keyed operations at
 * {@code O(log n)}.</p>
 *
 * <p>Iteration yields values in ascending key order.</p>
 *
 * <p>Thread safety: This class is not thread-safe. External synchronization is required
 * if instances are shared between threads.</p>
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class OrderedTree<K extends Comparable<? super K>, V> implements Iterable<V> {

    private Node<K, V> root;
    private int size;

    /**
     * Inserts a value under the given key, replacing any value already stored for that key.
     *
     * @param key the key, must not be null
     * @param value the value to store
     */
    public void insert(@NotNull K key, V value) {
        requireKey(key);
        root = insert(root, key, value);
    }

    /**
     * Removes the entry stored under the given key.
     *
     * @param key the key to remove
     * @return the value that was stored under the key
     * @throws KeyNotFoundException if no entry exists for the key
     */
    public V remove(@NotNull K key) {
        requireKey(key);
        Node<K, V> node = findNode(key);
        if (node == null) {
            throw new KeyNotFoundException(key);
        }
        V removed = node.value;
        root = remove(root, key);
        return removed;
    }

    /**
     * Looks up the value stored under the given key.
     *
     * @param key the key to look up
     * @return the stored value, or null if the key is absent
     */
    public @Nullable V find(@NotNull K key) {
        requireKey(key);
        Node<K, V> node = findNode(key);
        return node == null ? null : node.value;
    }

    /**
     * Checks if an entry exists for the given key.
     *
     * @param key the key to check
     * @return true if the key is present
     */
    public boolean contains(@NotNull K key) {
        requireKey(key);
        return findNode(key) != null;
    }

    /**
     * Returns the number of entries.
     */
    public int size() {
        return size;
    }

    /**
     * Returns true when the tree holds no entries.
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the height of the tree, where an empty tree has height 0 and a single node height 1.
     */
    public int height() {
        return height(root);
    }

    /**
     * Returns the smallest key in the tree.
     *
     * @throws NoSuchElementException if the tree is empty
     */
    public @NotNull K minimumKey() {
        if (root == null) {
            throw new NoSuchElementException("Tree is empty");
        }
        Node<K, V> current = root;
        while (current.left != null) {
            current = current.left;
        }
        return current.key;
    }

    /**
     * Returns the largest key in the tree.
     *
     * @throws NoSuchElementException if the tree is empty
     */
    public @NotNull K maximumKey() {
        if (root == null) {
            throw new NoSuchElementException("Tree is empty");
        }
        Node<K, V> current = root;
        while (current.right != null) {
            current = current.right;
        }
        return current.key;
    }

    /**
     * Returns all values in ascending key order.
     *
     * @return a new list of values, empty if the tree is empty
     */
    public List<V> inOrder() {
        List<V> values = new ArrayList<>(size);
        for (V value : this) {
            values.add(value);
        }
        return values;
    }

    /**
     * Returns all keys in ascending order.
     *
     * @return a new list of keys, empty if the tree is empty
     */
    public List<K> keys() {
        List<K> keys = new ArrayList<>(size);
        InOrderIterator<K, V> iterator = new InOrderIterator<>(root);
        while (iterator.hasNext()) {
            keys.add(iterator.nextNode().key);
        }
        return keys;
    }

    /**
     * Checks the AVL and ordering invariants over the whole tree.
     *
     * @return true if every node is balanced, its stored height is exact and keys are ordered
     */
    public boolean isBalanced() {
        return checkSubtree(root, null, null) >= 0;
    }

    @Override
    public @NotNull Iterator<V> iterator() {
        InOrderIterator<K, V> nodes = new InOrderIterator<>(root);
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return nodes.hasNext();
            }

            @Override
            public V next() {
                return nodes.nextNode().value;
            }
        };
    }

    private Node<K, V> findNode(K key) {
        Node<K, V> current = root;
        while (current != null) {
            int comparison = key.compareTo(current.key);
            if (comparison == 0) {
                return current;
            }
            current = comparison < 0 ? current.left : current.right;
        }
        return null;
    }

    private Node<K, V> insert(Node<K, V> node, K key, V value) {
        if (node == null) {
            size++;
            return new Node<>(key, value);
        }

        int comparison = key.compareTo(node.key);
        if (comparison < 0) {
            node.left = insert(node.left, key, value);
        } else if (comparison > 0) {
            node.right = insert(node.right, key, value);
        } else {
            node.value = value;
            return node;
        }

        return rebalance(node);
    }

    private Node<K, V> remove(Node<K, V> node, K key) {
        if (node == null) {
            return null;
        }

        int comparison = key.compareTo(node.key);
        if (comparison < 0) {
            node.left = remove(node.left, key);
        } else if (comparison > 0) {
            node.right = remove(node.right, key);
        } else {
            if (node.left == null || node.right == null) {
                size--;
                return node.left != null ? node.left : node.right;
            }
            // Two children: pull up the in-order successor, then delete it from the right subtree.
            Node<K, V> successor = node.right;
            while (successor.left != null) {
                successor = successor.left;
            }
            node.key = successor.key;
            node.value = successor.value;
            node.right = remove(node.right, successor.key);
        }

        return rebalance(node);
    }

    /**
     * Restores the AVL property at the given node after one of its subtrees changed height by one.
     *
     * @param node the node whose subtrees were modified
     * @return the new root of this subtree
     */
    private Node<K, V> rebalance(Node<K, V> node) {
        updateHeight(node);
        int balance = balanceFactor(node);

        if (balance > 1) {
            if (balanceFactor(node.left) < 0) {
                node.left = rotateLeft(node.left);
            }
            return rotateRight(node);
        }

        if (balance < -1) {
            if (balanceFactor(node.right) > 0) {
                node.right = rotateRight(node.right);
            }
            return rotateLeft(node);
        }

        return node;
    }

    private Node<K, V> rotateRight(Node<K, V> node) {
        Node<K, V> pivot = node.left;
        node.left = pivot.right;
        pivot.right = node;
        updateHeight(node);
        updateHeight(pivot);
        return pivot;
    }

    private Node<K, V> rotateLeft(Node<K, V> node) {
        Node<K, V> pivot = node.right;
        node.right = pivot.left;
        pivot.left = node;
        updateHeight(node);
        updateHeight(pivot);
        return pivot;
    }

    private void updateHeight(Node<K, V> node) {
        node.height = 1 + Math.max(height(node.left), height(node.right));
    }

    private int balanceFactor(Node<K, V> node) {
        return height(node.left) - height(node.right);
    }

    private static int height(Node<?, ?> node) {
        return node == null ? 0 : node.height;
    }

    /**
     * Returns the subtree height when valid, or -1 on any violation.
     */
    private int checkSubtree(Node<K, V> node, K lowerBound, K upperBound) {
        if (node == null) {
            return 0;
        }
        if (lowerBound != null && node.key.compareTo(lowerBound) <= 0) {
            return -1;
        }
        if (upperBound != null && node.key.compareTo(upperBound) >= 0) {
            return -1;
        }
        int leftHeight = checkSubtree(node.left, lowerBound, node.key);
        int rightHeight = checkSubtree(node.right, node.key, upperBound);
        if (leftHeight < 0 || rightHeight < 0 || Math.abs(leftHeight - rightHeight) > 1) {
            return -1;
        }
        int expected = 1 + Math.max(leftHeight, rightHeight);
        return expected == node.height ? expected : -1;
    }

    private static void requireKey(Object key) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
    }

    private static final class Node<K, V> {
        K key;
        V value;
        Node<K, V> left;
        Node<K, V> right;
        int height = 1;

        Node(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    /**
     * Iterative in-order walk driven by an explicit stack of pending ancestors.
     */
    private static final class InOrderIterator<K, V> {

        private final ArrayDeque<Node<K, V>> pending = new ArrayDeque<>();

        InOrderIterator(Node<K, V> root) {
            pushLeftSpine(root);
        }

        boolean hasNext() {
            return !pending.isEmpty();
        }

        Node<K, V> nextNode() {
            if (pending.isEmpty()) {
                throw new NoSuchElementException();
            }
            Node<K, V> node = pending.pop();
            pushLeftSpine(node.right);
            return node;
        }

        private void pushLeftSpine(Node<K, V> node) {
            Node<K, V> current = node;
            while (current != null) {
                pending.push(current);
                current = current.left;
            }
        }
    }
}
