package de.dreamcube.treasuremaze.structures;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Array-backed binary max-heap.
 *
 * <p>Items are ordered by the supplied comparator, largest first. Items the comparator considers
 * equal leave the heap in insertion order: every insert is stamped with a sequence number that is
 * used as the secondary key.</p>
 *
 * <p>For every non-root index {@code i}, the item at {@code parent(i) = (i - 1) / 2} ranks at
 * least as high as the item at {@code i}.</p>
 *
 * <p>Thread safety: This class is not thread-safe.</p>
 *
 * @param <T> the item type
 */
public final class MaxHeap<T> {

    private static final int DEFAULT_CAPACITY = 16;

    private final Comparator<? super T> comparator;

    private Object[] items;
    private long[] sequence;
    private int size;
    private long nextSequence;

    /**
     * Creates an empty heap ordered by the given comparator.
     *
     * @param comparator ranks items, larger means closer to the root
     */
    public MaxHeap(@NotNull Comparator<? super T> comparator) {
        this(comparator, DEFAULT_CAPACITY);
    }

    /**
     * Creates an empty heap with an initial backing capacity.
     *
     * @param comparator ranks items, larger means closer to the root
     * @param initialCapacity the initial array length, at least 1
     */
    public MaxHeap(@NotNull Comparator<? super T> comparator, int initialCapacity) {
        this.comparator = Objects.requireNonNull(comparator, "comparator");
        int capacity = Math.max(1, initialCapacity);
        this.items = new Object[capacity];
        this.sequence = new long[capacity];
    }

    /**
     * Builds a heap from a collection in linear time using bottom-up sift-down.
     *
     * <p>Insertion order for tie-breaking is the iteration order of the collection.</p>
     *
     * @param comparator ranks items, larger means closer to the root
     * @param source the items to place in the heap
     * @return a new heap holding all items
     */
    public static <T> MaxHeap<T> heapify(@NotNull Comparator<? super T> comparator,
                                         @NotNull Collection<? extends T> source) {
        MaxHeap<T> heap = new MaxHeap<>(comparator, source.size());
        for (T item : source) {
            heap.items[heap.size] = Objects.requireNonNull(item, "item");
            heap.sequence[heap.size] = heap.nextSequence++;
            heap.size++;
        }
        for (int index = heap.size / 2 - 1; index >= 0; index--) {
            heap.siftDown(index);
        }
        return heap;
    }

    /**
     * Adds an item to the heap.
     *
     * @param item the item to add, must not be null
     */
    public void insert(@NotNull T item) {
        Objects.requireNonNull(item, "item");
        ensureCapacity(size + 1);
        items[size] = item;
        sequence[size] = nextSequence++;
        siftUp(size);
        size++;
    }

    /**
     * Returns the highest ranked item without removing it.
     *
     * @return the top item, or null if the heap is empty
     */
    public @Nullable T peekMax() {
        return size == 0 ? null : itemAt(0);
    }

    /**
     * Removes and returns the highest ranked item.
     *
     * @return the removed item
     * @throws NoSuchElementException if the heap is empty
     */
    public @NotNull T extractMax() {
        if (size == 0) {
            throw new NoSuchElementException("Heap is empty");
        }
        T top = itemAt(0);
        size--;
        swap(0, size);
        items[size] = null;
        if (size > 0) {
            siftDown(0);
        }
        return top;
    }

    /**
     * Returns the number of items.
     */
    public int size() {
        return size;
    }

    /**
     * Returns true when the heap holds no items.
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns every item in extraction order without modifying this heap.
     *
     * @return a new list, highest ranked first
     */
    public List<T> drainedCopy() {
        MaxHeap<T> copy = new MaxHeap<>(comparator, Math.max(1, size));
        System.arraycopy(items, 0, copy.items, 0, size);
        System.arraycopy(sequence, 0, copy.sequence, 0, size);
        copy.size = size;
        copy.nextSequence = nextSequence;

        List<T> ordered = new ArrayList<>(size);
        while (!copy.isEmpty()) {
            ordered.add(copy.extractMax());
        }
        return ordered;
    }

    /**
     * Checks the heap order over the whole backing array.
     *
     * @return true if no child outranks its parent
     */
    public boolean isHeapOrdered() {
        for (int index = 1; index < size; index++) {
            if (outranks(index, (index - 1) / 2)) {
                return false;
            }
        }
        return true;
    }

    private void siftUp(int index) {
        int current = index;
        while (current > 0) {
            int parent = (current - 1) / 2;
            if (!outranks(current, parent)) {
                return;
            }
            swap(current, parent);
            current = parent;
        }
    }

    private void siftDown(int index) {
        int current = index;
        while (true) {
            int left = 2 * current + 1;
            if (left >= size) {
                return;
            }
            int right = left + 1;
            int largest = (right < size && outranks(right, left)) ? right : left;
            if (!outranks(largest, current)) {
                return;
            }
            swap(current, largest);
            current = largest;
        }
    }

    /**
     * Returns true if the item at {@code a} must sit above the item at {@code b}.
     */
    private boolean outranks(int a, int b) {
        int comparison = comparator.compare(itemAt(a), itemAt(b));
        if (comparison != 0) {
            return comparison > 0;
        }
        return sequence[a] < sequence[b];
    }

    private void swap(int a, int b) {
        Object item = items[a];
        items[a] = items[b];
        items[b] = item;

        long stamp = sequence[a];
        sequence[a] = sequence[b];
        sequence[b] = stamp;
    }

    private void ensureCapacity(int required) {
        if (required <= items.length) {
            return;
        }
        int newCapacity = Math.max(required, items.length * 2);
        items = Arrays.copyOf(items, newCapacity);
        sequence = Arrays.copyOf(sequence, newCapacity);
    }

    @SuppressWarnings("unchecked")
    private T itemAt(int index) {
        return (T) items[index];
    }
}
