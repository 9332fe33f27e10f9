package de.dreamcube.treasuremaze.hollow;

import org.jetbrains.annotations.NotNull;

import java.util.Comparator;

/**
 * Immutable collectible item with a weight and a value.
 */
public final class Treasure {

    /**
     * Best value-to-weight ratio first; equal ratios fall back to the lower (earlier) id.
     */
    public static final Comparator<Treasure> BY_RATIO = Comparator
            .comparingDouble(Treasure::ratio).reversed()
            .thenComparingInt(Treasure::id);

    /**
     * Heap ordering: the treasure that {@link #BY_RATIO} lists first ranks highest.
     */
    public static final Comparator<Treasure> RANK = BY_RATIO.reversed();

    private final int id;
    private final int weight;
    private final int value;

    /**
     * Creates a new treasure.
     *
     * @param id unique identifier
     * @param weight positive weight
     * @param value positive value
     * @throws IllegalArgumentException if weight or value is not positive
     */
    public Treasure(int id, int weight, int value) {
        if (weight <= 0) {
            throw new IllegalArgumentException("weight must be positive: " + weight);
        }
        if (value <= 0) {
            throw new IllegalArgumentException("value must be positive: " + value);
        }
        this.id = id;
        this.weight = weight;
        this.value = value;
    }

    /**
     * Returns the identifier.
     */
    public int id() {
        return id;
    }

    /**
     * Returns the weight.
     */
    public int weight() {
        return weight;
    }

    /**
     * Returns the value.
     */
    public int value() {
        return value;
    }

    /**
     * Returns value divided by weight.
     */
    public double ratio() {
        return (double) value / (double) weight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Treasure)) return false;
        Treasure other = (Treasure) o;
        return id == other.id && weight == other.weight && value == other.value;
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(id);
        result = 31 * result + Integer.hashCode(weight);
        result = 31 * result + Integer.hashCode(value);
        return result;
    }

    @Override
    public @NotNull String toString() {
        return String.format("Treasure#%d(w=%d, v=%d, r=%.2f)", id, weight, value, ratio());
    }
}
