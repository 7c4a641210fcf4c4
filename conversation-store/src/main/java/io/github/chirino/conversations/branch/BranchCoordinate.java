package io.github.chirino.conversations.branch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Sibling choice made at each decision point of a conversation, oldest first.
 *
 * <p>Equality is physical: {@code [0,1]} and {@code [0,1,0]} are different values even though
 * they name the same logical branch. Use {@link #isSameBranch(BranchCoordinate)} or {@link
 * #canonical()} to compare branches.
 */
public final class BranchCoordinate implements Comparable<BranchCoordinate> {

    public static final BranchCoordinate ROOT = new BranchCoordinate(new int[] {0});

    private final int[] values;

    private BranchCoordinate(int[] values) {
        this.values = values;
    }

    public static BranchCoordinate of(int... values) {
        if (values == null || values.length == 0) {
            return ROOT;
        }
        for (int value : values) {
            if (value < 0) {
                throw new IllegalArgumentException(
                        "Branch values must be non-negative: " + Arrays.toString(values));
            }
        }
        return new BranchCoordinate(values.clone());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BranchCoordinate fromList(List<Integer> values) {
        if (values == null || values.isEmpty()) {
            return ROOT;
        }
        int[] array = new int[values.size()];
        for (int i = 0; i < array.length; i++) {
            Integer value = values.get(i);
            if (value == null) {
                throw new IllegalArgumentException("Branch values must not be null: " + values);
            }
            array[i] = value;
        }
        return of(array);
    }

    @JsonValue
    public List<Integer> toList() {
        List<Integer> list = new ArrayList<>(values.length);
        for (int value : values) {
            list.add(value);
        }
        return Collections.unmodifiableList(list);
    }

    public int size() {
        return values.length;
    }

    public int get(int index) {
        return values[index];
    }

    /** Value chosen at {@code index}; positions past the end are implicitly 0. */
    public int valueAt(int index) {
        return index < values.length ? values[index] : 0;
    }

    /** Extends with trailing zeros, or truncates, to exactly {@code length} entries. */
    public BranchCoordinate pad(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative: " + length);
        }
        return new BranchCoordinate(Arrays.copyOf(values, length));
    }

    public BranchCoordinate append(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Branch values must be non-negative: " + value);
        }
        int[] extended = Arrays.copyOf(values, values.length + 1);
        extended[values.length] = value;
        return new BranchCoordinate(extended);
    }

    /** Same coordinate with trailing zeros removed; never shorter than one entry. */
    public BranchCoordinate canonical() {
        int length = values.length;
        while (length > 1 && values[length - 1] == 0) {
            length--;
        }
        if (length == 0) {
            return ROOT;
        }
        return length == values.length ? this : new BranchCoordinate(Arrays.copyOf(values, length));
    }

    public boolean isSameBranch(BranchCoordinate other) {
        return other != null && canonical().equals(other.canonical());
    }

    /** True when both coordinates agree on their first {@code length} zero-padded entries. */
    public boolean prefixEquals(BranchCoordinate other, int length) {
        for (int i = 0; i < length; i++) {
            if (valueAt(i) != other.valueAt(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(BranchCoordinate other) {
        return Arrays.compare(values, other.values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BranchCoordinate that)) {
            return false;
        }
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
