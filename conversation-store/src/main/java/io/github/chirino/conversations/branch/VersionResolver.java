package io.github.chirino.conversations.branch;

import io.github.chirino.conversations.persistence.BranchStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Derives sibling versions from the set of stored branch keys. Nothing here is persisted: every
 * answer is recomputed from the keys that exist at the time of the call.
 *
 * <p>Two branches are siblings at decision index {@code k} when they agree on their first {@code
 * k} (zero padded) values. The value each one holds at index {@code k} is its sibling value.
 */
@ApplicationScoped
public class VersionResolver {

    BranchStore branchStore;

    VersionResolver() {}

    @Inject
    public VersionResolver(BranchStore branchStore) {
        this.branchStore = branchStore;
    }

    public VersionInfo resolve(
            String conversationId, BranchCoordinate coordinate, int decisionIndex) {
        return resolve(branchStore.listBranchKeys(conversationId), coordinate, decisionIndex);
    }

    public int nextSiblingValue(
            String conversationId, BranchCoordinate coordinate, int decisionIndex) {
        return nextSiblingValue(
                branchStore.listBranchKeys(conversationId), coordinate, decisionIndex);
    }

    /** Distinct sibling values at {@code decisionIndex}, ascending. */
    public static SortedSet<Integer> siblingValues(
            Collection<BranchCoordinate> keys, BranchCoordinate coordinate, int decisionIndex) {
        checkIndex(decisionIndex);
        SortedSet<Integer> values = new TreeSet<>();
        for (BranchCoordinate key : keys) {
            if (key.prefixEquals(coordinate, decisionIndex)) {
                values.add(key.valueAt(decisionIndex));
            }
        }
        return values;
    }

    public static VersionInfo resolve(
            Collection<BranchCoordinate> keys, BranchCoordinate coordinate, int decisionIndex) {
        List<Integer> values = new ArrayList<>(siblingValues(keys, coordinate, decisionIndex));
        if (values.isEmpty()) {
            return new VersionInfo(decisionIndex, 1, 1, List.of(0));
        }
        int rank = values.indexOf(coordinate.valueAt(decisionIndex));
        return new VersionInfo(decisionIndex, rank < 0 ? 1 : rank + 1, values.size(), values);
    }

    /** Smallest non-negative value not yet used by a sibling at {@code decisionIndex}. */
    public static int nextSiblingValue(
            Collection<BranchCoordinate> keys, BranchCoordinate coordinate, int decisionIndex) {
        SortedSet<Integer> used = siblingValues(keys, coordinate, decisionIndex);
        int candidate = 0;
        while (used.contains(candidate)) {
            candidate++;
        }
        return candidate;
    }

    /**
     * The branch reached by stepping {@code direction} (-1 or +1) through the siblings at {@code
     * decisionIndex}, wrapping at both ends. Among the stored branches under the chosen sibling,
     * the lexicographically smallest one is returned.
     *
     * @return empty when no sibling exists at {@code decisionIndex}
     */
    public static Optional<BranchCoordinate> adjacentBranch(
            Collection<BranchCoordinate> keys,
            BranchCoordinate coordinate,
            int decisionIndex,
            int direction) {
        if (direction != -1 && direction != 1) {
            throw new IllegalArgumentException("direction must be -1 or 1: " + direction);
        }
        List<Integer> values = new ArrayList<>(siblingValues(keys, coordinate, decisionIndex));
        if (values.isEmpty()) {
            return Optional.empty();
        }
        int currentIndex = Math.max(0, values.indexOf(coordinate.valueAt(decisionIndex)));
        int nextIndex = Math.floorMod(currentIndex + direction, values.size());
        BranchCoordinate target = coordinate.pad(decisionIndex).append(values.get(nextIndex));

        BranchCoordinate best = null;
        for (BranchCoordinate key : keys) {
            if (key.prefixEquals(target, decisionIndex + 1)
                    && (best == null || key.compareTo(best) < 0)) {
                best = key;
            }
        }
        return Optional.of(best != null ? best : target);
    }

    private static void checkIndex(int decisionIndex) {
        if (decisionIndex < 0) {
            throw new IllegalArgumentException(
                    "decision index must be non-negative: " + decisionIndex);
        }
    }
}
