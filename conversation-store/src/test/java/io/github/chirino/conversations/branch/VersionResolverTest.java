package io.github.chirino.conversations.branch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class VersionResolverTest {

    private static final List<BranchCoordinate> KEYS =
            List.of(
                    BranchCoordinate.of(0),
                    BranchCoordinate.of(1),
                    BranchCoordinate.of(2),
                    BranchCoordinate.of(1, 1),
                    BranchCoordinate.of(1, 0, 3));

    @Test
    void counts_distinct_sibling_values_at_the_decision_index() {
        VersionInfo first = VersionResolver.resolve(KEYS, BranchCoordinate.of(1), 0);
        assertEquals(3, first.getTotalVersions());
        assertEquals(2, first.getCurrentVersion());
        assertEquals(List.of(0, 1, 2), first.getVersions());

        VersionInfo second = VersionResolver.resolve(KEYS, BranchCoordinate.of(1, 1), 1);
        assertEquals(List.of(0, 1), second.getVersions());
        assertEquals(2, second.getCurrentVersion());

        VersionInfo third = VersionResolver.resolve(KEYS, BranchCoordinate.of(1), 2);
        assertEquals(List.of(0, 3), third.getVersions());
        assertEquals(1, third.getCurrentVersion());
    }

    @Test
    void siblings_under_another_prefix_are_ignored() {
        VersionInfo info = VersionResolver.resolve(KEYS, BranchCoordinate.of(0), 1);
        assertEquals(1, info.getTotalVersions());
        assertEquals(List.of(0), info.getVersions());
    }

    @Test
    void no_keys_means_a_single_version() {
        VersionInfo info = VersionResolver.resolve(List.of(), BranchCoordinate.of(4, 2), 1);
        assertEquals(1, info.getCurrentVersion());
        assertEquals(1, info.getTotalVersions());
        assertEquals(List.of(0), info.getVersions());
    }

    @Test
    void unknown_current_value_ranks_first() {
        VersionInfo info = VersionResolver.resolve(KEYS, BranchCoordinate.of(7), 0);
        assertEquals(1, info.getCurrentVersion());
        assertEquals(3, info.getTotalVersions());
    }

    @Test
    void next_sibling_value_fills_the_smallest_gap() {
        List<BranchCoordinate> keys =
                List.of(BranchCoordinate.of(0), BranchCoordinate.of(2), BranchCoordinate.of(3));
        assertEquals(1, VersionResolver.nextSiblingValue(keys, BranchCoordinate.of(0), 0));
        assertEquals(1, VersionResolver.nextSiblingValue(KEYS, BranchCoordinate.of(1), 2));
        assertEquals(1, VersionResolver.nextSiblingValue(KEYS, BranchCoordinate.of(0), 1));
    }

    @Test
    void switching_wraps_around_in_both_directions() {
        List<BranchCoordinate> keys =
                List.of(BranchCoordinate.of(0), BranchCoordinate.of(1), BranchCoordinate.of(2));

        assertEquals(
                BranchCoordinate.of(2),
                VersionResolver.adjacentBranch(keys, BranchCoordinate.of(1), 0, 1).orElseThrow());
        assertEquals(
                BranchCoordinate.of(0),
                VersionResolver.adjacentBranch(keys, BranchCoordinate.of(2), 0, 1).orElseThrow());
        assertEquals(
                BranchCoordinate.of(2),
                VersionResolver.adjacentBranch(keys, BranchCoordinate.of(0), 0, -1).orElseThrow());
    }

    @Test
    void switching_snaps_to_the_lowest_stored_descendant() {
        List<BranchCoordinate> keys =
                List.of(
                        BranchCoordinate.of(0),
                        BranchCoordinate.of(1, 2),
                        BranchCoordinate.of(1, 1, 4),
                        BranchCoordinate.of(1, 1));

        assertEquals(
                BranchCoordinate.of(1, 1),
                VersionResolver.adjacentBranch(keys, BranchCoordinate.of(0), 0, 1).orElseThrow());
    }

    @Test
    void switching_without_siblings_is_empty() {
        assertTrue(
                VersionResolver.adjacentBranch(
                                List.of(BranchCoordinate.of(0)), BranchCoordinate.of(1), 1, 1)
                        .isEmpty());
        assertTrue(
                VersionResolver.adjacentBranch(List.of(), BranchCoordinate.of(0), 0, -1).isEmpty());
    }

    @Test
    void switching_rejects_other_directions() {
        assertThrows(
                IllegalArgumentException.class,
                () -> VersionResolver.adjacentBranch(KEYS, BranchCoordinate.of(0), 0, 2));
        assertThrows(
                IllegalArgumentException.class,
                () -> VersionResolver.adjacentBranch(KEYS, BranchCoordinate.of(0), 0, 0));
    }
}
