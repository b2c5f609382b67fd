package io.propagationcontroller.placement;

import io.propagationcontroller.models.ClusterDescriptor;
import io.propagationcontroller.models.UnitSelection;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for UnitSelector.
 */
class UnitSelectorTest {

    private final UnitSelector selector = new UnitSelector();

    @Test
    void testMaximumTruncatesLexicographically() {
        // Given
        SortedMap<String, List<ClusterDescriptor>> units = units("west", 1, "east", 2, "central", 1);

        // When
        UnitSelection selection = selector.selectUnits(units, 0, 2);

        // Then
        assertThat(selection.getSelectedUnits()).containsExactly("central", "east");
        assertThat(selection.getUnitsFound()).isEqualTo(3);
        assertThat(selection.getClustersPerUnit()).containsEntry("east", 2).containsEntry("central", 1);
        assertThat(selection.isSatisfied()).isTrue();
    }

    @Test
    void testZeroMaximumSelectsEveryUnit() {
        UnitSelection selection = selector.selectUnits(units("a", 1, "b", 1, "c", 1), 0, 0);

        assertThat(selection.getSelectedUnits()).containsExactly("a", "b", "c");
    }

    @Test
    void testMinimumNotMetKeepsAllUnits() {
        UnitSelection selection = selector.selectUnits(units("a", 1, "b", 2), 3, 0);

        assertThat(selection.isSatisfied()).isFalse();
        assertThat(selection.getSelectedUnits()).containsExactly("a", "b");
    }

    @Test
    void testMinimumMet() {
        UnitSelection selection = selector.selectUnits(units("a", 1, "b", 2), 2, 5);

        assertThat(selection.isSatisfied()).isTrue();
        assertThat(selection.getSelectedUnits()).hasSize(2);
    }

    @Test
    void testNoUnitsWithZeroMinimumIsSatisfied() {
        UnitSelection selection = selector.selectUnits(new TreeMap<>(), 0, 1);

        assertThat(selection.isSatisfied()).isTrue();
        assertThat(selection.getSelectedUnits()).isEmpty();
    }

    @Test
    void testEmptyKeyUnitCountsByDefault() {
        UnitSelection selection = selector.selectUnits(units("", 1, "a", 1), 0, 1);

        assertThat(selection.getSelectedUnits()).containsExactly("");
        assertThat(selection.getUnitsFound()).isEqualTo(2);
    }

    @Test
    void testEmptyKeyUnitDroppedWhenNotCounted() {
        UnitSelector strict = new UnitSelector(new LexicographicUnitRankingStrategy(), false);

        UnitSelection selection = strict.selectUnits(units("", 3, "a", 1), 2, 0);

        assertThat(selection.getSelectedUnits()).containsExactly("a");
        assertThat(selection.getUnitsFound()).isEqualTo(1);
        assertThat(selection.isSatisfied()).isFalse();
    }

    @Test
    void testClusterCountRankingPrefersLargerUnits() {
        UnitSelector byCount = new UnitSelector(
            new ScoredUnitRankingStrategy(UnitScorer.CLUSTER_COUNT, "cluster-count"), true);

        UnitSelection selection = byCount.selectUnits(units("a", 1, "b", 3, "c", 2), 0, 2);

        assertThat(selection.getSelectedUnits()).containsExactly("b", "c");
        assertThat(byCount.getStrategyName()).isEqualTo("cluster-count");
    }

    /**
     * Builds units from alternating key / cluster count arguments.
     */
    static SortedMap<String, List<ClusterDescriptor>> units(Object... keysAndCounts) {
        SortedMap<String, List<ClusterDescriptor>> units = new TreeMap<>();
        for (int i = 0; i < keysAndCounts.length; i += 2) {
            String key = (String) keysAndCounts[i];
            int count = (Integer) keysAndCounts[i + 1];
            List<ClusterDescriptor> members = new ArrayList<>();
            for (int j = 0; j < count; j++) {
                members.add(ClusterDescriptor.builder().name(key + "-" + j).build());
            }
            units.put(key, members);
        }
        return units;
    }
}
