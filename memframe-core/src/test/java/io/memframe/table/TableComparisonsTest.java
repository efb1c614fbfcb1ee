package io.memframe.table;

import io.memframe.core.Ternary;
import io.memframe.storage.Columns;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TableComparisonsTest {

    @Test
    void shapeDifferencesAreFalse() {
        var two = DataTable.of(List.of(Columns.ofLongs(1, 2)), List.of("a"));
        var three = DataTable.of(List.of(Columns.ofLongs(1, 2, 3)), List.of("a"));
        var wider = DataTable.of(List.of(Columns.ofLongs(1, 2), Columns.ofLongs(1, 2)), List.of("a", "b"));

        assertThat(TableComparisons.equalTo(two, three)).isEqualTo(Ternary.FALSE);
        assertThat(TableComparisons.equalTo(two, wider)).isEqualTo(Ternary.FALSE);
        assertThat(TableComparisons.isEquivalent(two, three)).isFalse();
    }

    @Test
    void definiteDifferenceWinsOverNa() {
        var left = DataTable.of(List.of(Columns.ofLongs(0, 2), Columns.ofLongs(5)), List.of("a", "b"));
        var withNa = Columns.ofLongs(1, 2);
        withNa.setNa(0);
        var right = DataTable.of(List.of(withNa, Columns.ofLongs(6)), List.of("a", "b"));

        assertThat(TableComparisons.equalTo(left, right)).isEqualTo(Ternary.FALSE);
    }

    @Test
    void numericTypesCompareByValue() {
        var longs = DataTable.of(List.of(Columns.ofLongs(1, 2)), List.of("a"));
        var doubles = DataTable.of(List.of(Columns.ofDoubles(1.0, 2.0)), List.of("a"));

        assertThat(TableComparisons.equalTo(longs, doubles)).isEqualTo(Ternary.TRUE);
        assertThat(TableComparisons.isEquivalent(longs, doubles)).isTrue();
        assertThat(TableComparisons.hash(longs)).isEqualTo(TableComparisons.hash(doubles));
    }

    @Test
    void hashIsColumnOrderSensitive() {
        var ab = DataTable.of(List.of(Columns.ofLongs(1), Columns.ofLongs(2)), List.of("a", "b"));
        var ba = DataTable.of(List.of(Columns.ofLongs(2), Columns.ofLongs(1)), List.of("a", "b"));

        assertThat(TableComparisons.hash(ab)).isNotEqualTo(TableComparisons.hash(ba));
    }

    @Test
    void emptyTablesAreEquivalent() {
        assertThat(TableComparisons.isEquivalent(DataTable.empty(), DataTable.empty())).isTrue();
        assertThat(TableComparisons.equalTo(DataTable.empty(), DataTable.empty())).isEqualTo(Ternary.TRUE);
    }
}
