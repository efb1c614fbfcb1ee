package io.memframe.table;

import io.memframe.core.ColumnType;
import io.memframe.core.DuplicateColumnException;
import io.memframe.core.EmptyResultException;
import io.memframe.core.IndexMismatchException;
import io.memframe.core.LengthMismatchException;
import io.memframe.core.MemframeConfiguration;
import io.memframe.core.NonContiguousInsertException;
import io.memframe.core.Ternary;
import io.memframe.kernel.ColumnIndex;
import io.memframe.kernel.selection.Selector;
import io.memframe.storage.Column;
import io.memframe.storage.Columns;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.assertj.core.api.Assertions;

import static org.assertj.core.api.Assertions.*;

class DataTableTest {

    private static DataTable people() {
        return DataTable.of(
                List.of(Columns.ofLongs(1, 2, 3), Columns.ofStrings("a", "b", "c"), Columns.ofDoubles(1.5, 2.5, 3.5)),
                List.of("id", "name", "score"));
    }

    private static DataTable withNa() {
        var ids = Columns.ofLongs(1, 0, 3);
        ids.setNa(1);
        return DataTable.of(List.of(ids, Columns.ofStrings("x", "y", null)), List.of("a", "b"));
    }

    // ===== construction =====

    @Test
    void constructorValidatesColumnLengthsAndIndex() {
        assertThatThrownBy(() -> new DataTable(List.of(Columns.ofLongs(1), Columns.ofLongs(1, 2)),
                new ColumnIndex(List.of("a", "b"))))
                .isInstanceOf(LengthMismatchException.class);
        assertThatThrownBy(() -> new DataTable(List.of(Columns.ofLongs(1)), new ColumnIndex(List.of("a", "b"))))
                .isInstanceOf(IndexMismatchException.class);
    }

    @Test
    void constructorCopiesTheIndex() {
        var index = new ColumnIndex(List.of("a"));
        var table = new DataTable(List.of(Columns.ofLongs(1)), index);
        index.rename("a", "z");

        assertThat(table.names()).containsExactly("a");
        table.index().rename("a", "q");
        assertThat(table.names()).containsExactly("a");
    }

    @Test
    void unnamedColumnsGetGeneratedNames() {
        var table = DataTable.of(List.of(Columns.ofLongs(1), Columns.ofLongs(2)));

        assertThat(table.names()).containsExactly("x1", "x2");
    }

    @Test
    void withShapeIsAllNaOfDefaultType() {
        var table = DataTable.withShape(2, 3);

        assertThat(table.names()).containsExactly("x1", "x2", "x3");
        assertThat(table.types()).containsOnly(ColumnType.DOUBLE);
        assertThat(table.rowCount()).isEqualTo(2);
        assertThat(table.value(0, "x1")).isNull();

        var config = MemframeConfiguration.builder()
                .defaultColumnType(ColumnType.LONG)
                .generatedNamePrefix("c")
                .build();
        var custom = DataTable.withShape(1, 1, config);
        assertThat(custom.names()).containsExactly("c1");
        assertThat(custom.types()).containsExactly(ColumnType.LONG);
        assertThat(custom.configuration()).isSameAs(config);
    }

    @Test
    void withTypesIsAllNa() {
        var table = DataTable.withTypes(List.of(ColumnType.LONG, ColumnType.STRING), List.of("a", "b"), 2);

        assertThat(table.types()).containsExactly(ColumnType.LONG, ColumnType.STRING);
        assertThat(table.column("b").naCount()).isEqualTo(2);
        assertThat(DataTable.withTypes(List.of(ColumnType.BOOLEAN), 4).names()).containsExactly("x1");
    }

    @Test
    void fromRecordsInfersTypesAndFillsMissingKeys() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 1);
        first.put("b", "x");
        Map<String, Object> second = new HashMap<>();
        second.put("a", 2.5);
        second.put("c", null);

        var table = DataTable.fromRecords(List.of(first, second));

        assertThat(table.names()).containsExactly("a", "b", "c");
        assertThat(table.types()).containsExactly(ColumnType.DOUBLE, ColumnType.STRING, ColumnType.OBJECT);
        Assertions.<Object>assertThat(table.column("a").toList()).containsExactly(1.0, 2.5);
        Assertions.<Object>assertThat(table.column("b").toList()).containsExactly("x", null);
        assertThat(table.column("c").naCount()).isEqualTo(2);
    }

    // ===== metadata =====

    @Test
    void metadata() {
        var table = people();

        assertThat(table.types()).containsExactly(ColumnType.LONG, ColumnType.STRING, ColumnType.DOUBLE);
        assertThat(table.isEmpty()).isFalse();
        assertThat(DataTable.empty().isEmpty()).isTrue();
        assertThat(table.containsColumn("id")).isTrue();
        assertThat(table.containsColumn(3)).isFalse();
        assertThat(table.getOrDefault("zz", "none")).isEqualTo("none");
        assertThat(table.getOrDefault("id", null)).isSameAs(table.column("id"));
    }

    @Test
    void renameAndSetNames() {
        var table = people();
        table.rename("id", "key");
        table.rename(Map.of("name", "label"));

        assertThat(table.names()).containsExactly("key", "label", "score");

        table.setNames(List.of("a", "b", "c"));
        Assertions.<Object>assertThat(table.column("a").toList()).containsExactly(1L, 2L, 3L);
        assertThatThrownBy(() -> table.setNames(List.of("a"))).isInstanceOf(LengthMismatchException.class);
    }

    @Test
    void cleanNamesReplacesNonWordCharacters() {
        var table = DataTable.of(List.of(Columns.ofLongs(1), Columns.ofLongs(2), Columns.ofLongs(3)),
                List.of(" a b", "a_b", "c!"));

        table.cleanNames();

        assertThat(table.names()).containsExactly("a_b", "a_b_1", "c_");
    }

    // ===== reads =====

    @Test
    void genericGetDispatchesOnShape() {
        var table = people();

        assertThat(table.get("id")).isInstanceOf(Column.class);
        assertThat(table.get(List.of("id"))).isInstanceOf(DataTable.class);
        assertThat(table.get(1, "name")).isEqualTo("b");
        assertThat(table.get(new int[]{0, 1}, "id")).isInstanceOf(Column.class);
    }

    @Test
    void selectSharesColumns() {
        var table = people();
        var selected = table.select("name");

        assertThat(selected.names()).containsExactly("name");
        selected.set(0, "name", "z");
        assertThat(table.value(0, "name")).isEqualTo("z");
        assertThat(table.select(new String[]{"score", "id"}).names()).containsExactly("score", "id");
    }

    @Test
    void cellsSliceAndRowsCopy() {
        var table = people();

        Assertions.<Object>assertThat(table.cells(new int[]{2, 0}, "id").toList()).containsExactly(3L, 1L);

        var slice = table.slice(new boolean[]{true, false, true}, List.of("id", "name"));
        assertThat(slice.rowCount()).isEqualTo(2);
        assertThat(slice.names()).containsExactly("id", "name");
        slice.set(0, "id", 100);
        assertThat(table.value(0, "id")).isEqualTo(1L);

        var single = table.slice(1, "id");
        assertThat(single.rowCount()).isEqualTo(1);
        assertThat(single.value(0, "id")).isEqualTo(2L);

        assertThat(table.rows(new int[]{1}).rowValues(0)).containsExactly(2L, "b", 2.5);
    }

    @Test
    void rowRoundTripThroughOneRowTable() {
        var table = people();

        for (int row = 0; row < table.rowCount(); row++) {
            var oneRow = (DataTable) table.get(row, Selector.ALL);
            for (String name : table.names()) {
                assertThat(oneRow.value(0, name)).isEqualTo(table.value(row, name));
            }
        }
    }

    @Test
    void iteratesRows() {
        var ids = new ArrayList<Object>();
        for (RowView row : people()) {
            ids.add(row.get("id"));
        }

        assertThat(ids).containsExactly(1L, 2L, 3L);
    }

    @Test
    void headAndTailDefaultToConfiguredSize() {
        var table = DataTable.of(List.of(Columns.ofInts(0, 1, 2, 3, 4, 5, 6, 7, 8, 9)));

        assertThat(table.head().rowCount()).isEqualTo(6);
        Assertions.<Object>assertThat(table.tail(3).column(0).toList()).containsExactly(7L, 8L, 9L);
        assertThat(table.head(20).rowCount()).isEqualTo(10);
        assertThat(table.tail(0).rowCount()).isZero();
        assertThat(table.tail().column(0).get(0)).isEqualTo(4L);
    }

    // ===== column editing =====

    @Test
    void insertColumnAtPosition() {
        var table = people();
        table.insertColumn(1, "flag", List.of(true, false, true));
        table.insertColumn(0, "k", 7);

        assertThat(table.names()).containsExactly("k", "id", "flag", "name", "score");
        Assertions.<Object>assertThat(table.column("k").toList()).containsExactly(7L, 7L, 7L);
        assertThat(table.column("flag").type()).isEqualTo(ColumnType.BOOLEAN);
    }

    @Test
    void insertColumnValidatesPositionLengthAndName() {
        var table = people();

        assertThatThrownBy(() -> table.insertColumn(4, "a", 1)).isInstanceOf(NonContiguousInsertException.class);
        assertThatThrownBy(() -> table.insertColumn(0, "a", List.of(1))).isInstanceOf(LengthMismatchException.class);
        assertThatThrownBy(() -> table.insertColumn(0, "id", 1)).isInstanceOf(DuplicateColumnException.class);
        assertThat(table.names()).containsExactly("id", "name", "score");
    }

    @Test
    void insertAllReplacesAndAppendsByName() {
        var table = people();
        var other = DataTable.of(List.of(Columns.ofLongs(7, 8, 9), Columns.ofStrings("p", "q", "r")),
                List.of("id", "extra"));

        table.insertAll(other);

        assertThat(table.names()).containsExactly("id", "name", "score", "extra");
        Assertions.<Object>assertThat(table.column("id").toList()).containsExactly(7L, 8L, 9L);

        var empty = DataTable.empty();
        empty.insertAll(other);
        assertThat(empty.rowCount()).isEqualTo(3);

        var shorter = DataTable.of(List.of(Columns.ofLongs(1)), List.of("id"));
        assertThatThrownBy(() -> table.insertAll(shorter)).isInstanceOf(LengthMismatchException.class);
    }

    @Test
    void deleteColumns() {
        var table = people();
        table.deleteColumn("name");
        assertThat(table.names()).containsExactly("id", "score");

        var other = people();
        other.deleteColumns(List.of("score", "id"));
        assertThat(other.names()).containsExactly("name");
    }

    @Test
    void withoutLeavesOriginalUntouched() {
        var table = people();
        var rest = table.without("id");

        assertThat(rest.names()).containsExactly("name", "score");
        assertThat(table.names()).containsExactly("id", "name", "score");
        assertThatThrownBy(() -> table.without(Selector.ALL)).isInstanceOf(EmptyResultException.class);
    }

    // ===== row editing =====

    @Test
    void keepAndDeleteRows() {
        var kept = people();
        kept.keepRows(new boolean[]{true, false, true});
        Assertions.<Object>assertThat(kept.column("id").toList()).containsExactly(1L, 3L);

        var deleted = people();
        deleted.deleteRows(0);
        Assertions.<Object>assertThat(deleted.column("id").toList()).containsExactly(2L, 3L);

        var repeated = people();
        repeated.keepRows(new int[]{2, 2});
        Assertions.<Object>assertThat(repeated.column("name").toList()).containsExactly("c", "c");
    }

    @Test
    void completeCasesFlagsRowsWithoutNa() {
        var table = withNa();

        assertThat(table.completeCases()).containsExactly(true, false, false);
        table.dropIncompleteRows();
        assertThat(table.rowCount()).isEqualTo(1);
        assertThat(table.rowValues(0)).containsExactly(1L, "x");
    }

    @Test
    void duplicatesTreatNaAsEqual() {
        var a = Columns.ofLongs(1, 1, 0, 0, 2);
        a.setNa(2);
        a.setNa(3);
        var b = Columns.ofStrings("x", "x", null, null, "y");
        var table = DataTable.of(List.of(a, b), List.of("a", "b"));

        assertThat(table.duplicated()).containsExactly(false, true, false, true, false);
        assertThat(table.unique().rowCount()).isEqualTo(3);

        table.dropDuplicates();
        Assertions.<Object>assertThat(table.column("a").toList()).containsExactly(1L, null, 2L);
    }

    @Test
    void flipCopiesAndFlipInPlaceWritesThrough() {
        var table = people();
        Assertions.<Object>assertThat(table.flip().column("id").toList()).containsExactly(3L, 2L, 1L);
        Assertions.<Object>assertThat(table.column("id").toList()).containsExactly(1L, 2L, 3L);

        var copy = table.copy();
        table.flipInPlace();
        Assertions.<Object>assertThat(copy.column("name").toList()).containsExactly("c", "b", "a");
    }

    @Test
    void flipInPlaceReversesColumnSharedBetweenSlots() {
        var table = DataTable.of(List.of(Columns.ofLongs(1, 2, 3)), List.of("p"));
        table.set("q", table.column("p"));

        table.flipInPlace();

        Assertions.<Object>assertThat(table.column("p").toList()).containsExactly(3L, 2L, 1L);
        Assertions.<Object>assertThat(table.column("q").toList()).containsExactly(3L, 2L, 1L);
    }

    // ===== copies & conversion =====

    @Test
    void shallowCopySharesCellsButNotColumnSlots() {
        var table = people();
        var copy = table.copy();

        copy.set("id", List.of(7, 8, 9));
        Assertions.<Object>assertThat(table.column("id").toList()).containsExactly(1L, 2L, 3L);

        copy.set(0, "name", "z");
        assertThat(table.value(0, "name")).isEqualTo("z");

        copy.set("new", 1);
        assertThat(table.containsColumn("new")).isFalse();
    }

    @Test
    void deepCopyIsIndependent() {
        var table = people();
        var copy = table.deepCopy();
        copy.set(0, "name", "z");

        assertThat(table.value(0, "name")).isEqualTo("a");
        assertThat(copy.configuration()).isSameAs(table.configuration());
    }

    @Test
    void allNaLikeKeepsSchema() {
        var like = people().allNaLike(2);

        assertThat(like.names()).containsExactly("id", "name", "score");
        assertThat(like.types()).containsExactly(ColumnType.LONG, ColumnType.STRING, ColumnType.DOUBLE);
        assertThat(like.completeCases()).containsExactly(false, false);
    }

    @Test
    void toArrayAndToMap() {
        var table = people();

        assertThat(table.toArray()[1]).containsExactly(2L, "b", 2.5);
        assertThat(table.toMap().get("id")).isSameAs(table.column("id"));
        assertThat(table.toMap(true).get("id")).isInstanceOf(Column.class);
        assertThat(table.rows(0).toMap(true)).containsExactly(
                entry("id", 1L), entry("name", "a"), entry("score", 1.5));
    }

    // ===== equality =====

    @Test
    void deepCopyIsEquivalentEvenWithNa() {
        var table = withNa();
        var copy = table.deepCopy();

        assertThat(table.isEquivalent(copy)).isTrue();
        assertThat(table).isEqualTo(copy);
        assertThat(table.hashCode()).isEqualTo(copy.hashCode());
        assertThat(table.equalTo(copy)).isEqualTo(Ternary.UNKNOWN);
        assertThat(people().equalTo(people())).isEqualTo(Ternary.TRUE);
    }

    @Test
    void naPlacementMakesEqualityUnknown() {
        var left = DataTable.of(List.of(Columns.ofLongs(1, 2)), List.of("a"));
        var right = DataTable.of(List.of(Columns.ofLongs(1, 2)), List.of("a"));
        right.set(1, "a", null);

        assertThat(left.equalTo(right)).isEqualTo(Ternary.UNKNOWN);
        assertThat(left.isEquivalent(right)).isFalse();
        assertThat(left).isNotEqualTo(right);
    }

    @Test
    void differentValuesOrNamesAreUnequal() {
        var table = people();
        var changed = people();
        changed.set(0, "id", 5);
        var renamed = people();
        renamed.rename("id", "key");

        assertThat(table.equalTo(changed)).isEqualTo(Ternary.FALSE);
        assertThat(table.equalTo(renamed)).isEqualTo(Ternary.FALSE);
        assertThat(table.isEquivalent(renamed)).isFalse();
    }

    @Test
    void toStringShowsShapeAndSchema() {
        assertThat(people().toString()).isEqualTo("DataTable[3x3: id LONG, name STRING, score DOUBLE]");
        assertThat(DataTable.empty().toString()).isEqualTo("DataTable[0x0]");
    }
}
