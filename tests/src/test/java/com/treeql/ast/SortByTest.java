package com.treeql.ast;

import com.treeql.symbol.AnonSymbol;
import com.treeql.symbol.FieldSymbol;
import com.treeql.symbol.Symbol;
import com.treeql.test.TestBase;
import com.treeql.test.TestCategories;
import com.treeql.test.TestTable;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for SortBy and Ordering.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SortBy Tests")
public class SortByTest extends TestBase {

    private final Symbol g = new AnonSymbol();

    private Node key(String field) {
        return Path.of(g, FieldSymbol.of(field));
    }

    @Nested
    @DisplayName("Children")
    class Children {

        @Test
        @DisplayName("Children are the source followed by the sort keys")
        void testChildren() {
            Node source = new TestTable("users");
            Node k1 = key("name");
            Node k2 = key("age");
            SortBy sortBy = new SortBy(g, source, List.of(
                SortBy.SortKey.of(k1), new SortBy.SortKey(k2, Ordering.DEFAULT.desc())));

            assertThat(sortBy.children()).containsExactly(source, k1, k2);
            assertThat(sortBy.childNames()).containsExactly("from " + g, "by0", "by1");
        }

        @Test
        @DisplayName("Rebuild keeps orderings and generator")
        void testRebuildKeepsOrderings() {
            Ordering desc = Ordering.DEFAULT.desc().nullsLast();
            SortBy sortBy = new SortBy(g, new TestTable("users"), List.of(new SortBy.SortKey(key("a"), desc)));

            SortBy rebuilt = (SortBy) sortBy.rebuild(List.of(new TestTable("orders"), key("b")));

            assertThat(rebuilt.generator()).isSameAs(g);
            assertThat(rebuilt.by()).containsExactly(new SortBy.SortKey(key("b"), desc));
            assertThat(rebuilt.from()).isEqualTo(new TestTable("orders"));
        }

        @Test
        @DisplayName("A sort without keys has only its source as a child")
        void testEmptyKeys() {
            Node source = new TestTable("users");
            SortBy sortBy = new SortBy(g, source, List.of());

            assertThat(sortBy.children()).containsExactly(source);
            assertThat(sortBy.childNames()).containsExactly("from " + g);
            assertThat(sortBy.toString()).isEqualTo("SortBy");

            Node other = new TestTable("admins");
            SortBy rebuilt = (SortBy) sortBy.rebuild(List.of(other));
            assertThat(rebuilt.from()).isSameAs(other);
            assertThat(rebuilt.by()).isEmpty();
            assertThat(TreeDump.dump(sortBy)).startsWith("SortBy\n  from " + g + ": ");
        }

        @Test
        @DisplayName("toString lists the orderings")
        void testToString() {
            SortBy sortBy = new SortBy(g, new TestTable("users"), List.of(
                SortBy.SortKey.of(key("a")),
                new SortBy.SortKey(key("b"), Ordering.DEFAULT.desc().nullsLast())));

            assertThat(sortBy.toString()).isEqualTo("SortBy asc, desc nullsLast");
        }
    }

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("Default is ascending with default null placement")
        void testDefault() {
            assertThat(Ordering.DEFAULT.direction()).isEqualTo(Ordering.Direction.ASC);
            assertThat(Ordering.DEFAULT.nulls()).isEqualTo(Ordering.NullOrdering.NULLS_DEFAULT);
            assertThat(Ordering.DEFAULT.toString()).isEqualTo("asc");
        }

        @Test
        @DisplayName("Reverse flips the direction and keeps null placement")
        void testReverse() {
            Ordering ordering = Ordering.DEFAULT.nullsFirst();

            Ordering reversed = ordering.reverse();

            assertThat(reversed.direction().isDesc()).isTrue();
            assertThat(reversed.nulls().first()).isTrue();
            assertThat(reversed.reverse()).isEqualTo(ordering);
            assertThat(reversed.toString()).isEqualTo("desc nullsFirst");
        }

        @Test
        @DisplayName("Null placement flags")
        void testNullOrdering() {
            assertThat(Ordering.NullOrdering.NULLS_LAST.last()).isTrue();
            assertThat(Ordering.NullOrdering.NULLS_LAST.first()).isFalse();
            assertThat(Ordering.NullOrdering.NULLS_DEFAULT.first()).isFalse();
            assertThat(Ordering.NullOrdering.NULLS_DEFAULT.last()).isFalse();
            assertThat(Ordering.DEFAULT.desc().nullsDefault().asc()).isEqualTo(Ordering.DEFAULT);
        }
    }
}
