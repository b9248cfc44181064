package com.treeql.ast;

import com.treeql.exception.NodeConstructionException;
import com.treeql.exception.QueryTreeException;
import com.treeql.symbol.AnonSymbol;
import com.treeql.symbol.FieldSymbol;
import com.treeql.symbol.Symbol;
import com.treeql.test.TestBase;
import com.treeql.test.TestCategories;
import com.treeql.test.TestTable;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for field selection.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Select Tests")
public class SelectTest extends TestBase {

    @Test
    @DisplayName("Selecting from a raw table fails with a descriptive error")
    void testRawTableRejected() {
        TestTable users = new TestTable("users");

        logStep("When: selecting a field directly from a table");
        Throwable thrown = catchThrowable(() -> new Select(users, FieldSymbol.of("name")));

        logStep("Then: construction fails and names the table and field");
        assertThat(thrown)
            .isInstanceOf(NodeConstructionException.class)
            .isInstanceOf(QueryTreeException.class)
            .hasMessageContaining("Table users")
            .hasMessageContaining("\"name\"")
            .hasMessageContaining("without introducing it through a generator");
        assertThat(((NodeConstructionException) thrown).getFailedNode()).isSameAs(users);
    }

    @Test
    @DisplayName("Selecting from a generator reference is allowed")
    void testSelectFromRef() {
        Symbol u = new AnonSymbol();

        Select select = new Select(new Ref(u), FieldSymbol.of("name"));

        assertThat(select.in()).isEqualTo(new Ref(u));
        assertThat(select.childNames()).containsExactly("in");
    }

    @Test
    @DisplayName("Rebuilding onto a raw table is rejected too")
    void testRebuildOntoTable() {
        Select select = new Select(new Ref(new AnonSymbol()), FieldSymbol.of("name"));

        assertThatThrownBy(() -> select.rebuild(List.of(new TestTable("users"))))
            .isInstanceOf(NodeConstructionException.class);
    }

    @Test
    @DisplayName("The referenced symbol is the field, and it can be replaced")
    void testReference() {
        Symbol u = new AnonSymbol();
        Select select = new Select(new Ref(u), FieldSymbol.of("name"));

        assertThat(select.reference()).isEqualTo(FieldSymbol.of("name"));
        assertThat(select.mapReference(f -> f)).isSameAs(select);
        assertThat(select.mapReference(f -> FieldSymbol.of("email")))
            .isEqualTo(new Select(new Ref(u), FieldSymbol.of("email")));
    }
}
