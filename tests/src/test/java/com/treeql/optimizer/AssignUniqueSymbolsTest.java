package com.treeql.optimizer;

import com.treeql.ast.Apply;
import com.treeql.ast.Bind;
import com.treeql.ast.DefNode;
import com.treeql.ast.Filter;
import com.treeql.ast.Generator;
import com.treeql.ast.Join;
import com.treeql.ast.JoinType;
import com.treeql.ast.LetDynamic;
import com.treeql.ast.LiteralNode;
import com.treeql.ast.Node;
import com.treeql.ast.Nodes;
import com.treeql.ast.Path;
import com.treeql.ast.ProductNode;
import com.treeql.ast.Pure;
import com.treeql.ast.Ref;
import com.treeql.ast.Select;
import com.treeql.ast.Union;
import com.treeql.symbol.AnonSymbol;
import com.treeql.symbol.FieldSymbol;
import com.treeql.symbol.Symbol;
import com.treeql.test.TestBase;
import com.treeql.test.TestCategories;
import com.treeql.test.TestTable;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for alpha-renaming of all bindings in a tree.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("AssignUniqueSymbols Tests")
public class AssignUniqueSymbolsTest extends TestBase {

    private final Symbol s = new AnonSymbol();
    private final Symbol t = new AnonSymbol();
    private final Symbol gt = FieldSymbol.of(">");
    private final Symbol age = FieldSymbol.of("age");

    private AssignUniqueSymbols rule;

    @Override
    protected void doSetUp() {
        rule = new AssignUniqueSymbols();
    }

    private Node ageAbove(Symbol row, int value) {
        return new Apply(gt, List.of(Path.of(row, age), LiteralNode.of(value)));
    }

    @Test
    @DisplayName("A generator and its references get the same fresh symbol")
    void testSimpleRename() {
        Node users = new TestTable("users");
        Filter filter = new Filter(s, users, ageAbove(s, 21));

        logStep("When: assigning unique symbols");
        Filter result = (Filter) rule.apply(filter);

        logStep("Then: the generator is fresh and the predicate follows it");
        Symbol fresh = result.generator();
        assertThat(fresh).isNotEqualTo(s).isInstanceOf(AnonSymbol.class);
        assertThat(result.where()).isEqualTo(ageAbove(fresh, 21));
        assertThat(result.from()).isSameAs(users);
    }

    @Test
    @DisplayName("Inner bindings shadow outer ones")
    void testShadowing() {
        Node users = new TestTable("users");
        Node inner = new Filter(s, new Ref(s), ageAbove(s, 18));
        Bind bind = new Bind(s, users, inner);

        Bind result = (Bind) rule.apply(bind);

        Symbol outer = result.generator();
        Filter innerResult = (Filter) result.select();
        Symbol innerSym = innerResult.generator();
        assertThat(outer).isNotEqualTo(innerSym);
        assertThat(innerResult.from()).isEqualTo(new Ref(outer));
        assertThat(innerResult.where()).isEqualTo(ageAbove(innerSym, 18));
    }

    @Test
    @DisplayName("A join condition refers to both renamed generators")
    void testJoin() {
        Node on = new Apply(FieldSymbol.of("=="), List.of(
            Path.of(s, FieldSymbol.of("id")), Path.of(t, FieldSymbol.of("userId"))));
        Join join = new Join(s, t, new TestTable("users"), new TestTable("orders"), JoinType.INNER, on);

        Join result = (Join) rule.apply(join);

        assertThat(result.on()).isEqualTo(new Apply(FieldSymbol.of("=="), List.of(
            Path.of(result.leftGen(), FieldSymbol.of("id")),
            Path.of(result.rightGen(), FieldSymbol.of("userId")))));
        assertThat(result.joinType()).isEqualTo(JoinType.INNER);
    }

    @Test
    @DisplayName("Sibling bindings that shared a symbol become distinct")
    void testSiblingsBecomeDistinct() {
        Node left = new Filter(s, new TestTable("users"), ageAbove(s, 1));
        Node right = new Filter(s, new TestTable("admins"), ageAbove(s, 2));
        Union union = new Union(left, right, true, s, t);

        Node result = rule.apply(union);

        Set<Symbol> generators = new HashSet<>();
        int count = 0;
        for (Node node : Nodes.collect(result, n -> n instanceof DefNode)) {
            for (Generator generator : ((DefNode) node).generators()) {
                generators.add(generator.symbol());
                count++;
            }
        }
        assertThat(count).isEqualTo(4);
        assertThat(generators).hasSize(4).doesNotContain(s, t);
    }

    @Test
    @DisplayName("A union side keeps referring to the enclosing binding")
    void testUnionSideSeesOuterBinding() {
        Node right = new Filter(t, new TestTable("admins"), new Ref(s));
        Union union = new Union(new TestTable("users"), right, true, s, t);
        Bind bind = new Bind(s, new TestTable("groups"), union);

        Bind result = (Bind) rule.apply(bind);

        Union newUnion = (Union) result.select();
        Filter newRight = (Filter) newUnion.right();
        assertThat(newRight.where()).isEqualTo(new Ref(result.generator()));
        assertThat(newRight.where()).isNotEqualTo(new Ref(newUnion.leftGen()));
    }

    @Test
    @DisplayName("A join side keeps referring to the enclosing binding")
    void testJoinSideSeesOuterBinding() {
        Node right = new Filter(t, new TestTable("orders"), new Ref(s));
        Join join = new Join(s, t, new TestTable("users"), right, JoinType.LEFT, LiteralNode.of(true));
        Bind bind = new Bind(s, new TestTable("groups"), join);

        Bind result = (Bind) rule.apply(bind);

        Join newJoin = (Join) result.select();
        Filter newRight = (Filter) newJoin.right();
        assertThat(newRight.where()).isEqualTo(new Ref(result.generator()));
        assertThat(newRight.where()).isNotEqualTo(new Ref(newJoin.leftGen()));
    }

    @Test
    @DisplayName("Let definitions can refer to each other in any order")
    void testLetDynamic() {
        LetDynamic let = new LetDynamic(
            List.of(new Generator(s, new Pure(new Ref(t))), new Generator(t, LiteralNode.of(1))),
            new ProductNode(new Ref(s), new Ref(t)));

        LetDynamic result = (LetDynamic) rule.apply(let);

        Symbol newS = result.defs().get(0).symbol();
        Symbol newT = result.defs().get(1).symbol();
        assertThat(result.defs().get(0).source()).isEqualTo(new Pure(new Ref(newT)));
        assertThat(result.in()).isEqualTo(new ProductNode(new Ref(newS), new Ref(newT)));
    }

    @Test
    @DisplayName("Free references, field symbols and function symbols are untouched")
    void testUntouchedSymbols() {
        Symbol free = new AnonSymbol();
        Node freeRef = new Ref(free);
        Node where = new Apply(gt, List.of(new Select(freeRef, age), Path.of(s, age)));
        Filter filter = new Filter(s, new TestTable("users"), where);

        Filter result = (Filter) rule.apply(filter);

        Apply newWhere = (Apply) result.where();
        Select freeSelect = (Select) newWhere.children().get(0);
        assertThat(newWhere.symbol()).isSameAs(gt);
        assertThat(freeSelect).isSameAs(where.children().get(0));
        assertThat(freeSelect.in()).isSameAs(freeRef);
        assertThat(((Select) newWhere.children().get(1)).field()).isSameAs(age);
    }

    @Test
    @DisplayName("A tree without bindings is returned unchanged")
    void testNoBindings() {
        Node tree = new ProductNode(new Ref(s), LiteralNode.of(1));

        assertThat(rule.apply(tree)).isSameAs(tree);
    }

    @Test
    @DisplayName("Runs once through an optimizer limited to one iteration")
    void testThroughOptimizer() {
        QueryOptimizer optimizer = new QueryOptimizer(
            List.of(new ResolveDelegates(), rule), OptimizerConfig.defaults().withMaxIterations(1));
        Node tree = new Filter(s, new Filter(t, new TestTable("users"), LiteralNode.of(true)), ageAbove(s, 30));

        Filter result = (Filter) optimizer.optimize(tree);

        assertThat(result.from()).isEqualTo(new TestTable("users"));
        assertThat(result.generator()).isNotEqualTo(s);
        assertThat(result.where()).isEqualTo(ageAbove(result.generator(), 30));
    }
}
