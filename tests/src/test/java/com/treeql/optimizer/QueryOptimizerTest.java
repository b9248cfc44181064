package com.treeql.optimizer;

import com.treeql.ast.Filter;
import com.treeql.ast.LiteralNode;
import com.treeql.ast.Node;
import com.treeql.ast.Nodes;
import com.treeql.ast.Path;
import com.treeql.ast.ProductNode;
import com.treeql.ast.Take;
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
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the fixpoint optimizer driver and the delegate resolution rule.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("QueryOptimizer Tests")
public class QueryOptimizerTest extends TestBase {

    private final Symbol s = new AnonSymbol();

    private OptimizationRule counting(AtomicInteger counter, OptimizationRule rule) {
        return node -> {
            counter.incrementAndGet();
            return rule.apply(node);
        };
    }

    @Nested
    @DisplayName("Fixpoint driver")
    class FixpointDriver {

        @Test
        @DisplayName("Default optimizer resolves delegates")
        void testDefaultRules() {
            QueryOptimizer optimizer = new QueryOptimizer();

            assertThat(optimizer.config().maxIterations()).isEqualTo(OptimizerConfig.DEFAULT_MAX_ITERATIONS);
            assertThat(optimizer.rules()).hasSize(1);
            assertThat(optimizer.rules().get(0)).isInstanceOf(ResolveDelegates.class);
            assertThat(optimizer.rules().get(0).name()).isEqualTo("ResolveDelegates");
        }

        @Test
        @DisplayName("A tree with nothing to rewrite is returned as the same instance after one pass")
        void testNoChange() {
            AtomicInteger applications = new AtomicInteger();
            QueryOptimizer optimizer = new QueryOptimizer(
                List.of(counting(applications, new ResolveDelegates())), OptimizerConfig.defaults());
            Node tree = new Take(new TestTable("users"), 5, s);

            Node result = optimizer.optimize(tree);

            assertThat(result).isSameAs(tree);
            assertThat(applications.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("A rule returning an equal copy also ends the loop")
        void testEqualCopyEndsLoop() {
            AtomicInteger applications = new AtomicInteger();
            OptimizationRule copy = node -> node.rebuild(node.children());
            QueryOptimizer optimizer = new QueryOptimizer(
                List.of(counting(applications, copy)), OptimizerConfig.defaults());
            Node tree = new ProductNode(LiteralNode.of(1));

            Node result = optimizer.optimize(tree);

            assertThat(result).isEqualTo(tree);
            assertThat(applications.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("A rule that never settles stops at the iteration limit")
        void testIterationLimit() {
            AtomicInteger applications = new AtomicInteger();
            QueryOptimizer optimizer = new QueryOptimizer(
                List.of(counting(applications, new AssignUniqueSymbols())),
                OptimizerConfig.defaults().withMaxIterations(3));
            Node tree = new Take(new TestTable("users"), 5, s);

            Node result = optimizer.optimize(tree);

            assertThat(applications.get()).isEqualTo(3);
            assertThat(((Take) result).generator()).isNotEqualTo(s);
        }

        @Test
        @DisplayName("Rules run in order within an iteration")
        void testRuleOrder() {
            StringBuilder order = new StringBuilder();
            OptimizationRule first = node -> {
                order.append('a');
                return node;
            };
            OptimizationRule second = node -> {
                order.append('b');
                return node;
            };

            new QueryOptimizer(List.of(first, second), OptimizerConfig.defaults())
                .optimize(LiteralNode.of(1));

            assertThat(order.toString()).isEqualTo("ab");
        }

        @Test
        @DisplayName("A rule returning null is reported")
        void testNullRule() {
            QueryOptimizer optimizer = new QueryOptimizer(List.of(node -> null), OptimizerConfig.defaults());

            assertThatThrownBy(() -> optimizer.optimize(LiteralNode.of(1)))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("returned null");
        }

        @Test
        @DisplayName("Tree dumps can be enabled without changing the result")
        void testDumpTrees() {
            QueryOptimizer optimizer = new QueryOptimizer(
                QueryOptimizer.createDefaultRules(), OptimizerConfig.defaults().withDumpTrees(true));
            Node table = new TestTable("users");

            assertThat(optimizer.optimize(new Filter(s, table, LiteralNode.of(true)))).isSameAs(table);
        }
    }

    @Nested
    @DisplayName("ResolveDelegates")
    class ResolveDelegatesTests {

        @Test
        @DisplayName("Trivial filters are removed at any depth")
        void testNestedTrivialFilters() {
            Node table = new TestTable("users");
            Node inner = new Filter(s, table, LiteralNode.of(true));
            Node tree = new Take(new Filter(new AnonSymbol(), inner, LiteralNode.of(true)), 10, s);

            logStep("When: resolving delegates");
            Node result = new ResolveDelegates().apply(tree);

            logStep("Then: both filters are gone");
            assertThat(result).isEqualTo(new Take(table, 10, s));
            assertThat(((Take) result).from()).isSameAs(table);
            assertThat(Nodes.collect(result, n -> n instanceof Filter)).isEmpty();
        }

        @Test
        @DisplayName("Non-trivial filters stay")
        void testRealFilterStays() {
            Node where = Path.of(s, FieldSymbol.of("active"));
            Node tree = new Filter(s, new TestTable("users"), where);

            assertThat(new ResolveDelegates().apply(tree)).isSameAs(tree);
        }

        @Test
        @DisplayName("A filter whose predicate becomes true is removed in the same pass")
        void testPredicateBecomesTrue() {
            Node table = new TestTable("users");
            Node wrapped = new Filter(new AnonSymbol(), LiteralNode.of(true), LiteralNode.of(true));
            Node tree = new Filter(s, table, wrapped);

            assertThat(new ResolveDelegates().apply(tree)).isSameAs(table);
        }
    }
}
