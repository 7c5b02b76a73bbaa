package com.graphtransliterator.compiler;

import com.graphtransliterator.api.model.TransliterationRule;
import com.graphtransliterator.runtime.model.GraphNode;
import com.graphtransliterator.runtime.model.MatchingGraph;
import com.graphtransliterator.runtime.model.NodeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GraphBuilderTest {

    private GraphBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new GraphBuilder();
    }

    private static TransliterationRule rule(String production, String... tokens) {
        return TransliterationRule.of(production, null, null, List.of(tokens), null, null);
    }

    @Test
    @DisplayName("Should share token nodes between rules with a common prefix")
    void shouldShareCommonPrefixes() {
        List<TransliterationRule> rules = List.of(rule("AB", "a", "b"), rule("A", "a"), rule("B", "b"));

        MatchingGraph graph = builder.build(rules);

        // Start, a, a->b, rule 0, rule 1, b, rule 2
        assertThat(graph.nodeCount()).isEqualTo(7);
        assertThat(graph.edgeCount()).isEqualTo(6);

        GraphNode.Start root = graph.root();
        assertThat(root.tokenChildren().keySet()).containsExactly("a", "b");
        assertThat(root.ruleChildren().toIntArray()).isEmpty();

        GraphNode.Token a = (GraphNode.Token) graph.node(root.tokenChildren().getInt("a"));
        assertThat(a.token()).isEqualTo("a");
        assertThat(a.minRuleKey()).isZero();
        assertThat(a.tokenChildren().keySet()).containsExactly("b");

        GraphNode.Rule single = (GraphNode.Rule) graph.node(a.ruleChildren().getInt(0));
        assertThat(single.ruleKey()).isEqualTo(1);
        assertThat(single.matchLength()).isEqualTo(1);

        GraphNode.Token ab = (GraphNode.Token) graph.node(a.tokenChildren().getInt("b"));
        GraphNode.Rule pair = (GraphNode.Rule) graph.node(ab.ruleChildren().getInt(0));
        assertThat(pair.ruleKey()).isZero();
        assertThat(pair.matchLength()).isEqualTo(2);

        GraphNode.Token b = (GraphNode.Token) graph.node(root.tokenChildren().getInt("b"));
        assertThat(b.minRuleKey()).isEqualTo(2);
    }

    @Test
    @DisplayName("Rules over the same tokens should hang off one node in key order")
    void shouldOrderSiblingRulesByKey() {
        List<TransliterationRule> rules = List.of(
                TransliterationRule.of("A1", List.of("c"), null, List.of("a"), null, null),
                rule("A", "a"));

        MatchingGraph graph = builder.build(rules);

        GraphNode.Token a = (GraphNode.Token) graph.node(graph.root().tokenChildren().getInt("a"));
        assertThat(a.ruleChildren().toIntArray()).hasSize(2);

        GraphNode.Rule first = (GraphNode.Rule) graph.node(a.ruleChildren().getInt(0));
        GraphNode.Rule second = (GraphNode.Rule) graph.node(a.ruleChildren().getInt(1));
        assertThat(first.ruleKey()).isZero();
        assertThat(first.constraints().prevClasses()).containsExactly("c");
        assertThat(second.ruleKey()).isEqualTo(1);
        assertThat(second.constraints().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("A rule-less graph should consist of the start node alone")
    void shouldBuildEmptyGraph() {
        MatchingGraph graph = builder.build(List.of());

        assertThat(graph.nodeCount()).isEqualTo(1);
        assertThat(graph.edgeCount()).isZero();
        assertThat(graph.root().type()).isEqualTo(NodeType.START);
    }
}
