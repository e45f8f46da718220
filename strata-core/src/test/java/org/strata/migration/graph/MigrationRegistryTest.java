package org.strata.migration.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.strata.migration.error.GraphException;
import org.strata.model.MigrationUnit;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.strata.testing.Fixtures.unit;

class MigrationRegistryTest {

    private final MigrationRegistry registry = new MigrationRegistry();

    @Test
    @DisplayName("중복 id는 DUPLICATE_ID로 거부한다")
    void duplicateId() {
        List<MigrationUnit> units = List.of(unit("A"), unit("B", "A"), unit("A"));

        assertThatThrownBy(() -> registry.load(units))
                .isInstanceOf(GraphException.class)
                .extracting(e -> ((GraphException) e).getKind())
                .isEqualTo(GraphException.Kind.DUPLICATE_ID);
    }

    @Test
    @DisplayName("존재하지 않는 부모를 참조하면 DANGLING_PARENT")
    void danglingParent() {
        List<MigrationUnit> units = List.of(unit("A"), unit("B", "missing"));

        assertThatThrownBy(() -> registry.load(units))
                .isInstanceOf(GraphException.class)
                .hasMessageContaining("missing")
                .extracting(e -> ((GraphException) e).getKind())
                .isEqualTo(GraphException.Kind.DANGLING_PARENT);
    }

    @Test
    @DisplayName("부모 링크가 순환하면 CYCLE과 함께 경로를 보고한다")
    void cycle() {
        List<MigrationUnit> units = List.of(unit("root"), unit("A", "root", "C"), unit("B", "A"), unit("C", "B"));

        assertThatThrownBy(() -> registry.load(units))
                .isInstanceOf(GraphException.class)
                .hasMessageContaining("->")
                .extracting(e -> ((GraphException) e).getKind())
                .isEqualTo(GraphException.Kind.CYCLE);
    }

    @Test
    @DisplayName("유효한 그래프는 head, 자식 관계를 제공한다")
    void validGraph() {
        RegisteredGraph graph = registry.load(List.of(
                unit("A"), unit("B1", "A"), unit("B2", "A"), unit("M", "B1", "B2")));

        assertThat(graph.size()).isEqualTo(4);
        assertThat(graph.heads()).containsExactly("M");
        assertThat(graph.childrenOf("A")).containsExactly("B1", "B2");
        assertThat(graph.unit("M").isMerge()).isTrue();
        assertThat(graph.unit("A").isRoot()).isTrue();
    }

    @Test
    @DisplayName("빈 unit 목록도 로드된다")
    void emptyGraph() {
        RegisteredGraph graph = registry.load(List.of());

        assertThat(graph.size()).isZero();
        assertThat(graph.heads()).isEmpty();
    }
}
