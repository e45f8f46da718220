package org.strata.migration.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;
import org.junit.jupiter.api.Test;
import org.strata.migration.error.GraphException;
import org.strata.model.Direction;
import org.strata.model.MigrationUnit;
import org.strata.model.PathStep;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.strata.testing.Fixtures.graph;
import static org.strata.testing.Fixtures.unit;

class GraphResolverTest {

    private final GraphResolver resolver = new GraphResolver();

    private static List<String> render(List<PathStep> path) {
        return path.stream().map(PathStep::toString).toList();
    }

    private static GraphException.Kind kindOf(Throwable t) {
        return ((GraphException) t).getKind();
    }

    @Nested
    @DisplayName("선형 A -> B -> C")
    class Linear {
        private final RegisteredGraph g = graph(unit("A"), unit("B", "A"), unit("C", "B"));

        @Test
        @DisplayName("빈 상태에서 head까지 순서대로 적용한다")
        void upgradeFromEmpty() {
            assertThat(render(resolver.upgradePath(g, Set.of(), GraphResolver.HEAD)))
                    .containsExactly("+A", "+B", "+C");
        }

        @Test
        @DisplayName("이미 적용된 부분은 건너뛴다")
        void upgradeFromMiddle() {
            assertThat(render(resolver.upgradePath(g, Set.of("A"), GraphResolver.HEAD)))
                    .containsExactly("+B", "+C");
        }

        @Test
        @DisplayName("현재 버전과 대상이 같으면 빈 경로")
        void samePosition() {
            assertThat(resolver.upgradePath(g, Set.of("C"), GraphResolver.HEAD)).isEmpty();
            assertThat(resolver.path(g, Set.of("B"), "B")).isEmpty();
        }

        @Test
        @DisplayName("이미 지난 버전으로 upgrade하면 아무것도 하지 않는다")
        void upgradeToAppliedAncestor() {
            assertThat(resolver.upgradePath(g, Set.of("C"), "A")).isEmpty();
        }

        @Test
        @DisplayName("downgrade는 후손부터 역순으로 되돌린다")
        void downgradeToA() {
            assertThat(render(resolver.downgradePath(g, Set.of("C"), "A")))
                    .containsExactly("-C", "-B");
        }

        @Test
        @DisplayName("base로 downgrade하면 전부 되돌린다")
        void downgradeToBase() {
            assertThat(render(resolver.downgradePath(g, Set.of("C"), GraphResolver.BASE)))
                    .containsExactly("-C", "-B", "-A");
        }

        @Test
        @DisplayName("path는 대상 위치에 따라 방향을 고른다")
        void pathPicksDirection() {
            assertThat(render(resolver.path(g, Set.of("C"), "A"))).containsExactly("-C", "-B");
            assertThat(render(resolver.path(g, Set.of("A"), "C"))).containsExactly("+B", "+C");
            assertThat(render(resolver.path(g, Set.of("B"), GraphResolver.BASE))).containsExactly("-B", "-A");
        }

        @Test
        @DisplayName("적용되지 않은 버전으로 downgrade하면 INVALID_TARGET")
        void downgradeToUnapplied() {
            assertThatThrownBy(() -> resolver.downgradePath(g, Set.of("A"), "C"))
                    .isInstanceOf(GraphException.class)
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(GraphException.Kind.INVALID_TARGET));
        }

        @Test
        @DisplayName("downgrade 대상으로 head는 허용하지 않는다")
        void downgradeToHead() {
            assertThatThrownBy(() -> resolver.downgradePath(g, Set.of("C"), GraphResolver.HEAD))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(GraphException.Kind.INVALID_TARGET));
        }

        @Test
        @DisplayName("저장소에 기록된 버전을 모르면 UNKNOWN_VERSION")
        void unknownCurrent() {
            assertThatThrownBy(() -> resolver.upgradePath(g, Set.of("zzz"), GraphResolver.HEAD))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(GraphException.Kind.UNKNOWN_VERSION));
        }

        @Test
        @DisplayName("알 수 없는 대상은 UNKNOWN_VERSION")
        void unknownTarget() {
            assertThatThrownBy(() -> resolver.upgradePath(g, Set.of(), "zzz"))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(GraphException.Kind.UNKNOWN_VERSION));
        }
    }

    @Nested
    @DisplayName("분기와 merge")
    class BranchAndMerge {
        private final RegisteredGraph g = graph(unit("A"), unit("B1", "A"), unit("B2", "A"), unit("M", "B1", "B2"));

        @Test
        @DisplayName("merge는 두 분기가 모두 적용된 뒤에 온다")
        void mergeAfterBothBranches() {
            assertThat(render(resolver.upgradePath(g, Set.of(), GraphResolver.HEAD)))
                    .containsExactly("+A", "+B1", "+B2", "+M");
        }

        @Test
        @DisplayName("빠진 분기는 merge 앞에 자동으로 끼워 넣는다")
        void missingBranchInserted() {
            assertThat(render(resolver.upgradePath(g, Set.of("B1"), "M")))
                    .containsExactly("+B2", "+M");
        }

        @Test
        @DisplayName("두 분기가 head인 상태에서 merge만 적용한다")
        void mergeFromBothHeads() {
            assertThat(render(resolver.upgradePath(g, Set.of("B1", "B2"), GraphResolver.HEAD)))
                    .containsExactly("+M");
        }

        @Test
        @DisplayName("merge를 되돌려도 부모 분기는 되돌리지 않는다")
        void downgradeMergeKeepsBranches() {
            assertThat(render(resolver.downgradePath(g, Set.of("M"), "B1")))
                    .containsExactly("-M");
        }

        @Test
        @DisplayName("base로 되돌리면 merge, 분기, 루트 순서")
        void downgradeAll() {
            assertThat(render(resolver.downgradePath(g, Set.of("M"), GraphResolver.BASE)))
                    .containsExactly("-M", "-B2", "-B1", "-A");
        }
    }

    @Nested
    @DisplayName("merge 되지 않은 head")
    class UnmergedHeads {
        private final RegisteredGraph g = graph(unit("A"), unit("B1", "A"), unit("B2", "A"));

        @Test
        @DisplayName("head가 둘 이상이면 MULTIPLE_UNMERGED_HEADS")
        void headIsAmbiguous() {
            assertThatThrownBy(() -> resolver.upgradePath(g, Set.of(), GraphResolver.HEAD))
                    .satisfies(e -> assertThat(kindOf(e)).isEqualTo(GraphException.Kind.MULTIPLE_UNMERGED_HEADS));
        }

        @Test
        @DisplayName("heads는 모든 head까지 적용한다")
        void headsAppliesAll() {
            assertThat(render(resolver.upgradePath(g, Set.of(), GraphResolver.HEADS)))
                    .containsExactly("+A", "+B1", "+B2");
        }

        @Test
        @DisplayName("특정 분기만 지정해 적용할 수 있다")
        void singleBranch() {
            assertThat(render(resolver.upgradePath(g, Set.of(), "B2")))
                    .containsExactly("+A", "+B2");
        }
    }

    @RepeatedTest(20)
    @DisplayName("무작위 DAG: 모든 unit은 부모 뒤에 정확히 한 번 나오고, 결과는 결정적이다")
    void topologicalProperty(RepetitionInfo info) {
        RegisteredGraph g = randomDag(new Random(info.getCurrentRepetition()), 25);

        List<PathStep> first = resolver.upgradePath(g, Set.of(), GraphResolver.HEADS);
        List<PathStep> second = resolver.upgradePath(g, Set.of(), GraphResolver.HEADS);

        assertThat(render(first)).isEqualTo(render(second));
        assertThat(first).hasSize(g.size());
        Map<String, Integer> position = new HashMap<>();
        for (int i = 0; i < first.size(); i++) {
            assertThat(first.get(i).direction()).isEqualTo(Direction.UPGRADE);
            position.put(first.get(i).unitId(), i);
        }
        for (PathStep step : first) {
            for (String parent : step.unit().getParentIds()) {
                assertThat(position.get(parent)).isLessThan(position.get(step.unitId()));
            }
        }

        List<PathStep> back = resolver.downgradePath(g, Set.copyOf(g.heads()), GraphResolver.BASE);
        Map<String, Integer> backPosition = new HashMap<>();
        for (int i = 0; i < back.size(); i++) {
            backPosition.put(back.get(i).unitId(), i);
        }
        assertThat(back).hasSize(g.size());
        for (PathStep step : back) {
            for (String parent : step.unit().getParentIds()) {
                assertThat(backPosition.get(parent)).isGreaterThan(backPosition.get(step.unitId()));
            }
        }
    }

    private static RegisteredGraph randomDag(Random random, int size) {
        List<MigrationUnit> units = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            MigrationUnit.MigrationUnitBuilder builder = MigrationUnit.builder().id(String.format("u%02d", i));
            if (i > 0) {
                int parents = 1 + random.nextInt(Math.min(i, 3));
                for (int p = 0; p < parents; p++) {
                    builder.parentId(String.format("u%02d", random.nextInt(i)));
                }
            }
            units.add(builder.build());
        }
        return new MigrationRegistry().load(units);
    }
}
