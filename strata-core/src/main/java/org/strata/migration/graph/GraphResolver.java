package org.strata.migration.graph;

import org.strata.migration.error.GraphException;
import org.strata.model.Direction;
import org.strata.model.PathStep;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the unit graph plus the currently applied heads into a linear execution path.
 *
 * <p>Symbolic targets: {@value #HEAD} (the single graph head), {@value #HEADS} (every graph
 * head) and {@value #BASE} (nothing applied; downgrade only).
 */
public class GraphResolver {

    public static final String HEAD = "head";
    public static final String HEADS = "heads";
    public static final String BASE = "base";

    /**
     * Resolves a path in whichever direction reaches {@code target} from {@code current}.
     */
    public List<PathStep> path(RegisteredGraph graph, Set<String> current, String target) {
        if (BASE.equals(target)) {
            return downgradePath(graph, current, target);
        }
        if (HEAD.equals(target) || HEADS.equals(target)) {
            return upgradePath(graph, current, target);
        }
        validateCurrent(graph, current);
        graph.unit(target);
        Set<String> applied = graph.ancestorsOf(current);
        if (applied.contains(target) && !current.contains(target)) {
            return downgradePath(graph, current, target);
        }
        return upgradePath(graph, current, target);
    }

    /**
     * Units to apply, ancestors first. Parent branches of a merge node that are not yet
     * applied are pulled into the path ahead of it. A target that is already applied yields
     * an empty path.
     */
    public List<PathStep> upgradePath(RegisteredGraph graph, Set<String> current, String target) {
        validateCurrent(graph, current);
        Collection<String> targets = resolveUpgradeTargets(graph, target);
        if (targets.isEmpty() || current.containsAll(targets) && current.size() == targets.size()) {
            return List.of();
        }

        Set<String> applied = graph.ancestorsOf(current);
        Set<String> needed = new LinkedHashSet<>(graph.ancestorsOf(targets));
        needed.removeAll(applied);

        return toSteps(graph, graph.topologicalOrder(needed), Direction.UPGRADE);
    }

    /**
     * Units to revert, descendants first. Only applied descendants of {@code target} are
     * reverted, so stepping back from a merge node leaves its parent branches applied.
     */
    public List<PathStep> downgradePath(RegisteredGraph graph, Set<String> current, String target) {
        validateCurrent(graph, current);
        if (target == null || target.isBlank() || HEAD.equals(target) || HEADS.equals(target)) {
            throw new GraphException(GraphException.Kind.INVALID_TARGET,
                    "Downgrade needs an explicit target version or '" + BASE + "'");
        }

        Set<String> applied = graph.ancestorsOf(current);
        Set<String> revert;
        if (BASE.equals(target)) {
            revert = applied;
        } else {
            graph.unit(target);
            if (!applied.contains(target)) {
                throw new GraphException(GraphException.Kind.INVALID_TARGET,
                        "Cannot downgrade to '" + target + "': it is not applied (current " + current + ")");
            }
            revert = new LinkedHashSet<>(graph.descendantsOf(target));
            revert.retainAll(applied);
        }

        List<String> order = new ArrayList<>(graph.topologicalOrder(revert));
        Collections.reverse(order);
        return toSteps(graph, order, Direction.DOWNGRADE);
    }

    private Collection<String> resolveUpgradeTargets(RegisteredGraph graph, String target) {
        if (target == null || target.isBlank() || HEAD.equals(target)) {
            List<String> heads = graph.heads();
            if (heads.size() > 1) {
                throw new GraphException(GraphException.Kind.MULTIPLE_UNMERGED_HEADS,
                        "Graph has unmerged heads " + heads + "; add a merge unit or upgrade to '"
                                + HEADS + "' or a specific version");
            }
            return heads;
        }
        if (HEADS.equals(target)) {
            return graph.heads();
        }
        if (BASE.equals(target)) {
            throw new GraphException(GraphException.Kind.INVALID_TARGET, "Cannot upgrade to '" + BASE + "'");
        }
        return List.of(graph.unit(target).getId());
    }

    private void validateCurrent(RegisteredGraph graph, Set<String> current) {
        for (String id : current) {
            if (!graph.contains(id)) {
                throw new GraphException(GraphException.Kind.UNKNOWN_VERSION,
                        "Store records version '" + id + "' which is not among the known migration units");
            }
        }
    }

    private List<PathStep> toSteps(RegisteredGraph graph, List<String> ids, Direction direction) {
        return ids.stream().map(id -> new PathStep(graph.unit(id), direction)).toList();
    }
}
