package org.strata.migration.graph;

import org.strata.migration.error.GraphException;
import org.strata.model.Direction;
import org.strata.model.MigrationUnit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Validated, immutable DAG of migration units. Instances are only produced by
 * {@link MigrationRegistry#load(Collection)}, so every parent reference resolves and there
 * are no cycles.
 */
public final class RegisteredGraph {

    private final Map<String, MigrationUnit> units;
    private final Map<String, List<String>> children;

    RegisteredGraph(Map<String, MigrationUnit> units) {
        this.units = Collections.unmodifiableMap(new LinkedHashMap<>(units));
        Map<String, List<String>> childMap = new HashMap<>();
        units.keySet().forEach(id -> childMap.put(id, new ArrayList<>()));
        for (MigrationUnit unit : units.values()) {
            for (String parent : unit.getParentIds()) {
                childMap.get(parent).add(unit.getId());
            }
        }
        childMap.values().forEach(Collections::sort);
        this.children = childMap;
    }

    public MigrationUnit unit(String id) {
        MigrationUnit unit = units.get(id);
        if (unit == null) {
            throw new GraphException(GraphException.Kind.UNKNOWN_VERSION, "No migration unit with id '" + id + "'");
        }
        return unit;
    }

    public boolean contains(String id) {
        return units.containsKey(id);
    }

    public Collection<MigrationUnit> units() {
        return units.values();
    }

    public int size() {
        return units.size();
    }

    public List<String> childrenOf(String id) {
        return Collections.unmodifiableList(children.getOrDefault(id, List.of()));
    }

    /**
     * Units nothing else builds upon, sorted by id.
     */
    public List<String> heads() {
        return units.keySet().stream()
                .filter(id -> children.get(id).isEmpty())
                .sorted()
                .toList();
    }

    /**
     * Every unit reachable through parent links from {@code ids}, including {@code ids}.
     */
    public Set<String> ancestorsOf(Collection<String> ids) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        for (String id : ids) {
            stack.push(unit(id).getId());
        }
        while (!stack.isEmpty()) {
            String id = stack.pop();
            if (seen.add(id)) {
                units.get(id).getParentIds().forEach(stack::push);
            }
        }
        return seen;
    }

    /**
     * Every unit that builds on {@code id}, excluding {@code id} itself.
     */
    public Set<String> descendantsOf(String id) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>(childrenOf(unit(id).getId()));
        while (!stack.isEmpty()) {
            String next = stack.pop();
            if (seen.add(next)) {
                children.get(next).forEach(stack::push);
            }
        }
        return seen;
    }

    /**
     * Orders {@code subset} so that every unit follows all of its parents that are part of
     * the subset. Among units that are ready at the same time the smallest id goes first,
     * which keeps the order reproducible across runs.
     */
    public List<String> topologicalOrder(Set<String> subset) {
        Map<String, Integer> pending = new HashMap<>();
        PriorityQueue<String> ready = new PriorityQueue<>();
        for (String id : subset) {
            int inSubset = (int) unit(id).getParentIds().stream().filter(subset::contains).count();
            pending.put(id, inSubset);
            if (inSubset == 0) {
                ready.add(id);
            }
        }

        List<String> ordered = new ArrayList<>(subset.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            ordered.add(id);
            for (String child : children.get(id)) {
                Integer remaining = pending.get(child);
                if (remaining == null) continue;
                if (remaining == 1) {
                    pending.remove(child);
                    ready.add(child);
                } else {
                    pending.put(child, remaining - 1);
                }
            }
            pending.remove(id);
        }
        return ordered;
    }

    /**
     * Computes the applied-head set after running {@code unit} in {@code direction}.
     *
     * <p>Going forward the unit replaces whichever of its parents are current heads (a merge
     * replaces several at once). Going backward the unit is replaced by those parents that
     * are not already covered by another remaining head.
     */
    public Set<String> headsAfter(Set<String> current, MigrationUnit unit, Direction direction) {
        Set<String> next = new TreeSet<>(current);
        if (direction == Direction.UPGRADE) {
            unit.getParentIds().forEach(next::remove);
            next.add(unit.getId());
            return next;
        }

        next.remove(unit.getId());
        for (String parent : unit.getParentIds()) {
            boolean covered = false;
            for (String head : next) {
                if (head.equals(parent) || ancestorsOf(List.of(head)).contains(parent)) {
                    covered = true;
                    break;
                }
            }
            if (!covered) {
                next.add(parent);
            }
        }
        return next;
    }
}
