package org.strata.migration.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.migration.error.GraphException;
import org.strata.model.MigrationUnit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link RegisteredGraph} from a set of units, rejecting duplicate ids, unknown
 * parents and cycles. Touches nothing outside the given units.
 */
public class MigrationRegistry {

    private static final Logger log = LoggerFactory.getLogger(MigrationRegistry.class);

    private enum Mark { VISITING, DONE }

    public RegisteredGraph load(Collection<MigrationUnit> units) {
        Map<String, MigrationUnit> byId = new LinkedHashMap<>();
        for (MigrationUnit unit : units) {
            if (byId.putIfAbsent(unit.getId(), unit) != null) {
                throw new GraphException(GraphException.Kind.DUPLICATE_ID,
                        "Migration unit id '" + unit.getId() + "' is declared more than once");
            }
        }

        for (MigrationUnit unit : byId.values()) {
            for (String parent : unit.getParentIds()) {
                if (!byId.containsKey(parent)) {
                    throw new GraphException(GraphException.Kind.DANGLING_PARENT,
                            "Unit '" + unit.getId() + "' references unknown parent '" + parent + "'");
                }
            }
        }

        Map<String, Mark> marks = new HashMap<>();
        for (String id : byId.keySet()) {
            if (!marks.containsKey(id)) {
                detectCycle(id, byId, marks, new ArrayList<>());
            }
        }

        RegisteredGraph graph = new RegisteredGraph(byId);
        log.debug("Registered {} migration units, heads={}", graph.size(), graph.heads());
        return graph;
    }

    private void detectCycle(String id, Map<String, MigrationUnit> byId, Map<String, Mark> marks, List<String> trail) {
        marks.put(id, Mark.VISITING);
        trail.add(id);
        for (String parent : byId.get(id).getParentIds()) {
            Mark mark = marks.get(parent);
            if (mark == Mark.VISITING) {
                List<String> cycle = new ArrayList<>(trail.subList(trail.indexOf(parent), trail.size()));
                cycle.add(parent);
                throw new GraphException(GraphException.Kind.CYCLE,
                        "Parent links form a cycle: " + String.join(" -> ", cycle));
            }
            if (mark == null) {
                detectCycle(parent, byId, marks, trail);
            }
        }
        trail.remove(trail.size() - 1);
        marks.put(id, Mark.DONE);
    }
}
