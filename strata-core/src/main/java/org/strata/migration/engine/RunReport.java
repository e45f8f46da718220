package org.strata.migration.engine;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one run. A failed unit is reported through an exception instead.
 */
@Getter
public class RunReport {

    private final List<UnitOutcome> outcomes = new ArrayList<>();
    private boolean cancelled;

    void record(UnitOutcome outcome) {
        outcomes.add(outcome);
    }

    void markCancelled() {
        this.cancelled = true;
    }

    public List<UnitOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public List<String> completedUnits() {
        return outcomes.stream()
                .filter(o -> o.state() == UnitState.APPLIED)
                .map(UnitOutcome::unitId)
                .toList();
    }

    public boolean isEmpty() {
        return outcomes.isEmpty();
    }

    public static RunReport empty() {
        return new RunReport();
    }
}
