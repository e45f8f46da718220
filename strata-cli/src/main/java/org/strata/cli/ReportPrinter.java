package org.strata.cli;

import org.strata.migration.engine.RunReport;
import org.strata.migration.engine.UnitOutcome;
import org.strata.model.Direction;

final class ReportPrinter {

    private ReportPrinter() {
    }

    static void print(RunReport report, String emptyMessage) {
        if (report.isEmpty() && !report.isCancelled()) {
            System.out.println(emptyMessage);
            return;
        }
        for (UnitOutcome outcome : report.getOutcomes()) {
            String verb = outcome.direction() == Direction.UPGRADE ? "Applied" : "Reverted";
            System.out.printf("%s %s (%d applied, %d skipped) [%s]%n",
                    verb, outcome.unitId(), outcome.appliedOperations(), outcome.skippedOperations(), outcome.state());
        }
        if (report.isCancelled()) {
            System.out.println("Run cancelled; re-run the command to continue.");
        }
    }
}
