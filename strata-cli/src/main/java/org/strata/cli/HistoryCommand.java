package org.strata.cli;

import org.strata.cli.service.MigrationSession;
import org.strata.model.HistoryEntry;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(
        name = "history",
        mixinStandardHelpOptions = true,
        description = "적용/되돌림 이력을 출력합니다."
)
public class HistoryCommand extends MigrationCommand {

    @Override
    protected int run(MigrationSession session) {
        List<HistoryEntry> history = session.getMigrator().history();
        if (history.isEmpty()) {
            System.out.println("No history.");
            return ExitCodes.OK;
        }
        for (HistoryEntry entry : history) {
            System.out.printf("%4d  %-9s %s  %s%n",
                    entry.getSequence(), entry.getDirection(), entry.getAppliedAt(), entry.getVersionId());
        }
        return ExitCodes.OK;
    }
}
