package org.strata.cli;

import org.strata.cli.service.MigrationSession;
import org.strata.migration.engine.RunReport;
import org.strata.migration.error.UnitExecutionException;
import org.strata.migration.graph.GraphResolver;
import picocli.CommandLine;

@CommandLine.Command(
        name = "upgrade",
        mixinStandardHelpOptions = true,
        showDefaultValues = true,
        description = "대상 버전까지 마이그레이션을 적용합니다."
)
public class UpgradeCommand extends MigrationCommand {

    @CommandLine.Parameters(index = "0", arity = "0..1", defaultValue = GraphResolver.HEAD,
            description = "대상 버전 (head, heads 또는 unit id)")
    private String target;

    @Override
    protected int run(MigrationSession session) {
        try {
            RunReport report = session.getMigrator().upgrade(target);
            ReportPrinter.print(report, "Already at " + target + ".");
            return ExitCodes.OK;
        } catch (UnitExecutionException e) {
            System.err.println("Upgrade failed at unit '" + e.getUnitId() + "': " + e.getCause().getMessage());
            return ExitCodes.FAILURE;
        }
    }

    @Override
    protected String failurePrefix() {
        return "Upgrade failed: ";
    }
}
