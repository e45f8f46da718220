package org.strata.cli;

import org.strata.cli.service.MigrationSession;
import org.strata.migration.engine.RunReport;
import org.strata.migration.error.UnitExecutionException;
import picocli.CommandLine;

@CommandLine.Command(
        name = "downgrade",
        mixinStandardHelpOptions = true,
        description = "대상 버전까지 적용된 마이그레이션을 되돌립니다. (base: 전체 되돌리기)"
)
public class DowngradeCommand extends MigrationCommand {

    @CommandLine.Parameters(index = "0", arity = "1", description = "대상 버전 (unit id 또는 base)")
    private String target;

    @Override
    protected int run(MigrationSession session) {
        try {
            RunReport report = session.getMigrator().downgrade(target);
            ReportPrinter.print(report, "Already at " + target + ".");
            return ExitCodes.OK;
        } catch (UnitExecutionException e) {
            System.err.println("Downgrade failed at unit '" + e.getUnitId() + "': " + e.getCause().getMessage());
            return ExitCodes.FAILURE;
        }
    }

    @Override
    protected String failurePrefix() {
        return "Downgrade failed: ";
    }
}
