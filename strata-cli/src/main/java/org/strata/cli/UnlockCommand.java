package org.strata.cli;

import org.strata.cli.service.MigrationSession;
import picocli.CommandLine;

@CommandLine.Command(
        name = "unlock",
        mixinStandardHelpOptions = true,
        description = "중단된 실행이 남긴 마이그레이션 락을 강제로 해제합니다."
)
public class UnlockCommand extends MigrationCommand {

    @Override
    protected int run(MigrationSession session) {
        boolean released = session.getMigrator().unlock();
        System.out.println(released ? "Lock released." : "No lock held.");
        return ExitCodes.OK;
    }
}
