package org.strata.cli;

import org.strata.cli.service.MigrationSession;
import picocli.CommandLine;

@CommandLine.Command(
        name = "heads",
        mixinStandardHelpOptions = true,
        description = "버전 그래프의 head 목록을 출력합니다."
)
public class HeadsCommand extends MigrationCommand {

    @Override
    protected int run(MigrationSession session) {
        var heads = session.getGraph().heads();
        heads.forEach(System.out::println);
        if (heads.size() > 1) {
            System.out.println("(" + heads.size() + " unmerged heads)");
        }
        return ExitCodes.OK;
    }
}
