package org.strata.cli;

import org.strata.cli.service.MigrationSession;
import org.strata.migration.graph.GraphResolver;
import picocli.CommandLine;

import java.util.Set;

@CommandLine.Command(
        name = "current",
        mixinStandardHelpOptions = true,
        description = "현재 적용된 버전(head)을 출력합니다."
)
public class CurrentCommand extends MigrationCommand {

    @Override
    protected int run(MigrationSession session) {
        Set<String> current = session.getMigrator().current();
        if (current.isEmpty()) {
            System.out.println(GraphResolver.BASE);
        } else {
            current.forEach(System.out::println);
        }
        return ExitCodes.OK;
    }
}
