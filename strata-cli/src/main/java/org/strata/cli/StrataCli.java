package org.strata.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for the Strata schema migration engine.
 */
@CommandLine.Command(
        name = "strata",
        mixinStandardHelpOptions = true,
        version = "strata 1.0",
        description = "버전 그래프 기반의 스키마 마이그레이션 툴",
        subcommands = {
                UpgradeCommand.class,
                DowngradeCommand.class,
                HistoryCommand.class,
                CurrentCommand.class,
                HeadsCommand.class,
                UnlockCommand.class
        }
)
public class StrataCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new StrataCli()).execute(args);
        System.exit(exitCode);
    }
}
