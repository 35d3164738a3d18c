package org.tablegen.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for tablegen.
 * Generates Go structs from the tables of a PostgreSQL, MySQL, Oracle or SQLite database.
 */
@CommandLine.Command(
        name = "tablegen",
        mixinStandardHelpOptions = true,
        version = "tablegen 1.0",
        description = "데이터베이스 테이블 메타데이터로 Go struct를 생성하는 툴",
        subcommands = {
                GenerateCommand.class
        }
)
public class TablegenCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new TablegenCli()).execute(args);
        System.exit(exitCode);
    }
}
