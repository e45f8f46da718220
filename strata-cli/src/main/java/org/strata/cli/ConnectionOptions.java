package org.strata.cli;

import lombok.Getter;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Options shared by every command. Unset options fall back to the active profile in
 * {@code strata.yaml}.
 */
@Getter
public class ConnectionOptions {

    @CommandLine.Option(names = "--url", description = "대상 DB JDBC URL (예: jdbc:sqlite:app.db)")
    private String url;

    @CommandLine.Option(names = {"-u", "--user"}, description = "DB 사용자")
    private String user;

    @CommandLine.Option(names = "--password", description = "DB 비밀번호")
    private String password;

    @CommandLine.Option(names = {"-d", "--dialect"}, description = "DB 방언 (sqlite, mysql). 생략 시 URL에서 추론")
    private String dialect;

    @CommandLine.Option(names = "--units", description = "마이그레이션 unit 파일 폴더")
    private Path unitsDirectory;

    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    private String profile;
}
