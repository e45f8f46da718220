package org.strata.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;

@Data
public class StrataConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    /**
     * 개별 프로파일 설정
     */
    @Data
    public static class ProfileConfiguration {

        @JsonProperty("database")
        private DatabaseConfiguration database;

        @JsonProperty("migrations")
        private MigrationsConfiguration migrations;
    }

    /**
     * 데이터베이스 관련 설정
     */
    @Data
    public static class DatabaseConfiguration {

        @JsonProperty("dialect")
        private String dialect;

        @JsonProperty("url")
        private String url;

        @JsonProperty("username")
        private String username;

        @ToString.Exclude
        @JsonProperty("password")
        private String password;
    }

    /**
     * 마이그레이션 파일 위치
     */
    @Data
    public static class MigrationsConfiguration {

        @JsonProperty("directory")
        private String directory;
    }
}
