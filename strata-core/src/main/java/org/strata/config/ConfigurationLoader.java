package org.strata.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.options.StrataOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

public class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final String CONFIG_FILE_NAME = StrataOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = StrataOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = StrataOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final UnaryOperator<String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, UnaryOperator<String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return 해석된 설정 맵 ({@link StrataOptions} 키)
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<StrataConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            // 설정 파일이 없으면 기본값 사용
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 strata.yaml을 찾습니다.
     */
    private Optional<StrataConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    log.debug("Loading configuration from {}", configFile);
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), StrataConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(StrataConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        var database = profileConfig.getDatabase();
        if (database != null) {
            putIfPresent(configMap, StrataOptions.Database.URL_KEY, database.getUrl());
            putIfPresent(configMap, StrataOptions.Database.USERNAME_KEY, database.getUsername());
            putIfPresent(configMap, StrataOptions.Database.PASSWORD_KEY, database.getPassword());
            putIfPresent(configMap, StrataOptions.Database.DIALECT_KEY, database.getDialect());
        }
        if (profileConfig.getMigrations() != null) {
            putIfPresent(configMap, StrataOptions.Migrations.DIRECTORY_KEY, profileConfig.getMigrations().getDirectory());
        }

        return configMap;
    }

    private static void putIfPresent(Map<String, String> map, String key, String value) {
        if (value != null && !value.isBlank()) {
            map.put(key, value);
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
            StrataOptions.Migrations.DIRECTORY_KEY, StrataOptions.Migrations.DIRECTORY_DEFAULT
        );
    }
}
