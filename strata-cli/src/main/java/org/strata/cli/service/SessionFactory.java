package org.strata.cli.service;

import org.strata.cli.ConnectionOptions;
import org.strata.config.ConfigurationLoader;
import org.strata.migration.graph.MigrationRegistry;
import org.strata.migration.graph.RegisteredGraph;
import org.strata.migration.loader.UnitFileLoader;
import org.strata.options.StrataOptions;

import java.nio.file.Path;
import java.util.Map;

/**
 * Resolves effective settings (CLI option &gt; profile in {@code strata.yaml} &gt; default)
 * and loads the unit graph.
 */
public class SessionFactory {

    private final ConfigurationLoader configurationLoader;
    private final UnitFileLoader unitFileLoader;

    public SessionFactory() {
        this(new ConfigurationLoader(), new UnitFileLoader());
    }

    public SessionFactory(ConfigurationLoader configurationLoader, UnitFileLoader unitFileLoader) {
        this.configurationLoader = configurationLoader;
        this.unitFileLoader = unitFileLoader;
    }

    public MigrationSession open(ConnectionOptions options) {
        ConnectionSettings settings = resolve(options);
        RegisteredGraph graph = new MigrationRegistry().load(unitFileLoader.loadDirectory(settings.getUnitsDirectory()));
        return new MigrationSession(settings, graph);
    }

    public ConnectionSettings resolve(ConnectionOptions options) {
        Map<String, String> config = configurationLoader.loadConfiguration(options.getProfile());
        Path units = options.getUnitsDirectory() != null
                ? options.getUnitsDirectory()
                : Path.of(config.getOrDefault(StrataOptions.Migrations.DIRECTORY_KEY,
                        StrataOptions.Migrations.DIRECTORY_DEFAULT));
        return ConnectionSettings.builder()
                .url(firstNonBlank(options.getUrl(), config.get(StrataOptions.Database.URL_KEY)))
                .user(firstNonBlank(options.getUser(), config.get(StrataOptions.Database.USERNAME_KEY)))
                .password(firstNonBlank(options.getPassword(), config.get(StrataOptions.Database.PASSWORD_KEY)))
                .dialect(firstNonBlank(options.getDialect(), config.get(StrataOptions.Database.DIALECT_KEY)))
                .unitsDirectory(units)
                .build();
    }

    private static String firstNonBlank(String cli, String configured) {
        return cli != null && !cli.isBlank() ? cli : configured;
    }
}
