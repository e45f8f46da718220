package org.strata.migration.loader;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.strata.migration.error.UnitFileException;
import org.strata.model.MigrationUnit;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Reads one unit per {@code .yaml}, {@code .yml} or {@code .json} file from a directory.
 * Files are read in name order; graph order comes from {@code down_revision} alone.
 */
public class UnitFileLoader {

    private static final Logger log = LoggerFactory.getLogger(UnitFileLoader.class);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final ObjectMapper jsonMapper = new ObjectMapper();

    public List<MigrationUnit> loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new UnitFileException(directory, "units directory does not exist");
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(UnitFileLoader::isUnitFile)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UnitFileException(directory, "cannot list units directory", e);
        }

        List<MigrationUnit> units = new ArrayList<>();
        for (Path file : files) {
            units.add(load(file));
        }
        log.debug("Loaded {} unit(s) from {}", units.size(), directory);
        return units;
    }

    public MigrationUnit load(Path file) {
        ObjectMapper mapper = isJson(file) ? jsonMapper : yamlMapper;
        UnitDocument doc;
        try {
            doc = mapper.readValue(file.toFile(), UnitDocument.class);
        } catch (IOException e) {
            throw new UnitFileException(file, "cannot parse unit: " + e.getMessage(), e);
        }
        if (doc == null || doc.getId() == null || doc.getId().isBlank()) {
            throw new UnitFileException(file, "unit has no id");
        }

        MigrationUnit.MigrationUnitBuilder builder = MigrationUnit.builder()
                .id(doc.getId())
                .description(doc.getDescription());
        if (doc.getDownRevision() != null) {
            doc.getDownRevision().stream()
                    .filter(parent -> parent != null && !parent.isBlank())
                    .forEach(builder::parentId);
        }
        if (doc.getUpgrade() != null) {
            builder.forwardOps(doc.getUpgrade());
        }
        if (doc.getDowngrade() != null) {
            builder.backwardOps(doc.getDowngrade());
        }
        return builder.build();
    }

    private static boolean isUnitFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }

    private static boolean isJson(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json");
    }
}
