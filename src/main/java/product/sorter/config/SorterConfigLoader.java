package product.sorter.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import product.sorter.model.SortKey;

/**
 * Loads a {@link SorterConfig} from an optional JSON file, e.g.
 * <pre>{"dataDir": "Data", "batchSize": 500, "defaultSortKey": "price"}</pre>
 * Absent properties keep their defaults.
 */
public class SorterConfigLoader {
    private final Gson gson = new Gson();

    /** Returns defaults for {@code defaultDataDir} when the file does not exist. */
    public SorterConfig load(Path file, Path defaultDataDir) {
        SorterConfig defaults = SorterConfig.defaultConfig(defaultDataDir);
        if (file == null || !Files.exists(file)) return defaults;
        ConfigFile raw;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            raw = gson.fromJson(reader, ConfigFile.class);
        } catch (IOException | JsonParseException e) {
            throw new IllegalArgumentException("Failed loading config file: " + file, e);
        }
        if (raw == null) return defaults;
        return new SorterConfig(
            raw.dataDir != null ? Paths.get(raw.dataDir) : defaults.dataDir,
            raw.sourceFile != null ? raw.sourceFile : defaults.sourceFileName,
            raw.batchSize != null ? raw.batchSize : defaults.batchSize,
            raw.defaultPageSize != null ? raw.defaultPageSize : defaults.defaultPageSize,
            raw.defaultSortKey != null ? SortKey.fromString(raw.defaultSortKey) : defaults.defaultSortKey,
            raw.atomicPublish != null ? raw.atomicPublish : defaults.atomicPublish,
            raw.writeReport != null ? raw.writeReport : defaults.writeReport
        );
    }

    // Gson target; boxed types so missing properties stay null
    private static final class ConfigFile {
        String dataDir;
        String sourceFile;
        Integer batchSize;
        Integer defaultPageSize;
        String defaultSortKey;
        Boolean atomicPublish;
        Boolean writeReport;
    }
}
