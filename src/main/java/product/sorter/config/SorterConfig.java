package product.sorter.config;

import java.nio.file.Path;
import java.nio.file.Paths;

import product.sorter.model.SortKey;

/**
 * Immutable settings shared by the materialization pipeline and the paginated reader.
 * Built once at startup and passed into constructors.
 */
public class SorterConfig {
    public static final String DEFAULT_SOURCE_FILE = "products.txt";
    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final int DEFAULT_PAGE_SIZE = 10;

    public final Path dataDir;
    public final String sourceFileName;
    public final int batchSize;
    public final int defaultPageSize;
    public final SortKey defaultSortKey;
    public final boolean atomicPublish;
    public final boolean writeReport;

    public SorterConfig(Path dataDir,
                        String sourceFileName,
                        int batchSize,
                        int defaultPageSize,
                        SortKey defaultSortKey,
                        boolean atomicPublish,
                        boolean writeReport) {
        if (dataDir == null) throw new IllegalArgumentException("dataDir must not be null");
        if (sourceFileName == null || sourceFileName.isBlank()) throw new IllegalArgumentException("sourceFileName must not be blank");
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        if (defaultPageSize < 1) throw new IllegalArgumentException("defaultPageSize must be >= 1, got " + defaultPageSize);
        this.dataDir = dataDir;
        this.sourceFileName = sourceFileName;
        this.batchSize = batchSize;
        this.defaultPageSize = defaultPageSize;
        this.defaultSortKey = defaultSortKey == null ? SortKey.ID : defaultSortKey;
        this.atomicPublish = atomicPublish;
        this.writeReport = writeReport;
    }

    public static SorterConfig defaultConfig(Path dataDir) {
        return new SorterConfig(
                dataDir,
                DEFAULT_SOURCE_FILE,
                DEFAULT_BATCH_SIZE,
                DEFAULT_PAGE_SIZE,
                SortKey.ID,
                true,    // write to temp files, rename on completion
                true     // materialization-report.json
        );
    }

    /**
     * Apply command line overrides on top of a base configuration.
     * Malformed numeric values raise IllegalArgumentException.
     */
    public static SorterConfig fromArgs(SorterConfig base, String[] args) {
        Path dataDir = base.dataDir;
        String sourceFileName = base.sourceFileName;
        int batchSize = base.batchSize;
        int pageSize = base.defaultPageSize;
        SortKey sortKey = base.defaultSortKey;
        boolean atomic = base.atomicPublish;
        boolean report = base.writeReport;

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--data-dir=")) {
                dataDir = Paths.get(s.substring("--data-dir=".length()));
            } else if (s.startsWith("--source=")) {
                sourceFileName = s.substring("--source=".length());
            } else if (s.startsWith("--batch-size=")) {
                batchSize = parseInt("--batch-size", s.substring("--batch-size=".length()));
            } else if (s.startsWith("--page-size=")) {
                pageSize = parseInt("--page-size", s.substring("--page-size=".length()));
            } else if (s.startsWith("--sort=")) {
                sortKey = SortKey.fromString(s.substring("--sort=".length()));
            } else if (s.equals("--no-atomic")) {
                atomic = false;
            } else if (s.equals("--no-report")) {
                report = false;
            }
        }
        return new SorterConfig(dataDir, sourceFileName, batchSize, pageSize, sortKey, atomic, report);
    }

    public Path sourcePath() { return dataDir.resolve(sourceFileName); }

    public Path sortedPath(SortKey key) { return dataDir.resolve(key.fileName()); }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + option + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return "SorterConfig{dataDir=" + dataDir +
               ", source=" + sourceFileName +
               ", batchSize=" + batchSize +
               ", defaultPageSize=" + defaultPageSize +
               ", defaultSortKey=" + defaultSortKey +
               ", atomicPublish=" + atomicPublish +
               ", writeReport=" + writeReport + "}";
    }
}
