package product.sorter.report;

import java.time.Instant;

import product.sorter.config.SorterConfig;
import product.sorter.pipeline.MaterializationResult;

/**
 * Flat, Gson-friendly snapshot of a materialization run.
 */
public class MaterializationReport {
    public final String status;
    public final String source;
    public final int batchSize;
    public final boolean atomicPublish;
    public final long linesRead;
    public final long validRecords;
    public final long rejectedLines;
    public final long blankLines;
    public final int batches;
    public final long durationMs;
    public final String completedAt;
    public final String failure; // null unless status is FAILED

    MaterializationReport(String status, String source, int batchSize, boolean atomicPublish,
                          long linesRead, long validRecords, long rejectedLines, long blankLines,
                          int batches, long durationMs, String completedAt, String failure) {
        this.status = status;
        this.source = source;
        this.batchSize = batchSize;
        this.atomicPublish = atomicPublish;
        this.linesRead = linesRead;
        this.validRecords = validRecords;
        this.rejectedLines = rejectedLines;
        this.blankLines = blankLines;
        this.batches = batches;
        this.durationMs = durationMs;
        this.completedAt = completedAt;
        this.failure = failure;
    }

    public static MaterializationReport of(MaterializationResult r, SorterConfig cfg) {
        String failure = r.failure() == null ? null
            : r.failure().getClass().getSimpleName() + ": " + r.failure().getMessage();
        return new MaterializationReport(
            r.state().name(),
            cfg.sourcePath().toString(),
            cfg.batchSize,
            cfg.atomicPublish,
            r.linesRead(),
            r.validRecords(),
            r.rejectedLines(),
            r.blankLines(),
            r.batches(),
            r.elapsed().toMillis(),
            Instant.now().toString(),
            failure
        );
    }
}
