package product.sorter.pipeline;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import product.sorter.config.SorterConfig;
import product.sorter.model.Product;
import product.sorter.parse.ParseResult;
import product.sorter.parse.ProductParser;
import product.sorter.parse.RejectReason;
import product.sorter.report.MaterializationReport;
import product.sorter.report.ReportWriter;
import product.sorter.sort.BatchSorter;
import product.sorter.sort.SortedBatch;
import product.sorter.storage.MultiSinkWriter;

/**
 * Streams the source file, accumulates accepted products into batches of {@code batchSize},
 * and writes each batch's three orderings through a {@link MultiSinkWriter}.
 *
 * Memory is bounded by one batch. Each output file is a sequence of per-batch sorted runs;
 * global order holds when the whole source fits in one batch.
 *
 * State: IDLE -> READING -> (SORTING -> WRITING)* -> FLUSHING -> DONE,
 * or FAILED on a missing source / I/O error, or CANCELLED when the signal is seen between batches.
 */
public class MaterializationPipeline {
    private static final Logger log = LoggerFactory.getLogger(MaterializationPipeline.class);

    private final SorterConfig config;
    private final ReportWriter reportWriter;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile PipelineState state = PipelineState.IDLE;

    public MaterializationPipeline(SorterConfig config) {
        this.config = config;
        this.reportWriter = new ReportWriter(config.dataDir);
    }

    public PipelineState state() { return state; }

    /**
     * Run one materialization end to end. Never throws for I/O problems; they end the run as FAILED.
     *
     * @throws IllegalStateException if this pipeline is already running
     */
    public MaterializationResult run(CancellationSignal signal) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Materialization already running for " + config.dataDir);
        }
        try {
            MaterializationResult result = doRun(signal == null ? CancellationSignal.none() : signal);
            if (config.writeReport) writeReport(result);
            return result;
        } finally {
            running.set(false);
        }
    }

    private MaterializationResult doRun(CancellationSignal signal) {
        long t0 = System.nanoTime();
        Counters c = new Counters();
        Path source = config.sourcePath();
        state = PipelineState.IDLE;
        log.info("Materialization starting: source={} batchSize={}", source, config.batchSize);

        if (!Files.isRegularFile(source)) {
            log.error("Source file not found: {}", source);
            return finish(PipelineState.FAILED, c, t0, new NoSuchFileException(source.toString()));
        }

        state = PipelineState.READING;
        List<Product> batch = new ArrayList<>(config.batchSize);
        // malformed UTF-8 is replaced, so the parser decides on the damaged line
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(source), StandardCharsets.UTF_8));
             MultiSinkWriter writer = MultiSinkWriter.open(config.dataDir, config.atomicPublish)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (signal.isCancelled()) {
                    log.info("Cancellation observed after {} batches; discarding {} buffered records", c.batches, batch.size());
                    return finish(PipelineState.CANCELLED, c, t0, null);
                }
                c.linesRead++;
                ParseResult parsed = ProductParser.parse(line);
                if (!parsed.isAccepted()) {
                    if (parsed.reason() == RejectReason.BLANK) {
                        c.blankLines++;
                    } else {
                        c.rejectedLines++;
                        log.warn("Invalid product at line {} ({}): {}", c.linesRead, parsed.reason(), line);
                    }
                    continue;
                }
                batch.add(parsed.product());
                if (batch.size() >= config.batchSize) {
                    flushBatch(batch, writer, c);
                    state = PipelineState.READING;
                }
            }
            if (!batch.isEmpty()) {
                if (signal.isCancelled()) {
                    log.info("Cancellation observed before final batch; discarding {} buffered records", batch.size());
                    return finish(PipelineState.CANCELLED, c, t0, null);
                }
                flushBatch(batch, writer, c);
            }
            state = PipelineState.FLUSHING;
            writer.publish();
        } catch (IOException | RuntimeException e) {
            log.error("Materialization failed after {} batches", c.batches, e);
            return finish(PipelineState.FAILED, c, t0, e);
        }

        MaterializationResult result = finish(PipelineState.DONE, c, t0, null);
        log.info("Successfully generated sorted product files with {} valid products ({} rejected, {} batches) in {} ms",
            c.validRecords, c.rejectedLines, c.batches, result.elapsed().toMillis());
        return result;
    }

    private void flushBatch(List<Product> batch, MultiSinkWriter writer, Counters c) throws IOException {
        state = PipelineState.SORTING;
        SortedBatch sorted = BatchSorter.sortBatch(batch);
        state = PipelineState.WRITING;
        writer.writeBatch(sorted);
        c.validRecords += sorted.size();
        c.batches++;
        batch.clear();
    }

    private MaterializationResult finish(PipelineState terminal, Counters c, long t0, Throwable failure) {
        state = terminal;
        return new MaterializationResult(terminal, c.linesRead, c.validRecords, c.rejectedLines, c.blankLines,
            c.batches, Duration.ofNanos(System.nanoTime() - t0), failure);
    }

    private void writeReport(MaterializationResult result) {
        try {
            reportWriter.writeJson(MaterializationReport.of(result, config));
        } catch (IOException e) {
            log.warn("Could not write materialization report to {}", config.dataDir, e);
        }
    }

    private static final class Counters {
        long linesRead;
        long validRecords;
        long rejectedLines;
        long blankLines;
        int batches;
    }
}
