package product.sorter.pipeline;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link MaterializationPipeline} as a single background task.
 * At most one run is in flight; readers never wait on it.
 */
public class MaterializationService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MaterializationService.class);

    private final MaterializationPipeline pipeline;
    private final ExecutorService executor;
    private CompletableFuture<MaterializationResult> current;
    private CancellationSignal currentSignal;

    public MaterializationService(MaterializationPipeline pipeline) {
        this.pipeline = pipeline;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "materialization");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Submit a run.
     *
     * @throws IllegalStateException if a previous run has not completed yet
     */
    public synchronized CompletableFuture<MaterializationResult> start(CancellationSignal signal) {
        if (current != null && !current.isDone()) {
            throw new IllegalStateException("A materialization run is already in progress");
        }
        CancellationSignal s = signal == null ? CancellationSignal.none() : signal;
        currentSignal = s;
        current = CompletableFuture.supplyAsync(() -> pipeline.run(s), executor);
        current.whenComplete((result, error) -> {
            if (error != null) log.error("Materialization task ended abnormally", error);
            else log.debug("Materialization task finished with state {}", result.state());
        });
        return current;
    }

    /** Raise the cancellation signal of the run in flight, if any. */
    public synchronized void cancel() {
        if (currentSignal != null) currentSignal.cancel();
    }

    public synchronized boolean isRunning() {
        return current != null && !current.isDone();
    }

    public PipelineState state() { return pipeline.state(); }

    @Override
    public void close() {
        cancel();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Materialization did not stop within 30s; forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
