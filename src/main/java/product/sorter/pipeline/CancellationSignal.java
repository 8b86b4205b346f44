package product.sorter.pipeline;

/**
 * Cooperative cancellation flag handed to a materialization run.
 * The pipeline polls it between batches; raising it never interrupts a batch being written.
 */
public class CancellationSignal {
    private volatile boolean cancelled;

    public static CancellationSignal none() { return new CancellationSignal(); }

    public void cancel() { cancelled = true; }

    public boolean isCancelled() { return cancelled; }
}
