package product.sorter.pipeline;

import java.time.Duration;

/**
 * Summary of a finished run. {@code state} is DONE, CANCELLED or FAILED; {@code failure}
 * is set only for FAILED.
 *
 * linesRead counts every physical line of the source, blank ones included.
 */
public record MaterializationResult(PipelineState state,
                                    long linesRead,
                                    long validRecords,
                                    long rejectedLines,
                                    long blankLines,
                                    int batches,
                                    Duration elapsed,
                                    Throwable failure) {

    public boolean isDone() { return state == PipelineState.DONE; }
}
