package product.sorter.pipeline;

/**
 * Lifecycle of one materialization run.
 */
public enum PipelineState {
    IDLE,
    READING,
    SORTING,
    WRITING,
    FLUSHING,
    DONE,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED || this == FAILED;
    }
}
