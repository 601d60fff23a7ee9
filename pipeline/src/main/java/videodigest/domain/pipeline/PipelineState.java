package videodigest.domain.pipeline;

/**
 * The stages of a run, in the order they happen. DONE and FAILED are terminal.
 */
public enum PipelineState {
    IDLE,
    LOCATING_VIDEO,
    FETCHING_TRANSCRIPT,
    SUMMARIZING,
    NOTIFYING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
