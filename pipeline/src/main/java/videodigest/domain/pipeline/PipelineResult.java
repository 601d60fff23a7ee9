package videodigest.domain.pipeline;

import org.jspecify.annotations.Nullable;
import videodigest.domain.video.VideoRef;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The outcome of a run.
 *
 * @param state           DONE or FAILED
 * @param failedStage     The stage that failed, or null for a successful run
 * @param cause           Why the stage failed, or null for a successful run
 * @param video           The video the run worked on, if one was found
 * @param chunksDelivered How many chat messages were delivered
 * @param transitions     Every state the run passed through, starting with IDLE
 */
public record PipelineResult(
        PipelineState state,
        @Nullable PipelineState failedStage,
        @Nullable Throwable cause,
        @Nullable VideoRef video,
        int chunksDelivered,
        List<PipelineState> transitions) {

    public PipelineResult {
        checkNotNull(state);
        checkArgument(state.isTerminal(), "A result must be in a terminal state");
        transitions = List.copyOf(transitions);
    }

    public static PipelineResult done(final VideoRef video, final int chunksDelivered, final List<PipelineState> transitions) {
        return new PipelineResult(PipelineState.DONE, null, null, video, chunksDelivered, transitions);
    }

    public static PipelineResult failed(
            final PipelineState failedStage,
            final Throwable cause,
            @Nullable final VideoRef video,
            final int chunksDelivered,
            final List<PipelineState> transitions) {
        checkNotNull(failedStage);
        checkNotNull(cause);
        return new PipelineResult(PipelineState.FAILED, failedStage, cause, video, chunksDelivered, transitions);
    }

    public boolean isSuccess() {
        return state == PipelineState.DONE;
    }
}
