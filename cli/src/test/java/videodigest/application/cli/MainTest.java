package videodigest.application.cli;

import org.junit.jupiter.api.Test;
import videodigest.domain.exceptions.EmptyTranscript;
import videodigest.domain.exceptions.InvalidResponse;
import videodigest.domain.exceptions.NoMatchingVideo;
import videodigest.domain.exceptions.PartialDelivery;
import videodigest.domain.exceptions.RetriesExhausted;
import videodigest.domain.exceptions.UnauthorizedResponse;
import videodigest.domain.pipeline.PipelineResult;
import videodigest.domain.pipeline.PipelineState;
import videodigest.domain.video.VideoRef;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MainTest {
    private static final VideoRef VIDEO = new VideoRef("ep5", "KS Forward Ep5", Instant.parse("2024-05-01T10:00:00Z"));

    private static PipelineResult failedWith(final PipelineState stage, final Throwable cause) {
        return PipelineResult.failed(stage, cause, VIDEO, 0, List.of(PipelineState.IDLE, stage, PipelineState.FAILED));
    }

    @Test
    void testDoneIsZero() {
        final PipelineResult result = PipelineResult.done(VIDEO, 2, List.of(PipelineState.IDLE, PipelineState.DONE));

        assertEquals(Main.EXIT_SUCCESS, Main.exitCode(result));
    }

    @Test
    void testTransientFailureIsTwo() {
        final RetriesExhausted cause = new RetriesExhausted("Gave up", new InvalidResponse("Server error", "", 500), 3);

        assertEquals(Main.EXIT_TRANSIENT_FAILURE, Main.exitCode(failedWith(PipelineState.SUMMARIZING, cause)));
    }

    @Test
    void testPermanentFailureIsOne() {
        assertEquals(Main.EXIT_PERMANENT_FAILURE, Main.exitCode(failedWith(PipelineState.LOCATING_VIDEO, new NoMatchingVideo("None"))));
        assertEquals(Main.EXIT_PERMANENT_FAILURE, Main.exitCode(failedWith(PipelineState.FETCHING_TRANSCRIPT, new EmptyTranscript("Empty"))));
    }

    @Test
    void testPartialDeliveryUsesTheChunkFailure() {
        final PartialDelivery transientStop = new PartialDelivery(1, 3, new RetriesExhausted("Gave up", new InvalidResponse("Server error", "", 503), 3));
        final PartialDelivery permanentStop = new PartialDelivery(0, 3, new UnauthorizedResponse("Unknown webhook"));

        assertEquals(Main.EXIT_TRANSIENT_FAILURE, Main.exitCode(failedWith(PipelineState.NOTIFYING, transientStop)));
        assertEquals(Main.EXIT_PERMANENT_FAILURE, Main.exitCode(failedWith(PipelineState.NOTIFYING, permanentStop)));
    }
}
