package videodigest.domain.pipeline;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;
import videodigest.domain.exceptionhandling.ExceptionHandler;
import videodigest.domain.exceptions.InternalFailure;
import videodigest.domain.exceptions.PartialDelivery;
import videodigest.domain.notify.Notifier;
import videodigest.domain.summary.Summarizer;
import videodigest.domain.transcript.TranscriptProvider;
import videodigest.domain.video.VideoLocator;
import videodigest.domain.video.VideoRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Runs the stages in order: find the video, get its transcript, summarize it, publish the summary.
 * The first failing stage ends the run. Every run starts from IDLE; nothing is resumed.
 */
@ApplicationScoped
public class VideoDigestPipeline {
    @Inject
    @ConfigProperty(name = "vd.channel.id")
    private Optional<String> channelId;

    @Inject
    @ConfigProperty(name = "vd.channel.titlePattern", defaultValue = "KS Forward")
    private String titlePattern;

    @Inject
    private VideoLocator videoLocator;

    @Inject
    private TranscriptProvider transcriptProvider;

    @Inject
    private Summarizer summarizer;

    @Inject
    private Notifier notifier;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    public PipelineResult run() {
        final Run run = new Run();

        run.moveTo(PipelineState.LOCATING_VIDEO);
        final Try<VideoRef> video = channelId
                .map(id -> videoLocator.findLatestMatching(id, titlePattern))
                .orElseGet(() -> Try.failure(new InternalFailure("vd.channel.id must be set")));
        if (video.isFailure()) {
            return run.fail(video.getCause(), null, 0);
        }

        run.moveTo(PipelineState.FETCHING_TRANSCRIPT);
        final Try<String> transcript = transcriptProvider.getTranscript(video.get());
        if (transcript.isFailure()) {
            return run.fail(transcript.getCause(), video.get(), 0);
        }

        run.moveTo(PipelineState.SUMMARIZING);
        final Try<String> summary = summarizer.summarize(transcript.get());
        if (summary.isFailure()) {
            return run.fail(summary.getCause(), video.get(), 0);
        }

        run.moveTo(PipelineState.NOTIFYING);
        final Try<Integer> delivered = notifier.publish(video.get().title(), summary.get());
        if (delivered.isFailure()) {
            final int partial = delivered.getCause() instanceof PartialDelivery partialDelivery
                    ? partialDelivery.getDelivered()
                    : 0;
            return run.fail(delivered.getCause(), video.get(), partial);
        }

        run.moveTo(PipelineState.DONE);
        return PipelineResult.done(video.get(), delivered.get(), run.transitions);
    }

    /**
     * Tracks the states a single run has passed through.
     */
    private class Run {
        private final List<PipelineState> transitions = new ArrayList<>(List.of(PipelineState.IDLE));

        private PipelineState current() {
            return transitions.get(transitions.size() - 1);
        }

        void moveTo(final PipelineState next) {
            logger.info("Pipeline state " + current() + " -> " + next);
            transitions.add(next);
        }

        PipelineResult fail(final Throwable cause, @Nullable final VideoRef video, final int chunksDelivered) {
            final PipelineState failedStage = current();
            logger.severe("Pipeline failed while " + failedStage + ": " + exceptionHandler.getExceptionMessage(cause));
            moveTo(PipelineState.FAILED);
            return PipelineResult.failed(failedStage, cause, video, chunksDelivered, transitions);
        }
    }
}
