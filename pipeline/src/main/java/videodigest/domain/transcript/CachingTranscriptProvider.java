package videodigest.domain.transcript;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import videodigest.domain.config.MockConfig;
import videodigest.domain.exceptionhandling.ExceptionHandler;
import videodigest.domain.exceptions.EmptyTranscript;
import videodigest.domain.persist.TranscriptCache;
import videodigest.domain.persist.TranscriptCacheEntry;
import videodigest.domain.retry.RetryExecutor;
import videodigest.domain.video.VideoRef;
import videodigest.infrastructure.transcript.TranscriptClient;
import videodigest.infrastructure.transcript.api.TranscriptResponse;

import java.util.Optional;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Returns the sample transcript in mock mode, otherwise the cached transcript, otherwise the transcript
 * fetched from the transcript API. Fetched transcripts are written to the cache before they are returned.
 */
@ApplicationScoped
public class CachingTranscriptProvider implements TranscriptProvider {
    @Inject
    @ConfigProperty(name = "vd.transcript.apikey")
    private Optional<String> apiKey;

    @Inject
    private MockConfig mockConfig;

    @Inject
    private SampleTranscript sampleTranscript;

    @Inject
    private TranscriptCache transcriptCache;

    @Inject
    private TranscriptClient transcriptClient;

    @Inject
    private RetryExecutor retryExecutor;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    @Override
    public Try<String> getTranscript(final VideoRef video) {
        checkNotNull(video);

        if (mockConfig.isMockTranscript()) {
            logger.info("Using the sample transcript for video " + video.id());
            return sampleTranscript.getText();
        }

        final Optional<TranscriptCacheEntry> cached = transcriptCache.get(video.id());
        if (cached.isPresent()) {
            logger.info("Using the transcript cached at " + cached.get().fetchedAt() + " for video " + video.id());
            return Try.success(cached.get().text());
        }

        return retryExecutor.execute(() -> transcriptClient.getTranscript(video.link(), apiKey.orElse("")))
                .map(TranscriptResponse::getText)
                .filter(StringUtils::isNotBlank, () -> new EmptyTranscript("The transcript for video " + video.id() + " was empty"))
                .peek(text -> logger.info("Fetched a transcript of " + text.length() + " characters for video " + video.id()))
                .peek(text -> saveToCache(video.id(), text));
    }

    /**
     * A failed save only means the next run fetches the transcript again.
     */
    private void saveToCache(final String videoId, final String text) {
        transcriptCache.put(videoId, text)
                .onFailure(ex -> logger.warning("Failed to cache the transcript for video " + videoId + ": "
                        + exceptionHandler.getExceptionMessage(ex)));
    }
}
