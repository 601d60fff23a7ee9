package videodigest.domain.video;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import videodigest.domain.exceptions.InternalFailure;
import videodigest.domain.exceptions.NoMatchingVideo;
import videodigest.domain.injection.Preferred;
import videodigest.domain.retry.RetryExecutor;
import videodigest.infrastructure.youtube.YoutubeClient;
import videodigest.infrastructure.youtube.api.YoutubeSearchItem;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

@ApplicationScoped
public class YoutubeVideoLocator implements VideoLocator {
    private static final int DEFAULT_MAX_RESULTS = 5;

    @Inject
    @ConfigProperty(name = "vd.youtube.apikey")
    private Optional<String> apiKey;

    @Inject
    @ConfigProperty(name = "vd.youtube.maxResults", defaultValue = DEFAULT_MAX_RESULTS + "")
    private Integer maxResults;

    @Inject
    @ConfigProperty(name = "vd.youtube.eventType")
    private Optional<String> eventType;

    @Inject
    @Preferred
    private YoutubeClient youtubeClient;

    @Inject
    private RetryExecutor retryExecutor;

    @Inject
    private Logger logger;

    @Override
    public Try<VideoRef> findLatestMatching(final String channelId, final String titlePattern) {
        if (StringUtils.isBlank(channelId) || StringUtils.isBlank(titlePattern)) {
            return Try.failure(new InternalFailure("The channel id and title pattern must not be blank"));
        }

        return retryExecutor.execute(() -> youtubeClient.searchLatestVideos(
                        channelId,
                        Math.max(1, maxResults),
                        eventType.filter(StringUtils::isNotBlank).orElse(null),
                        apiKey.orElse("")))
                .peek(items -> logger.info("Youtube search returned " + items.size() + " videos"))
                .flatMap(items -> firstMatching(items, titlePattern)
                        .map(Try::success)
                        .orElseGet(() -> Try.failure(new NoMatchingVideo(
                                "None of the latest " + items.size() + " videos on channel " + channelId
                                        + " have a title containing \"" + titlePattern + "\""))))
                .map(YoutubeSearchItem::toVideoRef)
                .peek(video -> logger.info("Found video " + video.id() + ": " + video.title()));
    }

    /**
     * Results are already ordered newest first, so the first match is the latest one.
     */
    private Optional<YoutubeSearchItem> firstMatching(final List<YoutubeSearchItem> items, final String titlePattern) {
        return items.stream()
                .filter(item -> StringUtils.isNotBlank(item.videoId()))
                .filter(item -> StringUtils.containsIgnoreCase(item.title(), titlePattern))
                .findFirst();
    }
}
