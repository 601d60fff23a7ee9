package videodigest.infrastructure.youtube;

import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.Nullable;
import videodigest.infrastructure.youtube.api.YoutubeSearchItem;
import videodigest.infrastructure.youtube.api.YoutubeSearchItemId;
import videodigest.infrastructure.youtube.api.YoutubeSearchItemSnippet;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * A mock implementation of the YoutubeClient interface that returns a fixed set of search results,
 * newest first.
 */
@ApplicationScoped
public class YoutubeClientMock implements YoutubeClient {
    @Override
    public List<YoutubeSearchItem> searchLatestVideos(final String channelId, final int maxResults, @Nullable final String eventType, final String key) {
        final Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);

        return List.of(
                        item("mockvideo03", "KS Forward Ep3: Markets this week", now.minus(1, ChronoUnit.DAYS)),
                        item("mockvideo02", "Weekly Q&A", now.minus(3, ChronoUnit.DAYS)),
                        item("mockvideo01", "KS Forward Ep2: Interest rates", now.minus(8, ChronoUnit.DAYS)))
                .stream()
                .limit(maxResults)
                .toList();
    }

    private YoutubeSearchItem item(final String id, final String title, final Instant publishedAt) {
        return new YoutubeSearchItem(
                new YoutubeSearchItemId("youtube#video", id),
                new YoutubeSearchItemSnippet(title, publishedAt.toString()));
    }
}
