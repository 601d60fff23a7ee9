package videodigest.infrastructure.youtube;

import org.jspecify.annotations.Nullable;
import videodigest.infrastructure.youtube.api.YoutubeSearchItem;

import java.util.List;

public interface YoutubeClient {
    /**
     * Search a channel for videos, newest first.
     *
     * @param channelId  The channel to search
     * @param maxResults The number of results to return
     * @param eventType  An optional event type filter, like "completed" for finished live streams
     * @param key        The YouTube Data API key
     * @return The results, ordered by publish date descending
     */
    List<YoutubeSearchItem> searchLatestVideos(String channelId, int maxResults, @Nullable String eventType, String key);
}
