package videodigest.infrastructure.youtube.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record YoutubeSearchItemSnippet(String title, String publishedAt, String channelId, String liveBroadcastContent) {
    public YoutubeSearchItemSnippet(final String title, final String publishedAt) {
        this(title, publishedAt, null, null);
    }
}
