package videodigest.domain.video;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * The video a run works on.
 *
 * @param id          The YouTube video id
 * @param title       The video title
 * @param publishedAt When the video was published, or null if the search result did not say
 */
public record VideoRef(String id, String title, @Nullable Instant publishedAt) {
    private static final String WATCH_URL = "https://www.youtube.com/watch?v=";

    public String link() {
        return WATCH_URL + id;
    }
}
