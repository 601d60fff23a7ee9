package videodigest.domain.video;

import io.vavr.control.Try;

/**
 * Finds the newest video on a channel with a matching title.
 */
public interface VideoLocator {
    /**
     * @param channelId    The channel to search
     * @param titlePattern Text the title must contain, ignoring case
     * @return The newest matching video, a NoMatchingVideo failure, or the failure from the search call
     */
    Try<VideoRef> findLatestMatching(String channelId, String titlePattern);
}
