package videodigest.domain.notify;

import java.util.List;

/**
 * Splits text into chunks no longer than a limit. Joining the chunk bodies in order gives back the original text.
 */
public interface MessageChunker {
    /**
     * @param text     The text to split
     * @param limit    The maximum chunk length. Must be positive.
     * @param lookback How far back from the limit to look for a natural break
     * @return At least one chunk. Empty text gives a single empty chunk.
     */
    List<NotificationChunk> chunk(String text, int limit, int lookback);
}
