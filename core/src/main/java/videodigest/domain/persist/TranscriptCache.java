package videodigest.domain.persist;

import io.vavr.control.Try;

import java.util.Optional;

/**
 * Durable storage of transcripts keyed by video id. Entries never expire and are never evicted.
 */
public interface TranscriptCache {
    /**
     * Get the transcript saved for a video.
     *
     * @param videoId The video id
     * @return The saved entry, or empty if there is none. A missing or unreadable entry is not an error.
     */
    Optional<TranscriptCacheEntry> get(String videoId);

    /**
     * Save (or overwrite) the transcript for a video.
     *
     * @param videoId The video id
     * @param text    The transcript text
     * @return The saved entry, or a LocalStorageFailure if the entry could not be written
     */
    Try<TranscriptCacheEntry> put(String videoId, String text);
}
