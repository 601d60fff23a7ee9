package videodigest.domain.persist;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * A transcript saved after it was first fetched from the transcript API.
 *
 * @param videoId   The video the transcript belongs to
 * @param text      The full transcript text
 * @param fetchedAt When the transcript was fetched
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptCacheEntry(String videoId, String text, Instant fetchedAt) {
}
