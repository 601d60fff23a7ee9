package videodigest.infrastructure.transcript.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(String lang, String text, Double offset, Double duration) {
}
