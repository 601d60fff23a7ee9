package videodigest.infrastructure.transcript.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The transcript API returns the transcript as a list of timed segments.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptResponse(String lang, List<String> availableLangs, List<TranscriptSegment> content) {
    public List<TranscriptSegment> getContent() {
        return Objects.requireNonNullElse(content, List.of());
    }

    /**
     * @return The segment texts joined with single spaces
     */
    public String getText() {
        return getContent().stream()
                .map(TranscriptSegment::text)
                .filter(StringUtils::isNotBlank)
                .map(String::trim)
                .collect(Collectors.joining(" "));
    }
}
