package videodigest.infrastructure.youtube.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record YoutubeSearch(String nextPageToken, List<YoutubeSearchItem> items) {
    public List<YoutubeSearchItem> getItems() {
        return Objects.requireNonNullElse(items, List.of());
    }
}
