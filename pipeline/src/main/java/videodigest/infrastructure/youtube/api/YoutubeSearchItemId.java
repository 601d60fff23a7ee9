package videodigest.infrastructure.youtube.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record YoutubeSearchItemId(String kind, String videoId) {
}
