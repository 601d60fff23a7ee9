package videodigest.infrastructure.youtube.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.vavr.control.Try;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;
import videodigest.domain.video.VideoRef;

import java.time.Instant;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record YoutubeSearchItem(@Nullable YoutubeSearchItemId id, @Nullable YoutubeSearchItemSnippet snippet) {
    @Nullable
    public String videoId() {
        return id == null ? null : id.videoId();
    }

    public String title() {
        return snippet == null ? "" : Objects.requireNonNullElse(snippet.title(), "");
    }

    public VideoRef toVideoRef() {
        final Instant publishedAt = snippet == null || StringUtils.isBlank(snippet.publishedAt())
                ? null
                : Try.of(() -> Instant.parse(snippet.publishedAt())).getOrNull();
        return new VideoRef(videoId(), title(), publishedAt);
    }
}
