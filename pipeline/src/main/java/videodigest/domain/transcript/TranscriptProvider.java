package videodigest.domain.transcript;

import io.vavr.control.Try;
import videodigest.domain.video.VideoRef;

/**
 * Gets the plain text transcript of a video.
 */
public interface TranscriptProvider {
    Try<String> getTranscript(VideoRef video);
}
