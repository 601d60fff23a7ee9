package videodigest.domain.exceptions;

/**
 * No video in the examined search results had a title matching the pattern.
 */
public class NoMatchingVideo extends RuntimeException implements InternalException {
    public NoMatchingVideo() {
        super();
    }

    public NoMatchingVideo(final String message) {
        super(message);
    }

    public NoMatchingVideo(final String message, final Throwable cause) {
        super(message, cause);
    }

    public NoMatchingVideo(final Throwable cause) {
        super(cause);
    }
}
