package videodigest.domain.exceptions;

/**
 * The transcript source returned no text for a video.
 */
public class EmptyTranscript extends RuntimeException implements InternalException {
    public EmptyTranscript() {
        super();
    }

    public EmptyTranscript(final String message) {
        super(message);
    }

    public EmptyTranscript(final String message, final Throwable cause) {
        super(message, cause);
    }

    public EmptyTranscript(final Throwable cause) {
        super(cause);
    }
}
