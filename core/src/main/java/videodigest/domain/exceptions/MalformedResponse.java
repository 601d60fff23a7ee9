package videodigest.domain.exceptions;

/**
 * The upstream returned a successful status, but the body could not be parsed into the expected shape.
 */
public class MalformedResponse extends RuntimeException implements InternalException {
    public MalformedResponse() {
        super();
    }

    public MalformedResponse(final String message) {
        super(message);
    }

    public MalformedResponse(final String message, final Throwable cause) {
        super(message, cause);
    }

    public MalformedResponse(final Throwable cause) {
        super(cause);
    }
}
