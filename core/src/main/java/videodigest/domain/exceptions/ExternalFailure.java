package videodigest.domain.exceptions;

/**
 * Represents a failure from an external source. This is like a 500 response code in HTTP.
 * It means if you make the same call with the same data you might be successful.
 * Exceptions that carry no marker interface, like a connection reset surfaced by the HTTP client,
 * are mapped to this class by the exception mapping when they are known to be transient.
 */
public class ExternalFailure extends RuntimeException implements ExternalException {
    public ExternalFailure() {
        super();
    }

    public ExternalFailure(final String message) {
        super(message);
    }

    public ExternalFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ExternalFailure(final Throwable cause) {
        super(cause);
    }
}
