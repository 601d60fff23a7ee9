package videodigest.domain.httpclient;

/**
 * Builds the exception thrown when a call fails for a reason that has not already been classified,
 * typically a transport error from the client.
 */
public interface ExceptionBuilder {
    RuntimeException buildException(Throwable cause);
}
