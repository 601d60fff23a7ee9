package videodigest.domain.exceptionhandling;

/**
 * Turns an exception into something that can be logged.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
