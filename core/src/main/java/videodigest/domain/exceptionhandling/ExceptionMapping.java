package videodigest.domain.exceptionhandling;

import io.vavr.control.Try;

public interface ExceptionMapping {
    <T> Try<T> map(Try<T> tryObject);

    /**
     * @return true if the failure is worth retrying
     */
    boolean isTransient(Throwable throwable);
}
