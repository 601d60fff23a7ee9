package videodigest.domain.exceptionhandling;

import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.ProcessingException;
import videodigest.domain.exceptions.ExternalException;
import videodigest.domain.exceptions.ExternalFailure;
import videodigest.domain.exceptions.InternalException;
import videodigest.domain.exceptions.InternalFailure;
import videodigest.domain.exceptions.Timeout;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Predicates.instanceOf;

/**
 * Standard implementation of exception mapping.
 * Exceptions that already implement ExternalException or InternalException pass through untouched, so callers
 * can still see the specific failure (a rate limit, a missing answer, and so on).
 * Timeouts are mapped to Timeout, and other transport level exceptions from the HTTP client and IO layer
 * are mapped to ExternalFailure.
 * Everything else is mapped to InternalFailure.
 */
@ApplicationScoped
public class StandardExceptionMapping implements ExceptionMapping {
    @Override
    public <T> Try<T> map(final Try<T> tryObject) {
        checkNotNull(tryObject);

        return tryObject.mapFailure(
                // Classified exceptions pass through.
                API.Case(API.$(instanceOf(ExternalException.class)), throwable -> throwable),
                API.Case(API.$(instanceOf(InternalException.class)), throwable -> throwable),
                // Connection resets, refused connections and read timeouts surface as one of these.
                API.Case(API.$(instanceOf(SocketTimeoutException.class)), throwable -> new Timeout(throwable)),
                API.Case(API.$(instanceOf(TimeoutException.class)), throwable -> new Timeout(throwable)),
                API.Case(API.$(instanceOf(ProcessingException.class)), throwable -> new ExternalFailure(throwable)),
                API.Case(API.$(instanceOf(IOException.class)), throwable -> new ExternalFailure(throwable)),
                // Map everything else to InternalFailure.
                API.Case(API.$(), throwable -> new InternalFailure(throwable)));
    }

    @Override
    public boolean isTransient(final Throwable throwable) {
        return map(Try.failure(throwable)).getCause() instanceof ExternalException;
    }
}
