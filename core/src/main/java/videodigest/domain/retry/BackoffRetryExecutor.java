package videodigest.domain.retry;

import io.vavr.CheckedFunction0;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import videodigest.domain.exceptionhandling.ExceptionHandler;
import videodigest.domain.exceptionhandling.ExceptionMapping;
import videodigest.domain.exceptions.RetriesExhausted;
import videodigest.domain.retry.config.RetrySettings;

import java.time.Duration;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Retries operations that fail with an external (transient) exception, waiting
 * baseDelay * 2^(attempt - 1) between attempts, capped at maxDelay.
 */
@ApplicationScoped
public class BackoffRetryExecutor implements RetryExecutor {
    @Inject
    private Logger logger;

    @Inject
    private ExceptionMapping exceptionMapping;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private RetrySettings retrySettings;

    /**
     * The delay to wait after the given (1 based) attempt failed.
     */
    public static Duration delayForAttempt(final int attempt, final Duration baseDelay, final Duration maxDelay) {
        checkArgument(attempt >= 1, "attempt must be at least 1");

        // Anything past 2^30 is well beyond any sensible cap
        final long multiplier = 1L << Math.min(attempt - 1, 30);
        final Duration delay = Try.of(() -> baseDelay.multipliedBy(multiplier)).getOrElse(maxDelay);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    @Override
    public <T> Try<T> execute(final CheckedFunction0<T> operation) {
        return execute(operation, retrySettings.getMaxAttempts(), retrySettings.getBaseDelay(), retrySettings.getMaxDelay());
    }

    @Override
    public <T> Try<T> execute(final CheckedFunction0<T> operation, final int maxAttempts, final Duration baseDelay) {
        return execute(operation, maxAttempts, baseDelay, retrySettings.getMaxDelay());
    }

    @Override
    public <T> Try<T> execute(final CheckedFunction0<T> operation, final int maxAttempts, final Duration baseDelay, final Duration maxDelay) {
        checkNotNull(operation, "operation must not be null");
        checkNotNull(baseDelay, "baseDelay must not be null");
        checkNotNull(maxDelay, "maxDelay must not be null");
        checkArgument(maxAttempts >= 1, "maxAttempts must be at least 1");

        return attempt(operation, maxAttempts, baseDelay, maxDelay, 1);
    }

    private <T> Try<T> attempt(
            final CheckedFunction0<T> operation,
            final int maxAttempts,
            final Duration baseDelay,
            final Duration maxDelay,
            final int attempt) {
        final Try<T> result = exceptionMapping.map(Try.of(operation));

        if (result.isSuccess() || !exceptionMapping.isTransient(result.getCause())) {
            return result;
        }

        if (attempt >= maxAttempts) {
            logger.warning("Giving up after " + attempt + " attempts: " + exceptionHandler.getExceptionMessage(result.getCause()));
            return Try.failure(new RetriesExhausted(
                    "Operation failed after " + attempt + " attempts",
                    result.getCause(),
                    attempt));
        }

        final Duration delay = delayForAttempt(attempt, baseDelay, maxDelay);
        logger.warning("Attempt " + attempt + " of " + maxAttempts + " failed, retrying in " + delay.toMillis() + "ms: "
                + result.getCause().getMessage());

        return exceptionMapping.map(Try.run(() -> Thread.sleep(delay.toMillis()))
                        .onFailure(InterruptedException.class, ex -> Thread.currentThread().interrupt()))
                .flatMap(ignored -> attempt(operation, maxAttempts, baseDelay, maxDelay, attempt + 1));
    }
}
