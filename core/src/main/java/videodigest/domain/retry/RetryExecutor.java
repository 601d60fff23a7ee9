package videodigest.domain.retry;

import io.vavr.CheckedFunction0;
import io.vavr.control.Try;

import java.time.Duration;

/**
 * Runs an operation, retrying transient failures with an exponential backoff.
 * Permanent failures are returned after a single attempt.
 */
public interface RetryExecutor {
    /**
     * Execute the operation with the configured attempt limit and delays.
     */
    <T> Try<T> execute(CheckedFunction0<T> operation);

    /**
     * @param operation   The operation to run. It may perform IO.
     * @param maxAttempts The total number of attempts, including the first one. Must be at least 1.
     * @param baseDelay   The delay before the second attempt. Each later delay doubles, up to the configured cap.
     * @return The operation's result, the permanent failure that stopped it, or a RetriesExhausted failure
     */
    <T> Try<T> execute(CheckedFunction0<T> operation, int maxAttempts, Duration baseDelay);

    <T> Try<T> execute(CheckedFunction0<T> operation, int maxAttempts, Duration baseDelay, Duration maxDelay);
}
