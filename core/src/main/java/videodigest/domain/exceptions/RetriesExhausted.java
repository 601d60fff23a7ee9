package videodigest.domain.exceptions;

/**
 * An operation kept failing with transient errors until the attempt limit was reached.
 * The cause is the failure from the final attempt.
 */
public class RetriesExhausted extends ExternalFailure {
    private final int attempts;

    public RetriesExhausted(final String message, final Throwable cause, final int attempts) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
