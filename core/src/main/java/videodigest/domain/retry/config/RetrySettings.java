package videodigest.domain.retry.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;

@ApplicationScoped
public class RetrySettings {
    private static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final long DEFAULT_BASE_DELAY_MILLIS = 1000;
    private static final long DEFAULT_MAX_DELAY_MILLIS = 30000;

    @Inject
    @ConfigProperty(name = "vd.retry.maxAttempts", defaultValue = DEFAULT_MAX_ATTEMPTS + "")
    private Integer maxAttempts;

    @Inject
    @ConfigProperty(name = "vd.retry.baseDelayMillis", defaultValue = DEFAULT_BASE_DELAY_MILLIS + "")
    private Long baseDelayMillis;

    @Inject
    @ConfigProperty(name = "vd.retry.maxDelayMillis", defaultValue = DEFAULT_MAX_DELAY_MILLIS + "")
    private Long maxDelayMillis;

    public int getMaxAttempts() {
        return Math.max(1, maxAttempts);
    }

    public Duration getBaseDelay() {
        return Duration.ofMillis(Math.max(0, baseDelayMillis));
    }

    public Duration getMaxDelay() {
        return Duration.ofMillis(Math.max(0, maxDelayMillis));
    }
}
