package videodigest.domain.retry;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import io.vavr.control.Try;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import videodigest.domain.exceptionhandling.LoggingExceptionHandler;
import videodigest.domain.exceptionhandling.StandardExceptionMapping;
import videodigest.domain.exceptions.ExternalFailure;
import videodigest.domain.exceptions.InternalFailure;
import videodigest.domain.exceptions.InvalidResponse;
import videodigest.domain.exceptions.RateLimit;
import videodigest.domain.exceptions.RetriesExhausted;
import videodigest.domain.exceptions.UnauthorizedResponse;
import videodigest.domain.logger.Loggers;
import videodigest.domain.retry.config.RetrySettings;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(BackoffRetryExecutor.class)
@AddBeanClasses(StandardExceptionMapping.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(RetrySettings.class)
@AddBeanClasses(Loggers.class)
class BackoffRetryExecutorTest {
    @Inject
    private BackoffRetryExecutor retryExecutor;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of(
                        "vd.retry.maxAttempts", "3",
                        "vd.retry.baseDelayMillis", "0",
                        "vd.retry.maxDelayMillis", "0"
                ),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @Test
    void testSuccessOnFirstAttempt() {
        final AtomicInteger calls = new AtomicInteger();

        final Try<String> result = retryExecutor.execute(() -> {
            calls.incrementAndGet();
            return "ok";
        });

        assertTrue(result.isSuccess());
        assertEquals("ok", result.get());
        assertEquals(1, calls.get());
    }

    @Test
    void testTransientFailuresThenSuccess() {
        final AtomicInteger calls = new AtomicInteger();

        final Try<String> result = retryExecutor.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new InvalidResponse("Server error", "", 503);
            }
            return "ok";
        }, 3, Duration.ZERO);

        assertTrue(result.isSuccess());
        assertEquals("ok", result.get());
        assertEquals(3, calls.get());
    }

    @Test
    void testPermanentFailureIsNotRetried() {
        final AtomicInteger calls = new AtomicInteger();

        final Try<String> result = retryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw new UnauthorizedResponse("Bad key");
        }, 5, Duration.ZERO);

        assertTrue(result.isFailure());
        assertInstanceOf(UnauthorizedResponse.class, result.getCause());
        assertEquals(1, calls.get());
    }

    @Test
    void testUnclassifiedFailureIsPermanent() {
        final AtomicInteger calls = new AtomicInteger();

        final Try<String> result = retryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("Bug");
        }, 5, Duration.ZERO);

        assertInstanceOf(InternalFailure.class, result.getCause());
        assertEquals(1, calls.get());
    }

    @Test
    void testIOExceptionIsRetried() {
        final AtomicInteger calls = new AtomicInteger();

        final Try<String> result = retryExecutor.execute(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IOException("Connection reset");
            }
            return "ok";
        }, 2, Duration.ZERO);

        assertEquals("ok", result.get());
        assertEquals(2, calls.get());
    }

    @Test
    void testRetriesExhausted() {
        final AtomicInteger calls = new AtomicInteger();

        final Try<String> result = retryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw new RateLimit("Slow down", "", 429);
        }, 4, Duration.ZERO);

        assertEquals(4, calls.get());
        final RetriesExhausted exhausted = assertInstanceOf(RetriesExhausted.class, result.getCause());
        assertEquals(4, exhausted.getAttempts());
        assertInstanceOf(RateLimit.class, exhausted.getCause());
        assertInstanceOf(ExternalFailure.class, exhausted);
    }

    @Test
    void testConfiguredAttempts() {
        final AtomicInteger calls = new AtomicInteger();

        final Try<String> result = retryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw new ExternalFailure("Down");
        });

        assertInstanceOf(RetriesExhausted.class, result.getCause());
        assertEquals(3, calls.get());
    }

    @Test
    void testInvalidMaxAttempts() {
        assertThrows(IllegalArgumentException.class, () -> retryExecutor.execute(() -> "ok", 0, Duration.ZERO));
    }

    @Test
    void testDelaySchedule() {
        final Duration base = Duration.ofSeconds(1);
        final Duration max = Duration.ofSeconds(30);

        assertEquals(Duration.ofSeconds(1), BackoffRetryExecutor.delayForAttempt(1, base, max));
        assertEquals(Duration.ofSeconds(2), BackoffRetryExecutor.delayForAttempt(2, base, max));
        assertEquals(Duration.ofSeconds(4), BackoffRetryExecutor.delayForAttempt(3, base, max));
        assertEquals(Duration.ofSeconds(16), BackoffRetryExecutor.delayForAttempt(5, base, max));
        assertEquals(max, BackoffRetryExecutor.delayForAttempt(6, base, max));
        assertEquals(max, BackoffRetryExecutor.delayForAttempt(100, base, max));
    }
}
