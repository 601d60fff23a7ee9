package videodigest.domain.transcript;

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
import org.junit.jupiter.api.io.TempDir;
import videodigest.domain.config.MockConfig;
import videodigest.domain.exceptionhandling.LoggingExceptionHandler;
import videodigest.domain.exceptionhandling.StandardExceptionMapping;
import videodigest.domain.exceptions.EmptyTranscript;
import videodigest.domain.exceptions.InvalidResponse;
import videodigest.domain.exceptions.MissingResponse;
import videodigest.domain.exceptions.RetriesExhausted;
import videodigest.domain.json.JsonDeserializerJackson;
import videodigest.domain.logger.Loggers;
import videodigest.domain.persist.FileTranscriptCache;
import videodigest.domain.persist.TranscriptCacheEntry;
import videodigest.domain.persist.config.LocalStorageCacheDirectory;
import videodigest.domain.retry.BackoffRetryExecutor;
import videodigest.domain.retry.config.RetrySettings;
import videodigest.domain.video.VideoRef;
import videodigest.infrastructure.fakes.FakeTranscriptClient;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(CachingTranscriptProvider.class)
@AddBeanClasses(SampleTranscript.class)
@AddBeanClasses(MockConfig.class)
@AddBeanClasses(FileTranscriptCache.class)
@AddBeanClasses(LocalStorageCacheDirectory.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(FakeTranscriptClient.class)
@AddBeanClasses(BackoffRetryExecutor.class)
@AddBeanClasses(RetrySettings.class)
@AddBeanClasses(StandardExceptionMapping.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(Loggers.class)
class CachingTranscriptProviderTest {
    private static final VideoRef VIDEO = new VideoRef("abc123", "KS Forward Ep5", Instant.parse("2024-05-01T10:00:00Z"));

    @TempDir
    Path cacheRoot;

    @Inject
    private CachingTranscriptProvider transcriptProvider;

    @Inject
    private FakeTranscriptClient transcriptClient;

    @Inject
    private FileTranscriptCache transcriptCache;

    @BeforeEach
    void updateConfig() {
        registerConfig(Map.of());
    }

    private void registerConfig(final Map<String, String> overrides) {
        final Map<String, String> properties = new HashMap<>(Map.of(
                "vd.cache.localdir", cacheRoot.resolve("cache").toString(),
                "vd.transcript.apikey", "transcript-key",
                "vd.retry.maxAttempts", "3",
                "vd.retry.baseDelayMillis", "0"
        ));
        properties.putAll(overrides);

        final var configSource = new PropertiesConfigSource(
                properties,
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
    void testMissFetchesAndWritesThrough() {
        transcriptClient.setSegments(List.of(" Rates held. ", "Yields fell."));

        final Try<String> result = transcriptProvider.getTranscript(VIDEO);

        assertEquals("Rates held. Yields fell.", result.get());
        assertEquals(1, transcriptClient.getCalls());
        assertEquals(List.of("https://www.youtube.com/watch?v=abc123"), transcriptClient.getRequestedLinks());
        assertEquals(Optional.of("Rates held. Yields fell."), transcriptCache.get(VIDEO.id()).map(TranscriptCacheEntry::text));
    }

    @Test
    void testHitMakesNoRemoteCall() {
        transcriptCache.put(VIDEO.id(), "Cached transcript");

        final Try<String> result = transcriptProvider.getTranscript(VIDEO);

        assertEquals("Cached transcript", result.get());
        assertEquals(0, transcriptClient.getCalls());
    }

    @Test
    void testSecondRequestIsServedFromTheCache() {
        transcriptProvider.getTranscript(VIDEO);
        transcriptProvider.getTranscript(VIDEO);

        assertEquals(1, transcriptClient.getCalls());
    }

    @Test
    void testTransientFailureIsRetried() {
        transcriptClient.failWith(new InvalidResponse("Server error", "", 502));

        assertEquals("Hello world", transcriptProvider.getTranscript(VIDEO).get());
        assertEquals(2, transcriptClient.getCalls());
    }

    @Test
    void testRemoteFailureIsNotCached() {
        transcriptClient.failAlwaysWith(new InvalidResponse("Server error", "", 500));

        final Try<String> result = transcriptProvider.getTranscript(VIDEO);

        assertInstanceOf(RetriesExhausted.class, result.getCause());
        assertEquals(3, transcriptClient.getCalls());
        assertTrue(transcriptCache.get(VIDEO.id()).isEmpty());
    }

    @Test
    void testPermanentFailureIsNotRetried() {
        transcriptClient.failWith(new MissingResponse("No transcript"));

        assertInstanceOf(MissingResponse.class, transcriptProvider.getTranscript(VIDEO).getCause());
        assertEquals(1, transcriptClient.getCalls());
    }

    @Test
    void testEmptyTranscriptIsAFailureAndNotCached() {
        transcriptClient.setSegments(List.of(" ", ""));

        final Try<String> result = transcriptProvider.getTranscript(VIDEO);

        assertInstanceOf(EmptyTranscript.class, result.getCause());
        assertTrue(transcriptCache.get(VIDEO.id()).isEmpty());
    }

    @Test
    void testMockModeUsesTheSampleTranscript() {
        registerConfig(Map.of("vd.transcript.mock", "true"));
        transcriptCache.put(VIDEO.id(), "Cached transcript");

        final Try<String> result = transcriptProvider.getTranscript(VIDEO);

        assertTrue(result.get().startsWith("Welcome back to KS Forward"));
        assertEquals(0, transcriptClient.getCalls());
    }

    @Test
    void testCacheWriteFailureIsIgnored() throws Exception {
        final Path blocker = Files.writeString(cacheRoot.resolve("blocker"), "not a directory");
        registerConfig(Map.of("vd.cache.localdir", blocker.resolve("cache").toString()));

        final Try<String> result = transcriptProvider.getTranscript(VIDEO);

        assertEquals("Hello world", result.get());
        assertEquals(1, transcriptClient.getCalls());
    }
}
