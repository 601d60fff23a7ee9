package videodigest.domain.logger;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(Loggers.class)
class LoggersTest {
    private final Logger loggersLogger = Logger.getLogger(Loggers.class.getName());
    private final List<LogRecord> records = new ArrayList<>();
    private final Handler capture = new Handler() {
        @Override
        public void publish(final LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @Inject
    private Instance<Logger> logger;

    @TempDir
    private Path tempDir;

    @BeforeEach
    void addHandler() {
        loggersLogger.addHandler(capture);
    }

    @AfterEach
    void removeHandler() {
        loggersLogger.removeHandler(capture);
    }

    private void setLogFile(final String file) {
        final var configSource = new PropertiesConfigSource(
                Map.of("vd.logging.file", file),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        configProviderResolver.releaseConfig(configProviderResolver.getConfig());
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @Test
    void testUnwritableLogFileIsReported() {
        final Path file = tempDir.resolve("missing").resolve("videodigest.log");
        setLogFile(file.toString());

        assertNotNull(logger.get());

        assertTrue(records.stream().anyMatch(record ->
                record.getLevel() == Level.WARNING && record.getMessage().contains(file.toString())));
    }

    @Test
    void testWritableLogFileIsAttached() {
        final Path file = tempDir.resolve("videodigest.log");
        setLogFile(file.toString());

        final Logger injected = logger.get();

        assertTrue(injected.getHandlers().length > 0);
        assertTrue(records.stream().noneMatch(record -> record.getLevel() == Level.WARNING));
    }
}
