package videodigest.domain.logger;

import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.enterprise.inject.spi.InjectionPoint;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;

import java.util.Optional;
import java.util.logging.FileHandler;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

@ApplicationScoped
public class Loggers {
    /**
     * Single line format shared with the CLI console handler.
     */
    public static final String LOG_FORMAT = "%1$tF %1$tT %4$s %3$s: %5$s%6$s%n";

    @Inject
    @ConfigProperty(name = "vd.logging.file")
    private Optional<String> logFile;

    @Nullable
    private FileHandler fileHandler;

    @PostConstruct
    private void init() {
        System.setProperty("java.util.logging.SimpleFormatter.format", LOG_FORMAT);
        final SimpleFormatter formatter = new SimpleFormatter();
        this.fileHandler = logFile
                .flatMap(file -> Try.of(() -> new FileHandler(file, true))
                        .onSuccess(handler -> handler.setFormatter(formatter))
                        .onFailure(ex -> Logger.getLogger(Loggers.class.getName())
                                .warning("Could not open log file " + file + ", logging to the console only: " + ex))
                        .toJavaOptional())
                .orElse(null);
    }

    @Produces
    public Logger getLogger(final InjectionPoint injectionPoint) {
        final Logger logger = Logger.getLogger(
                injectionPoint.getMember().getDeclaringClass().getName());

        if (fileHandler != null && !hasHandler(logger, fileHandler)) {
            logger.addHandler(fileHandler);
        }

        return logger;
    }

    private boolean hasHandler(final Logger logger, final FileHandler handler) {
        for (final var existing : logger.getHandlers()) {
            if (existing == handler) {
                return true;
            }
        }
        return false;
    }
}
