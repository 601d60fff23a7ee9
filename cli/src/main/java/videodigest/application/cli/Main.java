package videodigest.application.cli;

import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.jboss.weld.environment.se.Weld;
import org.jboss.weld.environment.se.WeldContainer;
import videodigest.Marker;
import videodigest.domain.config.ConfigurationReport;
import videodigest.domain.exceptions.ExternalException;
import videodigest.domain.exceptions.PartialDelivery;
import videodigest.domain.pipeline.PipelineResult;
import videodigest.domain.pipeline.VideoDigestPipeline;

import java.util.List;
import java.util.logging.Logger;

public class Main {
    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_PERMANENT_FAILURE = 1;
    public static final int EXIT_TRANSIENT_FAILURE = 2;

    @Inject
    private VideoDigestPipeline pipeline;

    @Inject
    private ConfigurationReport configurationReport;

    @Inject
    private Logger logger;

    public static void main(final String[] args) {
        LogConfig.init();

        final Weld weld = new Weld();
        /*
        The marker class sits in the shared ancestor package so Weld can find the beans in every module,
        including inside the uber JAR. Discovery is disabled, so the config extension is added by hand.
         */
        final int exitCode;
        try (WeldContainer weldContainer = weld
                .disableDiscovery()
                .addBeanClass(Main.class)
                .addPackages(true, Marker.class)
                .addExtension(new ConfigExtension())
                .initialize()) {
            exitCode = weldContainer.select(Main.class).get().entry();
        }

        System.exit(exitCode);
    }

    /**
     * Failures that may succeed if the run is repeated later get their own exit code, so a scheduler can
     * tell them apart from configuration or data problems.
     */
    public static int exitCode(final PipelineResult result) {
        if (result.isSuccess()) {
            return EXIT_SUCCESS;
        }

        // A partial delivery is only worth repeating if the chunk that stopped it failed transiently
        final Throwable cause = result.cause() instanceof PartialDelivery partialDelivery && partialDelivery.getCause() != null
                ? partialDelivery.getCause()
                : result.cause();

        // Stage failures have already been through the exception mapping, so the marker is reliable
        return cause instanceof ExternalException
                ? EXIT_TRANSIENT_FAILURE
                : EXIT_PERMANENT_FAILURE;
    }

    public int entry() {
        configurationReport.describe()
                .forEach((name, value) -> logger.info("Config " + name + " = " + value));

        final List<String> problems = configurationReport.validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> logger.severe("Invalid configuration: " + problem));
            return EXIT_PERMANENT_FAILURE;
        }

        final PipelineResult result = pipeline.run();
        final int exitCode = exitCode(result);

        if (result.isSuccess()) {
            logger.info("Finished: delivered " + result.chunksDelivered() + " message(s) for video "
                    + result.video().id() + ", exit code " + exitCode);
        } else {
            logger.severe("Finished: failed while " + result.failedStage() + " ("
                    + result.cause().getClass().getSimpleName() + ": " + result.cause().getMessage()
                    + "), exit code " + exitCode);
        }

        return exitCode;
    }
}
