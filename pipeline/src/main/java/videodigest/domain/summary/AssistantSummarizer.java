package videodigest.domain.summary;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import videodigest.domain.exceptions.InternalFailure;
import videodigest.domain.exceptions.MalformedResponse;
import videodigest.domain.injection.Preferred;
import videodigest.domain.retry.RetryExecutor;
import videodigest.infrastructure.assistant.AssistantClient;
import videodigest.infrastructure.assistant.api.AssistantMessage;
import videodigest.infrastructure.assistant.api.AssistantRequest;
import videodigest.infrastructure.assistant.api.AssistantResponse;

import java.util.List;
import java.util.logging.Logger;

/**
 * Sends the transcript to the AI assistant as a single user message. The persona configured on the
 * assistant holds the summarization instructions.
 */
@ApplicationScoped
public class AssistantSummarizer implements Summarizer {
    private static final String USER_ROLE = "user";

    @Inject
    @ConfigProperty(name = "vd.assistant.persona", defaultValue = "ks-discord")
    private String persona;

    @Inject
    @ConfigProperty(name = "vd.assistant.userId", defaultValue = "ks-discord")
    private String userId;

    @Inject
    @Preferred
    private AssistantClient assistantClient;

    @Inject
    private RetryExecutor retryExecutor;

    @Inject
    private SummaryCleaner summaryCleaner;

    @Inject
    private Logger logger;

    @Override
    public Try<String> summarize(final String transcript) {
        if (StringUtils.isBlank(transcript)) {
            return Try.failure(new InternalFailure("The transcript to summarize must not be blank"));
        }

        final AssistantRequest request = new AssistantRequest(
                persona,
                userId,
                List.of(new AssistantMessage(USER_ROLE, transcript)));

        return retryExecutor.execute(() -> assistantClient.chat(request))
                .map(AssistantResponse::answer)
                .filter(StringUtils::isNotBlank, () -> new MalformedResponse("The AI assistant response did not include an answer"))
                .map(summaryCleaner::sanitize)
                .filter(StringUtils::isNotBlank, () -> new MalformedResponse("The AI assistant answer was empty once cleaned"))
                .peek(summary -> logger.info("Summarized " + transcript.length() + " transcript characters into "
                        + summary.length() + " characters"));
    }
}
