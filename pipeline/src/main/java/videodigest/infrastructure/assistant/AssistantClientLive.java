package videodigest.infrastructure.assistant;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.client.Invocation;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import videodigest.domain.exceptions.ExternalFailure;
import videodigest.domain.exceptions.MalformedResponse;
import videodigest.domain.httpclient.HttpClientCaller;
import videodigest.domain.response.ResponseValidation;
import videodigest.infrastructure.assistant.api.AssistantRequest;
import videodigest.infrastructure.assistant.api.AssistantResponse;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Calls the self hosted AI assistant endpoint.
 */
@ApplicationScoped
public class AssistantClientLive implements AssistantClient {
    private static final long API_CONNECTION_TIMEOUT_SECONDS_DEFAULT = 10;
    // Summarizing an hour long transcript can take several minutes
    private static final long API_CALL_TIMEOUT_SECONDS_DEFAULT = 60 * 5;

    @Inject
    @ConfigProperty(name = "vd.assistant.url")
    private Optional<String> url;

    @Inject
    @ConfigProperty(name = "vd.assistant.apikey")
    private Optional<String> apiKey;

    @Inject
    @ConfigProperty(name = "vd.assistant.timeoutSeconds", defaultValue = API_CALL_TIMEOUT_SECONDS_DEFAULT + "")
    private Long timeout;

    @Inject
    private ResponseValidation responseValidation;

    @Inject
    private Logger logger;

    @Inject
    private HttpClientCaller httpClientCaller;

    private Client getClient() {
        final ClientBuilder clientBuilder = ClientBuilder.newBuilder();
        clientBuilder.connectTimeout(API_CONNECTION_TIMEOUT_SECONDS_DEFAULT, TimeUnit.SECONDS);
        clientBuilder.readTimeout(timeout, TimeUnit.SECONDS);
        return clientBuilder.build();
    }

    @Override
    public AssistantResponse chat(final AssistantRequest request) {
        checkNotNull(request);
        checkState(url.isPresent(), "vd.assistant.url must be set");

        logger.info("Calling the AI assistant with persona " + request.persona());

        return httpClientCaller.call(
                this::getClient,
                client -> withApiKey(client.target(url.get()).request())
                        .header("Accept", MediaType.APPLICATION_JSON)
                        .post(Entity.entity(request, MediaType.APPLICATION_JSON)),
                response -> Try.of(() -> responseValidation.validate(response, "the AI assistant"))
                        .map(r -> Try.of(() -> r.readEntity(AssistantResponse.class))
                                .getOrElseThrow(ex -> new MalformedResponse("Failed to parse the AI assistant response", ex)))
                        .get(),
                cause -> new ExternalFailure("Failed to call the AI assistant", cause)
        );
    }

    private Invocation.Builder withApiKey(final Invocation.Builder builder) {
        return apiKey
                .map(key -> builder.header("X-API-Key", key))
                .orElse(builder);
    }
}
