package videodigest.infrastructure.chat;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import videodigest.domain.exceptions.ExternalFailure;
import videodigest.domain.httpclient.HttpClientCaller;
import videodigest.domain.response.ResponseValidation;
import videodigest.infrastructure.chat.api.ChatWebhookMessage;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Posts messages to a Discord webhook.
 */
@ApplicationScoped
public class ChatWebhookClientLive implements ChatWebhookClient {
    private static final long API_CONNECTION_TIMEOUT_SECONDS_DEFAULT = 10;
    private static final long API_CALL_TIMEOUT_SECONDS_DEFAULT = 30;

    @Inject
    @ConfigProperty(name = "vd.chat.webhook")
    private Optional<String> webhook;

    @Inject
    private ResponseValidation responseValidation;

    @Inject
    private Logger logger;

    @Inject
    private HttpClientCaller httpClientCaller;

    private Client getClient() {
        final ClientBuilder clientBuilder = ClientBuilder.newBuilder();
        clientBuilder.connectTimeout(API_CONNECTION_TIMEOUT_SECONDS_DEFAULT, TimeUnit.SECONDS);
        clientBuilder.readTimeout(API_CALL_TIMEOUT_SECONDS_DEFAULT, TimeUnit.SECONDS);
        return clientBuilder.build();
    }

    @Override
    public void post(final ChatWebhookMessage message) {
        checkNotNull(message);
        checkState(webhook.isPresent(), "vd.chat.webhook must be set");

        final Integer status = httpClientCaller.call(
                this::getClient,
                client -> client.target(webhook.get())
                        .request()
                        .header("Accept", MediaType.APPLICATION_JSON)
                        .post(Entity.entity(message, MediaType.APPLICATION_JSON)),
                // The webhook URL contains the token, so it is never included in messages
                response -> Try.of(() -> responseValidation.validate(response, "the chat webhook"))
                        .map(r -> r.getStatus())
                        .get(),
                cause -> new ExternalFailure("Failed to call the chat webhook", cause)
        );

        logger.fine("Chat webhook accepted the message with status " + status);
    }
}
