package videodigest.infrastructure.chat;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import videodigest.infrastructure.chat.api.ChatEmbed;
import videodigest.infrastructure.chat.api.ChatWebhookMessage;

import java.util.logging.Logger;

/**
 * A mock implementation of the ChatWebhookClient interface that logs messages instead of posting them.
 */
@ApplicationScoped
public class ChatWebhookClientMock implements ChatWebhookClient {
    @Inject
    private Logger logger;

    @Override
    public void post(final ChatWebhookMessage message) {
        for (final ChatEmbed embed : message.embeds()) {
            logger.info("Mock chat message \"" + embed.title() + "\":\n" + embed.description());
        }
    }
}
