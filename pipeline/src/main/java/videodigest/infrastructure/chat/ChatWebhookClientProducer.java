package videodigest.infrastructure.chat;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import videodigest.domain.config.MockConfig;
import videodigest.domain.injection.Preferred;

/**
 * Produces a ChatWebhookClient instance based on the configuration.
 */
public class ChatWebhookClientProducer {

    @Inject
    private MockConfig mockConfig;

    @Produces
    @Preferred
    @ApplicationScoped
    public ChatWebhookClient produceChatWebhookClient(final ChatWebhookClientLive chatWebhookClientLive,
                                                      final ChatWebhookClientMock chatWebhookClientMock) {
        if (mockConfig.isMock()) {
            return chatWebhookClientMock;
        }

        return chatWebhookClientLive;
    }
}
