package videodigest.infrastructure.chat;

import videodigest.infrastructure.chat.api.ChatWebhookMessage;

public interface ChatWebhookClient {
    /**
     * Post a single message to the webhook. Returns normally only if the webhook accepted the message.
     */
    void post(ChatWebhookMessage message);
}
