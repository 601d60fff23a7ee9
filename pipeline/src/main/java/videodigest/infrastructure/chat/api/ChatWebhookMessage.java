package videodigest.infrastructure.chat.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatWebhookMessage(@Nullable String content, List<ChatEmbed> embeds) {
    public ChatWebhookMessage(final ChatEmbed embed) {
        this(null, List.of(embed));
    }
}
