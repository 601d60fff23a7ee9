package videodigest.infrastructure.chat.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * A Discord style embed. The description holds the message text and is limited to 4096 characters.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatEmbed(
        String title,
        String description,
        @Nullable Integer color,
        @Nullable String timestamp,
        @Nullable ChatEmbedFooter footer) {
}
