package videodigest.infrastructure.assistant.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AssistantResponse(
        @Nullable String answer,
        @JsonProperty("session_id") @Nullable String sessionId,
        @JsonProperty("context_used") @Nullable Boolean contextUsed) {
    public AssistantResponse(@Nullable final String answer) {
        this(answer, null, null);
    }
}
