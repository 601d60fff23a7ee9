package videodigest.infrastructure.assistant.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The body sent to the AI endpoint. The persona selects the assistant's instructions on the server side.
 */
public record AssistantRequest(
        String persona,
        @JsonProperty("user_id") String userId,
        List<AssistantMessage> messages) {
}
