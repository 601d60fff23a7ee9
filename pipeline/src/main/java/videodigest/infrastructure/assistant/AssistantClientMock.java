package videodigest.infrastructure.assistant;

import jakarta.enterprise.context.ApplicationScoped;
import videodigest.infrastructure.assistant.api.AssistantMessage;
import videodigest.infrastructure.assistant.api.AssistantRequest;
import videodigest.infrastructure.assistant.api.AssistantResponse;

/**
 * A mock implementation of the AssistantClient interface that returns a canned summary describing the request.
 */
@ApplicationScoped
public class AssistantClientMock implements AssistantClient {
    @Override
    public AssistantResponse chat(final AssistantRequest request) {
        final int length = request.messages().stream()
                .map(AssistantMessage::content)
                .mapToInt(String::length)
                .sum();

        return new AssistantResponse(
                "Mock summary for persona " + request.persona() + ".\n\n"
                        + "The transcript contained " + length + " characters.",
                "mock-session",
                false);
    }
}
