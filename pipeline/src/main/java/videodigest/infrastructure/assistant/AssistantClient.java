package videodigest.infrastructure.assistant;

import videodigest.infrastructure.assistant.api.AssistantRequest;
import videodigest.infrastructure.assistant.api.AssistantResponse;

public interface AssistantClient {
    AssistantResponse chat(AssistantRequest request);
}
