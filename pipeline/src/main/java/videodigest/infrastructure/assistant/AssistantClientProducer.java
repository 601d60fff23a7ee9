package videodigest.infrastructure.assistant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import videodigest.domain.config.MockConfig;
import videodigest.domain.injection.Preferred;

/**
 * Produces an AssistantClient instance based on the configuration.
 */
public class AssistantClientProducer {

    @Inject
    private MockConfig mockConfig;

    @Produces
    @Preferred
    @ApplicationScoped
    public AssistantClient produceAssistantClient(final AssistantClientLive assistantClientLive,
                                                  final AssistantClientMock assistantClientMock) {
        if (mockConfig.isMock()) {
            return assistantClientMock;
        }

        return assistantClientLive;
    }
}
