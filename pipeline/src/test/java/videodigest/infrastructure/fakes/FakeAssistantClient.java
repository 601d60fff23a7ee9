package videodigest.infrastructure.fakes;

import jakarta.enterprise.context.ApplicationScoped;
import org.jspecify.annotations.Nullable;
import videodigest.infrastructure.assistant.AssistantClient;
import videodigest.infrastructure.assistant.api.AssistantRequest;
import videodigest.infrastructure.assistant.api.AssistantResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Answers every request with the configured response, or throws the configured failure.
 */
@ApplicationScoped
public class FakeAssistantClient implements AssistantClient {
    private final List<AssistantRequest> requests = new ArrayList<>();
    private AssistantResponse response = new AssistantResponse("A short summary.");
    @Nullable
    private Supplier<RuntimeException> failure;

    public void setAnswer(@Nullable final String answer) {
        this.response = new AssistantResponse(answer);
    }

    public void setFailure(@Nullable final Supplier<RuntimeException> failure) {
        this.failure = failure;
    }

    @Override
    public AssistantResponse chat(final AssistantRequest request) {
        requests.add(request);

        if (failure != null) {
            throw failure.get();
        }

        return response;
    }

    public List<AssistantRequest> getRequests() {
        return requests;
    }
}
