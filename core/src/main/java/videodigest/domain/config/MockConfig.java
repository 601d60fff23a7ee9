package videodigest.domain.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class MockConfig {
    @Inject
    @ConfigProperty(name = "vd.infrastructure.mock", defaultValue = "false")
    private String mock;

    @Inject
    @ConfigProperty(name = "vd.transcript.mock", defaultValue = "false")
    private String mockTranscript;

    /**
     * @return true if every remote client should be replaced with its offline mock
     */
    public boolean isMock() {
        return Boolean.parseBoolean(mock.toLowerCase());
    }

    /**
     * @return true if transcripts come from the bundled sample rather than the cache or the transcript API
     */
    public boolean isMockTranscript() {
        return isMock() || Boolean.parseBoolean(mockTranscript.toLowerCase());
    }
}
