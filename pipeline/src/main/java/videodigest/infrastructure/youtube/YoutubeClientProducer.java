package videodigest.infrastructure.youtube;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import videodigest.domain.config.MockConfig;
import videodigest.domain.injection.Preferred;

/**
 * Produces a YoutubeClient instance based on the configuration.
 */
public class YoutubeClientProducer {

    @Inject
    private MockConfig mockConfig;

    @Produces
    @Preferred
    @ApplicationScoped
    public YoutubeClient produceYoutubeClient(final YoutubeClientLive youtubeClientLive,
                                              final YoutubeClientMock youtubeClientMock) {
        if (mockConfig.isMock()) {
            return youtubeClientMock;
        }

        return youtubeClientLive;
    }
}
