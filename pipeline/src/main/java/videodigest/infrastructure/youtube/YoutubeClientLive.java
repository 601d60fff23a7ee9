package videodigest.infrastructure.youtube;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import jakarta.ws.rs.client.WebTarget;
import jakarta.ws.rs.core.MediaType;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;
import videodigest.domain.exceptions.ExternalFailure;
import videodigest.domain.exceptions.MalformedResponse;
import videodigest.domain.httpclient.HttpClientCaller;
import videodigest.domain.response.ResponseValidation;
import videodigest.infrastructure.youtube.api.YoutubeSearch;
import videodigest.infrastructure.youtube.api.YoutubeSearchItem;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

@ApplicationScoped
public class YoutubeClientLive implements YoutubeClient {
    private static final long API_CONNECTION_TIMEOUT_SECONDS_DEFAULT = 10;
    private static final long API_CALL_TIMEOUT_SECONDS_DEFAULT = 60;

    @Inject
    @ConfigProperty(name = "vd.youtube.url", defaultValue = "https://www.googleapis.com/youtube/v3/search")
    private String url;

    @Inject
    private ResponseValidation responseValidation;

    @Inject
    private Logger logger;

    @Inject
    private HttpClientCaller httpClientCaller;

    private Client getClient() {
        final ClientBuilder clientBuilder = ClientBuilder.newBuilder();
        clientBuilder.connectTimeout(API_CONNECTION_TIMEOUT_SECONDS_DEFAULT, TimeUnit.SECONDS);
        clientBuilder.readTimeout(API_CALL_TIMEOUT_SECONDS_DEFAULT, TimeUnit.SECONDS);
        return clientBuilder.build();
    }

    @Override
    public List<YoutubeSearchItem> searchLatestVideos(final String channelId, final int maxResults, @Nullable final String eventType, final String key) {
        checkArgument(StringUtils.isNotBlank(channelId), "channelId must not be blank");
        checkArgument(maxResults > 0, "maxResults must be positive");

        logger.info("Getting Youtube API search for channelId: " + channelId + ", maxResults: " + maxResults
                + (StringUtils.isNotBlank(eventType) ? ", eventType: " + eventType : ""));

        return httpClientCaller.call(
                this::getClient,
                client -> buildTarget(client, channelId, maxResults, eventType, key)
                        .request()
                        .header("Accept", MediaType.APPLICATION_JSON)
                        .get(),
                response -> Try.of(() -> responseValidation.validate(response, "the Youtube search API"))
                        .map(r -> Try.of(() -> r.readEntity(YoutubeSearch.class))
                                .getOrElseThrow(ex -> new MalformedResponse("Failed to parse the Youtube search response", ex)))
                        .map(YoutubeSearch::getItems)
                        .get(),
                cause -> new ExternalFailure("Failed to call the Youtube search API", cause)
        );
    }

    private WebTarget buildTarget(final Client client, final String channelId, final int maxResults, @Nullable final String eventType, final String key) {
        final WebTarget target = client.target(url)
                .queryParam("part", "snippet")
                .queryParam("channelId", channelId)
                .queryParam("maxResults", maxResults)
                .queryParam("order", "date")
                .queryParam("type", "video")
                .queryParam("key", key);

        // eventType is only valid for searches with type=video, which is always the case here
        return StringUtils.isNotBlank(eventType)
                ? target.queryParam("eventType", eventType)
                : target;
    }
}
