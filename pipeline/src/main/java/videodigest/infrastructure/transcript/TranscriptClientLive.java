package videodigest.infrastructure.transcript;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.client.Client;
import jakarta.ws.rs.client.ClientBuilder;
import jakarta.ws.rs.core.MediaType;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import videodigest.domain.exceptions.ExternalFailure;
import videodigest.domain.exceptions.MalformedResponse;
import videodigest.domain.httpclient.HttpClientCaller;
import videodigest.domain.response.ResponseValidation;
import videodigest.infrastructure.transcript.api.TranscriptResponse;

import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Fetches transcripts from the Supadata transcript API.
 */
@ApplicationScoped
public class TranscriptClientLive implements TranscriptClient {
    private static final long API_CONNECTION_TIMEOUT_SECONDS_DEFAULT = 10;
    // Transcripts for long videos can take a while to generate on the first request
    private static final long API_CALL_TIMEOUT_SECONDS_DEFAULT = 60 * 2;

    @Inject
    @ConfigProperty(name = "vd.transcript.url", defaultValue = "https://api.supadata.ai/v1/transcript")
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
    public TranscriptResponse getTranscript(final String videoLink, final String apiKey) {
        checkArgument(StringUtils.isNotBlank(videoLink), "videoLink must not be blank");

        logger.info("Getting transcript for " + videoLink);

        return httpClientCaller.call(
                this::getClient,
                client -> client.target(url)
                        .queryParam("url", videoLink)
                        .request()
                        .header("Accept", MediaType.APPLICATION_JSON)
                        .header("x-api-key", apiKey)
                        .get(),
                response -> Try.of(() -> responseValidation.validate(response, "the transcript API"))
                        .map(r -> Try.of(() -> r.readEntity(TranscriptResponse.class))
                                .getOrElseThrow(ex -> new MalformedResponse("Failed to parse the transcript response", ex)))
                        .get(),
                cause -> new ExternalFailure("Failed to call the transcript API", cause)
        );
    }
}
