package videodigest.domain.transcript;

import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import videodigest.domain.exceptions.InternalFailure;
import videodigest.domain.json.JsonDeserializer;
import videodigest.infrastructure.transcript.api.TranscriptResponse;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Loads the sample transcript bundled on the classpath. It has the same shape as a transcript API response.
 */
@ApplicationScoped
public class SampleTranscript {
    private static final String SAMPLE_TRANSCRIPT_RESOURCE = "mock/sample-transcript.json";

    @Inject
    private JsonDeserializer jsonDeserializer;

    public Try<String> getText() {
        return Try.withResources(() -> Objects.requireNonNull(
                        SampleTranscript.class.getClassLoader().getResourceAsStream(SAMPLE_TRANSCRIPT_RESOURCE),
                        SAMPLE_TRANSCRIPT_RESOURCE + " was not found on the classpath"))
                .of(InputStream::readAllBytes)
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                .map(json -> jsonDeserializer.deserialize(json, TranscriptResponse.class))
                .map(TranscriptResponse::getText)
                .mapFailure(API.Case(API.$(), ex -> new InternalFailure("Failed to load the sample transcript", ex)));
    }
}
