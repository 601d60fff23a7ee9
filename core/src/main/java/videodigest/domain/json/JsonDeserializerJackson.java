package videodigest.domain.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.blackbird.BlackbirdModule;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import videodigest.domain.exceptions.DeserializationFailed;
import videodigest.domain.exceptions.SerializationFailed;

import java.util.logging.Logger;

/**
 * A service for serializing and deserializing JSON.
 */
@ApplicationScoped
public class JsonDeserializerJackson implements JsonDeserializer {

    @Inject
    private Logger logger;

    @Override
    public String serialize(final Object object) {
        return Try.of(this::createObjectMapper)
                .mapTry(objectMapper -> objectMapper.writeValueAsString(object))
                .onFailure(ex -> logger.warning("Failed to serialize object of type " + object.getClass().getSimpleName() + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> new SerializationFailed(ex));
    }

    @Override
    public <T> T deserialize(final String json, final Class<T> clazz) {
        return Try.of(this::createObjectMapper)
                .mapTry(objectMapper -> objectMapper.readValue(json, clazz))
                .getOrElseThrow(ex -> new DeserializationFailed("Failed to deserialize " + clazz.getSimpleName(), ex));
    }

    private ObjectMapper createObjectMapper() {
        final ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.registerModule(new BlackbirdModule());
        objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return objectMapper;
    }
}
