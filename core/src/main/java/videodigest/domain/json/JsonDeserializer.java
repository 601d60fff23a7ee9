package videodigest.domain.json;

public interface JsonDeserializer {
    String serialize(Object object);

    <T> T deserialize(String json, Class<T> clazz);
}
