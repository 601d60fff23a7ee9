package videodigest.domain.httpclient;

/**
 * Defines a service that builds a client, generates the response, parses the response, and builds an exception.
 * This service will also take care of closing any resources.
 */
public interface HttpClientCaller {
    <T> T call(ClientBuilder builder, ClientCallback callback, ResponseCallback<T> responseCallback, ExceptionBuilder exceptionBuilder);
}
