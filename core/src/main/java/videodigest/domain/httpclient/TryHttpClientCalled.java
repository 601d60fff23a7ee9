package videodigest.domain.httpclient;

import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import videodigest.domain.exceptions.ExternalException;
import videodigest.domain.exceptions.InternalException;

@ApplicationScoped
public class TryHttpClientCalled implements HttpClientCaller {

    @Override
    public <T> T call(final ClientBuilder builder, final ClientCallback callback, final ResponseCallback<T> responseCallback, final ExceptionBuilder exceptionBuilder) {
        // Clients are not guaranteed to be thread safe, so we build a new client for each call.
        // The response is closed before the client that produced it.
        return Try.withResources(builder::buildClient)
                .of(client -> Try.withResources(() -> callback.call(client))
                        .of(responseCallback::handleResponse))
                .flatMap(result -> result)
                // Exceptions raised while validating or parsing the response are already classified
                .mapFailure(API.Case(
                        API.$((Throwable ex) -> !(ex instanceof ExternalException) && !(ex instanceof InternalException)),
                        exceptionBuilder::buildException))
                .get();
    }
}
