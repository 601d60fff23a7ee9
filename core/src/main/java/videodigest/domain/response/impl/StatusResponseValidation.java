package videodigest.domain.response.impl;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;
import org.apache.commons.lang3.StringUtils;
import videodigest.domain.exceptions.InvalidResponse;
import videodigest.domain.exceptions.MissingResponse;
import videodigest.domain.exceptions.RateLimit;
import videodigest.domain.exceptions.RejectedRequest;
import videodigest.domain.exceptions.UnauthorizedResponse;
import videodigest.domain.response.ResponseValidation;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Accepts any 2xx status. Webhooks answer 204, most APIs answer 200.
 * 5xx and 429 are mapped to external (retryable) exceptions, other 4xx to internal ones.
 */
@ApplicationScoped
public class StatusResponseValidation implements ResponseValidation {
    private static final int MAX_BODY_LENGTH = 500;

    @Override
    public Response validate(final Response response, final String target) {
        checkNotNull(response);

        final int status = response.getStatus();

        if (status >= 200 && status < 300) {
            return response;
        }

        final String body = StringUtils.abbreviate(
                Try.of(() -> response.readEntity(String.class)).getOrElse(""),
                MAX_BODY_LENGTH);
        final String message = "Expected a 2xx status from " + target + ", but got " + status;

        if (status == 429) {
            throw new RateLimit(message, body, status);
        }

        if (status >= 500) {
            throw new InvalidResponse(message, body, status);
        }

        if (status == 401 || status == 403) {
            throw new UnauthorizedResponse(message);
        }

        if (status == 404) {
            throw new MissingResponse(message);
        }

        throw new RejectedRequest(message, body, status);
    }
}
