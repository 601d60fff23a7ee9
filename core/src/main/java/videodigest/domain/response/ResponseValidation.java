package videodigest.domain.response;

import jakarta.ws.rs.core.Response;

public interface ResponseValidation {
    /**
     * Returns the response if it has a successful status, or throws an exception classified by the status code.
     *
     * @param response The response to validate
     * @param target   A description of the call, used in exception messages. Must not contain secrets.
     */
    Response validate(Response response, String target);
}
