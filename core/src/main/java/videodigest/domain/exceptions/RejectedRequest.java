package videodigest.domain.exceptions;

/**
 * Represents a client side error (4xx) returned from an HTTP request that is not covered by a more specific exception
 */
public class RejectedRequest extends RuntimeException implements InternalException {
    private final String body;
    private final int code;

    public RejectedRequest() {
        super();
        this.body = "";
        this.code = -1;
    }

    public RejectedRequest(final String message, final String body, final int code) {
        super(message);
        this.body = body;
        this.code = code;
    }

    public RejectedRequest(final String message, final Throwable cause) {
        super(message, cause);
        this.body = "";
        this.code = -1;
    }

    public RejectedRequest(final String message) {
        super(message);
        this.body = "";
        this.code = -1;
    }

    public String getBody() {
        return body;
    }

    public int getCode() {
        return code;
    }
}
