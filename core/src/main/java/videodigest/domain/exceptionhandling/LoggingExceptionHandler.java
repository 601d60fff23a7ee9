package videodigest.domain.exceptionhandling;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jspecify.annotations.Nullable;
import videodigest.domain.exceptions.ExternalException;

@ApplicationScoped
public class LoggingExceptionHandler implements ExceptionHandler {

    @Inject
    @ConfigProperty(name = "vd.exceptions.printstacktrace", defaultValue = "false")
    private String printStackTrace;

    @Override
    public String getExceptionMessage(@Nullable final Throwable e) {
        if (e == null) {
            return "Exception was null";
        }

        if (Boolean.parseBoolean(printStackTrace) || e instanceof ExternalException) {
            return ExceptionUtils.getStackTrace(e);
        }

        // Include the root cause, as wrapped exceptions often only say which call failed
        final Throwable rootCause = ExceptionUtils.getRootCause(e);
        final String message = StringUtils.isBlank(e.getMessage()) ? e.toString() : e.getMessage();
        if (rootCause != null && rootCause != e && StringUtils.isNotBlank(rootCause.getMessage())) {
            return message + " (caused by " + rootCause.getMessage() + ")";
        }

        return message;
    }
}
