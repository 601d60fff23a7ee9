package videodigest.domain.summary;

import io.vavr.control.Try;

/**
 * Turns a transcript into a summary ready to be published.
 */
public interface Summarizer {
    /**
     * @param transcript The plain text transcript
     * @return The cleaned summary, or the failure that prevented it
     */
    Try<String> summarize(String transcript);
}
