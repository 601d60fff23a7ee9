package videodigest.domain.sanitize;

import org.jspecify.annotations.Nullable;

/**
 * Cleans up a document, typically text returned by an LLM.
 */
public interface SanitizeDocument {
    @Nullable String sanitize(@Nullable String document);
}
