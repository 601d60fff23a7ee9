package videodigest.domain.summary;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;
import videodigest.domain.json.JsonDeserializer;
import videodigest.domain.sanitize.GetFirstMarkdownBlock;
import videodigest.domain.sanitize.SanitizeDocument;
import videodigest.infrastructure.assistant.api.AssistantResponse;

/**
 * LLMs like to wrap their output in a code fence, and sometimes answer with a JSON document holding the
 * real answer. This strips both.
 */
@ApplicationScoped
public class SummaryCleaner implements SanitizeDocument {
    @Inject
    private GetFirstMarkdownBlock getFirstMarkdownBlock;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Override
    @Nullable
    public String sanitize(@Nullable final String document) {
        if (StringUtils.isBlank(document)) {
            return document;
        }

        final String unfenced = StringUtils.trim(getFirstMarkdownBlock.sanitize(document));

        if (!(StringUtils.startsWith(unfenced, "{") && StringUtils.endsWith(unfenced, "}"))) {
            return unfenced;
        }

        return Try.of(() -> jsonDeserializer.deserialize(unfenced, AssistantResponse.class))
                .map(AssistantResponse::answer)
                .filter(StringUtils::isNotBlank)
                .map(String::trim)
                .getOrElse(unfenced);
    }
}
