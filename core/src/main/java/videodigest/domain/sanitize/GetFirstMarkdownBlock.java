package videodigest.domain.sanitize;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Unwraps a document that is entirely enclosed in a markdown code fence, with or without a language tag.
 * Documents that merely contain a fenced block somewhere in their text are returned unchanged.
 */
@ApplicationScoped
public class GetFirstMarkdownBlock implements SanitizeDocument {
    private static final Pattern WRAPPING_MARKDOWN_BLOCK_REGEX = Pattern.compile("^```[^\\n]*\\n(.*?)\\n```$", Pattern.DOTALL);

    @Override
    @Nullable
    public String sanitize(@Nullable final String document) {
        if (StringUtils.isEmpty(document)) {
            return document;
        }

        final String trimmedDocument = document.trim();
        final Matcher matcher = WRAPPING_MARKDOWN_BLOCK_REGEX.matcher(trimmedDocument);

        if (matcher.matches()) {
            return matcher.group(1);
        }

        return document;
    }
}
