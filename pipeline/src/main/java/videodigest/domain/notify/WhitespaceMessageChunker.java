package videodigest.domain.notify;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Breaks text at a paragraph break if one is close to the limit, then at a line break, then at any other
 * whitespace. Text with no whitespace near the limit is split at exactly the limit.
 * Break characters stay at the end of the chunk before the break.
 * A hard split that would fall inside a surrogate pair moves back one char, so a chunk only exceeds the limit
 * when the limit is a single char and the chunk is a whole supplementary character.
 */
@ApplicationScoped
public class WhitespaceMessageChunker implements MessageChunker {
    private static final String PARAGRAPH_BREAK = "\n\n";
    private static final char LINE_BREAK = '\n';

    @Override
    public List<NotificationChunk> chunk(final String text, final int limit, final int lookback) {
        checkNotNull(text);
        checkArgument(limit > 0, "limit must be positive");
        checkArgument(lookback >= 0, "lookback must not be negative");

        final List<NotificationChunk> chunks = new ArrayList<>();
        int start = 0;

        while (text.length() - start > limit) {
            final int end = findEnd(text, start, limit, lookback);
            chunks.add(new NotificationChunk(chunks.size(), text.substring(start, end)));
            start = end;
        }

        chunks.add(new NotificationChunk(chunks.size(), text.substring(start)));
        return chunks;
    }

    /**
     * @return The exclusive end of the chunk starting at start. Always greater than start and at most start + limit,
     * or start + 2 when limit is 1 and the text at start is a surrogate pair.
     */
    private int findEnd(final String text, final int start, final int limit, final int lookback) {
        final int hardEnd = start + limit;
        // Chunks may end anywhere in [minEnd, hardEnd] when breaking on whitespace
        final int minEnd = Math.max(start + 1, hardEnd - lookback);

        final int paragraph = text.lastIndexOf(PARAGRAPH_BREAK, hardEnd - PARAGRAPH_BREAK.length());
        if (paragraph >= start && paragraph + PARAGRAPH_BREAK.length() >= minEnd) {
            return paragraph + PARAGRAPH_BREAK.length();
        }

        final int line = text.lastIndexOf(LINE_BREAK, hardEnd - 1);
        if (line >= start && line + 1 >= minEnd) {
            return line + 1;
        }

        for (int i = hardEnd - 1; i >= start && i + 1 >= minEnd; --i) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i + 1;
            }
        }

        // Never separate the two halves of a surrogate pair
        if (Character.isHighSurrogate(text.charAt(hardEnd - 1)) && Character.isLowSurrogate(text.charAt(hardEnd))) {
            return hardEnd - 1 > start ? hardEnd - 1 : hardEnd + 1;
        }

        return hardEnd;
    }
}
