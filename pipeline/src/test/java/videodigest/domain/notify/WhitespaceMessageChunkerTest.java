package videodigest.domain.notify;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class WhitespaceMessageChunkerTest {

    private final WhitespaceMessageChunker chunker = new WhitespaceMessageChunker();

    private static String join(final List<NotificationChunk> chunks) {
        return chunks.stream().map(NotificationChunk::body).collect(Collectors.joining());
    }

    private static void assertIndexes(final List<NotificationChunk> chunks) {
        for (int i = 0; i < chunks.size(); ++i) {
            assertEquals(i, chunks.get(i).index());
        }
    }

    @Test
    void testShortTextIsOneChunk() {
        final List<NotificationChunk> chunks = chunker.chunk("Rates held.", 4096, 500);

        assertEquals(List.of(new NotificationChunk(0, "Rates held.")), chunks);
    }

    @Test
    void testTextAtExactlyTheLimitIsOneChunk() {
        final String text = "a".repeat(100);

        assertEquals(1, chunker.chunk(text, 100, 10).size());
    }

    @Test
    void testEmptyTextIsOneEmptyChunk() {
        assertEquals(List.of(new NotificationChunk(0, "")), chunker.chunk("", 10, 5));
    }

    @Test
    void testLongSummaryIsSplitWithinTheLimit() {
        final StringBuilder builder = new StringBuilder();
        int paragraph = 0;
        while (builder.length() < 7000) {
            builder.append("Paragraph ").append(++paragraph).append(": markets moved on the rate decision again.\n\n");
        }
        final String text = builder.substring(0, 7000);

        final List<NotificationChunk> chunks = chunker.chunk(text, 4096, 500);

        assertTrue(chunks.size() >= 2);
        chunks.forEach(chunk -> assertTrue(chunk.body().length() <= 4096));
        assertEquals(text, join(chunks));
        assertIndexes(chunks);
        assertTrue(chunks.get(0).body().endsWith("\n\n"));
    }

    @Test
    void testParagraphBreakIsPreferredOverLineBreak() {
        final String text = "aaaa\n\nbbbb\ncc dd";

        final List<NotificationChunk> chunks = chunker.chunk(text, 14, 14);

        assertEquals("aaaa\n\n", chunks.get(0).body());
        assertEquals(text, join(chunks));
    }

    @Test
    void testLineBreakIsPreferredOverSpace() {
        final String text = "aaaa\nbbbb cccc dddd";

        final List<NotificationChunk> chunks = chunker.chunk(text, 12, 12);

        assertEquals("aaaa\n", chunks.get(0).body());
        assertEquals(text, join(chunks));
    }

    @Test
    void testSpaceIsUsedWhenThereIsNoLineBreak() {
        final String text = "alpha beta gamma delta";

        final List<NotificationChunk> chunks = chunker.chunk(text, 12, 12);

        assertEquals("alpha beta ", chunks.get(0).body());
        assertEquals(text, join(chunks));
        chunks.forEach(chunk -> assertTrue(chunk.body().length() <= 12));
    }

    @Test
    void testBoundaryOutsideTheLookbackIsIgnored() {
        final String text = "ab " + "c".repeat(20);

        final List<NotificationChunk> chunks = chunker.chunk(text, 10, 3);

        assertEquals(text.substring(0, 10), chunks.get(0).body());
        assertEquals(text, join(chunks));
    }

    @Test
    void testTextWithoutWhitespaceIsHardSplit() {
        final String text = "x".repeat(25);

        final List<NotificationChunk> chunks = chunker.chunk(text, 10, 5);

        assertEquals(List.of(10, 10, 5), chunks.stream().map(chunk -> chunk.body().length()).toList());
        assertEquals(text, join(chunks));
    }

    @Test
    void testHardSplitKeepsSurrogatePairsTogether() {
        final String text = "\uD83D\uDCC8".repeat(30);

        final List<NotificationChunk> chunks = chunker.chunk(text, 25, 500);

        assertEquals(text, join(chunks));
        assertIndexes(chunks);
        for (final NotificationChunk chunk : chunks) {
            assertTrue(chunk.body().length() <= 25);
            assertFalse(Character.isHighSurrogate(chunk.body().charAt(chunk.body().length() - 1)));
            assertFalse(Character.isLowSurrogate(chunk.body().charAt(0)));
            assertEquals(chunk.body(), new String(chunk.body().getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8));
        }
    }

    @Test
    void testSingleCharLimitKeepsSupplementaryCharactersWhole() {
        final String text = "a\uD83D\uDCC8b";

        final List<NotificationChunk> chunks = chunker.chunk(text, 1, 0);

        assertEquals(List.of("a", "\uD83D\uDCC8", "b"), chunks.stream().map(NotificationChunk::body).toList());
    }

    @Test
    void testInvalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> chunker.chunk("text", 0, 5));
    }
}
