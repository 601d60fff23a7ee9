package videodigest.domain.notify;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import videodigest.domain.exceptionhandling.ExceptionHandler;
import videodigest.domain.exceptions.InternalFailure;
import videodigest.domain.exceptions.PartialDelivery;
import videodigest.domain.injection.Preferred;
import videodigest.domain.retry.RetryExecutor;
import videodigest.infrastructure.chat.ChatWebhookClient;
import videodigest.infrastructure.chat.api.ChatEmbed;
import videodigest.infrastructure.chat.api.ChatEmbedFooter;
import videodigest.infrastructure.chat.api.ChatWebhookMessage;

import java.time.Instant;
import java.util.List;
import java.util.logging.Logger;

/**
 * Posts the summary to the chat webhook as one embed per chunk.
 * Chunks are posted in order, each with its own retries. If a chunk still fails, the chunks after it are
 * not sent and the chunks before it are left in place.
 */
@ApplicationScoped
public class ChatNotifier implements Notifier {
    /**
     * Discord rejects embed descriptions longer than this.
     */
    public static final int MAX_EMBED_DESCRIPTION_LENGTH = 4096;
    private static final int MAX_EMBED_TITLE_LENGTH = 256;

    @Inject
    @ConfigProperty(name = "vd.chat.maxChunkLength", defaultValue = "4000")
    private Integer maxChunkLength;

    @Inject
    @ConfigProperty(name = "vd.chat.lookback", defaultValue = "500")
    private Integer lookback;

    @Inject
    @ConfigProperty(name = "vd.chat.footer", defaultValue = "KS Forward")
    private String footer;

    @Inject
    @ConfigProperty(name = "vd.chat.color", defaultValue = "5793266")
    private Integer color;

    @Inject
    @Preferred
    private ChatWebhookClient chatWebhookClient;

    @Inject
    private MessageChunker messageChunker;

    @Inject
    private RetryExecutor retryExecutor;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Logger logger;

    @Override
    public Try<Integer> publish(final String title, final String summaryText) {
        if (StringUtils.isBlank(summaryText)) {
            return Try.failure(new InternalFailure("The summary to publish must not be blank"));
        }

        final List<NotificationChunk> chunks = messageChunker.chunk(summaryText, getChunkLimit(), Math.max(0, lookback));
        final String timestamp = Instant.now().toString();

        logger.info("Publishing the summary as " + chunks.size() + " message(s)");

        int delivered = 0;
        for (final NotificationChunk chunk : chunks) {
            final ChatWebhookMessage message = new ChatWebhookMessage(new ChatEmbed(
                    embedTitle(title, chunk.index(), chunks.size()),
                    chunk.body(),
                    color,
                    timestamp,
                    StringUtils.isBlank(footer) ? null : new ChatEmbedFooter(footer)));

            final Try<Void> result = retryExecutor.execute(() -> {
                chatWebhookClient.post(message);
                return null;
            });

            if (result.isFailure()) {
                logger.warning("Abandoning delivery at message " + (chunk.index() + 1) + " of " + chunks.size() + ": "
                        + exceptionHandler.getExceptionMessage(result.getCause()));
                return Try.failure(new PartialDelivery(delivered, chunks.size(), result.getCause()));
            }

            ++delivered;
            logger.info("Delivered message " + delivered + " of " + chunks.size());
        }

        return Try.success(delivered);
    }

    /**
     * The configured length, capped at what the chat platform accepts.
     */
    int getChunkLimit() {
        return Math.max(1, Math.min(maxChunkLength, MAX_EMBED_DESCRIPTION_LENGTH));
    }

    static String embedTitle(final String title, final int index, final int total) {
        final String suffix = total > 1 ? " (" + (index + 1) + "/" + total + ")" : "";
        final String base = StringUtils.defaultIfBlank(title, "Video summary");
        return StringUtils.abbreviate(base, MAX_EMBED_TITLE_LENGTH - suffix.length()) + suffix;
    }
}
