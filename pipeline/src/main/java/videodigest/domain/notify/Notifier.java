package videodigest.domain.notify;

import io.vavr.control.Try;

/**
 * Publishes a summary to the chat channel.
 */
public interface Notifier {
    /**
     * @param title       The heading for the message, usually the video title
     * @param summaryText The text to publish. Long text is split into several messages.
     * @return The number of messages delivered, or the failure that stopped delivery
     */
    Try<Integer> publish(String title, String summaryText);
}
