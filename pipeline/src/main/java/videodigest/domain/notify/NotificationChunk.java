package videodigest.domain.notify;

/**
 * One piece of a message that is too long to post in one go.
 *
 * @param index Zero based position of the chunk. Chunks are posted in ascending index order.
 * @param body  The chunk text
 */
public record NotificationChunk(int index, String body) {
}
