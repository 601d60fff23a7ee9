package videodigest.domain.exceptions;

/**
 * Some notification chunks were delivered before a later one failed. Delivered chunks are not recalled
 * and the remaining chunks are not sent.
 */
public class PartialDelivery extends RuntimeException implements ExternalException {
    private final int delivered;
    private final int total;

    public PartialDelivery(final int delivered, final int total, final Throwable cause) {
        super("Delivered " + delivered + " of " + total + " message chunks before a failure", cause);
        this.delivered = delivered;
        this.total = total;
    }

    public int getDelivered() {
        return delivered;
    }

    public int getTotal() {
        return total;
    }
}
