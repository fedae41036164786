package ae.teletronics.custody.domain.model;

/**
 * Where the blob transport keeps a payload: the channel it was posted to and the
 * message carrying it. Both are needed to delete the payload remotely.
 * Several file records may share one location (clones point at the same message).
 */
public record TransportLocation(long channelId, long messageId) {

    @Override
    public String toString() {
        return channelId + "/" + messageId;
    }
}
