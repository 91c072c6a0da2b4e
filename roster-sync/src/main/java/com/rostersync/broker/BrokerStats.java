package com.rostersync.broker;

/**
 * Counters of one broker since construction.
 */
public final class BrokerStats {

    private final ConnectionState state;
    private final int subscriberCount;
    private final long framesReceived;
    private final long fullSnapshots;
    private final long deltasApplied;
    private final long deltasRejected;
    private final long protocolErrors;
    private final long resyncRequests;
    private final long currentVersion;

    BrokerStats(ConnectionState state, int subscriberCount, long framesReceived, long fullSnapshots,
                long deltasApplied, long deltasRejected, long protocolErrors, long resyncRequests,
                long currentVersion) {
        this.state = state;
        this.subscriberCount = subscriberCount;
        this.framesReceived = framesReceived;
        this.fullSnapshots = fullSnapshots;
        this.deltasApplied = deltasApplied;
        this.deltasRejected = deltasRejected;
        this.protocolErrors = protocolErrors;
        this.resyncRequests = resyncRequests;
        this.currentVersion = currentVersion;
    }

    public ConnectionState getState() {
        return state;
    }

    public int getSubscriberCount() {
        return subscriberCount;
    }

    public long getFramesReceived() {
        return framesReceived;
    }

    public long getFullSnapshots() {
        return fullSnapshots;
    }

    public long getDeltasApplied() {
        return deltasApplied;
    }

    public long getDeltasRejected() {
        return deltasRejected;
    }

    public long getProtocolErrors() {
        return protocolErrors;
    }

    public long getResyncRequests() {
        return resyncRequests;
    }

    public long getCurrentVersion() {
        return currentVersion;
    }

    @Override
    public String toString() {
        return "BrokerStats{" +
                "state=" + state +
                ", subscribers=" + subscriberCount +
                ", frames=" + framesReceived +
                ", fullSnapshots=" + fullSnapshots +
                ", deltasApplied=" + deltasApplied +
                ", deltasRejected=" + deltasRejected +
                ", protocolErrors=" + protocolErrors +
                ", resyncRequests=" + resyncRequests +
                ", version=" + currentVersion +
                '}';
    }
}
