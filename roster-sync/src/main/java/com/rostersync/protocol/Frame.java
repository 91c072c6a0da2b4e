package com.rostersync.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rostersync.delta.DeltaMetadata;
import com.rostersync.delta.DeltaPackage;
import com.rostersync.delta.EntityChange;
import com.rostersync.state.Entity;
import com.rostersync.state.Snapshot;

import java.util.List;

/**
 * One message of the roster feed protocol.
 *
 * A single flat shape covers every frame type; fields that a type does not
 * use are left null and omitted from the JSON.
 *
 * JSON formats:
 * {"type":"SUBSCRIBE","clientId":"observer-1"}
 * {"type":"RESYNC_REQUEST","lastKnownVersion":41}
 * {"type":"FULL_SNAPSHOT","version":42,"entities":[...]}
 * {"type":"DELTA","baseVersion":42,"targetVersion":43,"changes":[...],"metadata":{...}}
 * {"type":"HEARTBEAT"}
 *
 * Every frame also carries the sender's timestamp in epoch millis.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Frame {

    private FrameType type;
    private String clientId;
    private Long lastKnownVersion;
    private Long version;
    private List<Entity> entities;
    private Long baseVersion;
    private Long targetVersion;
    private List<EntityChange> changes;
    private DeltaMetadata metadata;
    private Long timestamp;

    // Default constructor for Jackson deserialization
    public Frame() {
    }

    private Frame(Builder builder) {
        this.type = builder.type;
        this.clientId = builder.clientId;
        this.lastKnownVersion = builder.lastKnownVersion;
        this.version = builder.version;
        this.entities = builder.entities;
        this.baseVersion = builder.baseVersion;
        this.targetVersion = builder.targetVersion;
        this.changes = builder.changes;
        this.metadata = builder.metadata;
        this.timestamp = builder.timestamp != null ? builder.timestamp : System.currentTimeMillis();
    }

    public static Frame subscribe(String clientId) {
        return builder().type(FrameType.SUBSCRIBE).clientId(clientId).build();
    }

    public static Frame resyncRequest(long lastKnownVersion) {
        return builder().type(FrameType.RESYNC_REQUEST).lastKnownVersion(lastKnownVersion).build();
    }

    public static Frame heartbeat() {
        return builder().type(FrameType.HEARTBEAT).build();
    }

    public static Frame fullSnapshot(Snapshot snapshot) {
        return builder()
                .type(FrameType.FULL_SNAPSHOT)
                .version(snapshot.getVersion())
                .entities(snapshot.sortedEntities())
                .timestamp(snapshot.getCapturedAt())
                .build();
    }

    public static Frame delta(DeltaPackage pkg) {
        return builder()
                .type(FrameType.DELTA)
                .baseVersion(pkg.getBaseVersion())
                .targetVersion(pkg.getTargetVersion())
                .changes(pkg.getChanges())
                .metadata(pkg.getMetadata())
                .build();
    }

    /**
     * Rebuilds the roster carried by a FULL_SNAPSHOT frame.
     * Only valid on frames that passed {@link FrameCodec#decode}.
     */
    public Snapshot toSnapshot() {
        return Snapshot.of(version, timestamp != null ? timestamp : 0L, entities);
    }

    /**
     * Rebuilds the package carried by a DELTA frame.
     * Only valid on frames that passed {@link FrameCodec#decode}.
     */
    public DeltaPackage toDeltaPackage() {
        return new DeltaPackage(baseVersion, targetVersion, changes, metadata);
    }

    // Getters
    public FrameType getType() {
        return type;
    }

    public String getClientId() {
        return clientId;
    }

    public Long getLastKnownVersion() {
        return lastKnownVersion;
    }

    public Long getVersion() {
        return version;
    }

    public List<Entity> getEntities() {
        return entities;
    }

    public Long getBaseVersion() {
        return baseVersion;
    }

    public Long getTargetVersion() {
        return targetVersion;
    }

    public List<EntityChange> getChanges() {
        return changes;
    }

    public DeltaMetadata getMetadata() {
        return metadata;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    // Setters for Jackson deserialization
    public void setType(FrameType type) {
        this.type = type;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public void setLastKnownVersion(Long lastKnownVersion) {
        this.lastKnownVersion = lastKnownVersion;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public void setEntities(List<Entity> entities) {
        this.entities = entities;
    }

    public void setBaseVersion(Long baseVersion) {
        this.baseVersion = baseVersion;
    }

    public void setTargetVersion(Long targetVersion) {
        this.targetVersion = targetVersion;
    }

    public void setChanges(List<EntityChange> changes) {
        this.changes = changes;
    }

    public void setMetadata(DeltaMetadata metadata) {
        this.metadata = metadata;
    }

    public void setTimestamp(Long timestamp) {
        this.timestamp = timestamp;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private FrameType type;
        private String clientId;
        private Long lastKnownVersion;
        private Long version;
        private List<Entity> entities;
        private Long baseVersion;
        private Long targetVersion;
        private List<EntityChange> changes;
        private DeltaMetadata metadata;
        private Long timestamp;

        public Builder type(FrameType type) {
            this.type = type;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder lastKnownVersion(Long lastKnownVersion) {
            this.lastKnownVersion = lastKnownVersion;
            return this;
        }

        public Builder version(Long version) {
            this.version = version;
            return this;
        }

        public Builder entities(List<Entity> entities) {
            this.entities = entities;
            return this;
        }

        public Builder baseVersion(Long baseVersion) {
            this.baseVersion = baseVersion;
            return this;
        }

        public Builder targetVersion(Long targetVersion) {
            this.targetVersion = targetVersion;
            return this;
        }

        public Builder changes(List<EntityChange> changes) {
            this.changes = changes;
            return this;
        }

        public Builder metadata(DeltaMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder timestamp(Long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Frame build() {
            return new Frame(this);
        }
    }

    @Override
    public String toString() {
        return "Frame{" +
                "type=" + type +
                (version != null ? ", version=" + version : "") +
                (baseVersion != null ? ", baseVersion=" + baseVersion : "") +
                (targetVersion != null ? ", targetVersion=" + targetVersion : "") +
                (changes != null ? ", changes=" + changes.size() : "") +
                '}';
    }
}
