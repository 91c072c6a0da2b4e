package com.rostersync.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * One monitored participant on the roster.
 *
 * Entities are immutable value objects. A change produces a new Entity
 * (see the {@code with*} methods and {@link EntityPatch#applyTo(Entity)});
 * nothing ever mutates one in place, so a Snapshot can be shared across
 * threads without copying.
 *
 * JSON format:
 * {
 *     "id": "s1",
 *     "displayName": "Ada",
 *     "teamName": "team-a",
 *     "status": "active",
 *     "actionCount": 12,
 *     "errorCount": 1,
 *     "currentLocation": "lesson-03.ipynb",
 *     "lastActivityAt": 1234567890
 * }
 */
@JsonPropertyOrder({"id", "displayName", "teamName", "status", "actionCount",
        "errorCount", "currentLocation", "lastActivityAt"})
public final class Entity {

    private final String id;
    private final String displayName;
    private final String teamName;
    private final EntityStatus status;
    private final long actionCount;
    private final long errorCount;
    private final String currentLocation;
    private final long lastActivityAt;

    @JsonCreator
    public Entity(@JsonProperty("id") String id,
                  @JsonProperty("displayName") String displayName,
                  @JsonProperty("teamName") String teamName,
                  @JsonProperty("status") EntityStatus status,
                  @JsonProperty("actionCount") long actionCount,
                  @JsonProperty("errorCount") long errorCount,
                  @JsonProperty("currentLocation") String currentLocation,
                  @JsonProperty("lastActivityAt") long lastActivityAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.displayName = displayName != null ? displayName : "";
        this.teamName = teamName != null ? teamName : "";
        this.status = status != null ? status : EntityStatus.UNKNOWN;
        this.actionCount = actionCount;
        this.errorCount = errorCount;
        this.currentLocation = currentLocation != null ? currentLocation : "";
        this.lastActivityAt = lastActivityAt;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getTeamName() {
        return teamName;
    }

    public EntityStatus getStatus() {
        return status;
    }

    public long getActionCount() {
        return actionCount;
    }

    public long getErrorCount() {
        return errorCount;
    }

    public String getCurrentLocation() {
        return currentLocation;
    }

    public long getLastActivityAt() {
        return lastActivityAt;
    }

    public Entity withStatus(EntityStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }

    public Entity withLocation(String newLocation, long activityAt) {
        return toBuilder().currentLocation(newLocation).lastActivityAt(activityAt).build();
    }

    /**
     * Records one more action (and optionally one more error) at the given time.
     */
    public Entity withAction(boolean failed, long activityAt) {
        return toBuilder()
                .actionCount(actionCount + 1)
                .errorCount(failed ? errorCount + 1 : errorCount)
                .lastActivityAt(activityAt)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .displayName(displayName)
                .teamName(teamName)
                .status(status)
                .actionCount(actionCount)
                .errorCount(errorCount)
                .currentLocation(currentLocation)
                .lastActivityAt(lastActivityAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String displayName = "";
        private String teamName = "";
        private EntityStatus status = EntityStatus.UNKNOWN;
        private long actionCount;
        private long errorCount;
        private String currentLocation = "";
        private long lastActivityAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder teamName(String teamName) {
            this.teamName = teamName;
            return this;
        }

        public Builder status(EntityStatus status) {
            this.status = status;
            return this;
        }

        public Builder actionCount(long actionCount) {
            this.actionCount = actionCount;
            return this;
        }

        public Builder errorCount(long errorCount) {
            this.errorCount = errorCount;
            return this;
        }

        public Builder currentLocation(String currentLocation) {
            this.currentLocation = currentLocation;
            return this;
        }

        public Builder lastActivityAt(long lastActivityAt) {
            this.lastActivityAt = lastActivityAt;
            return this;
        }

        public Entity build() {
            return new Entity(id, displayName, teamName, status, actionCount,
                    errorCount, currentLocation, lastActivityAt);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Entity)) {
            return false;
        }
        Entity other = (Entity) o;
        return actionCount == other.actionCount
                && errorCount == other.errorCount
                && lastActivityAt == other.lastActivityAt
                && id.equals(other.id)
                && displayName.equals(other.displayName)
                && teamName.equals(other.teamName)
                && status == other.status
                && currentLocation.equals(other.currentLocation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, displayName, teamName, status, actionCount,
                errorCount, currentLocation, lastActivityAt);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", status=" + status +
                ", actionCount=" + actionCount +
                ", errorCount=" + errorCount +
                ", currentLocation='" + currentLocation + '\'' +
                '}';
    }
}
