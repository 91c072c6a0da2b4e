package com.rostersync.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The changed fields of one entity: a partial Entity.
 *
 * A null field means "unchanged". Entity text fields are never null (they
 * normalize to ""), so a null here is never ambiguous with a cleared value.
 * The id is not part of a patch; ids are immutable.
 *
 * Example: {"status":"error","errorCount":3}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"displayName", "teamName", "status", "actionCount",
        "errorCount", "currentLocation", "lastActivityAt"})
public final class EntityPatch {

    private static final EntityPatch EMPTY = new EntityPatch(null, null, null, null, null, null, null);

    private final String displayName;
    private final String teamName;
    private final EntityStatus status;
    private final Long actionCount;
    private final Long errorCount;
    private final String currentLocation;
    private final Long lastActivityAt;

    @JsonCreator
    public EntityPatch(@JsonProperty("displayName") String displayName,
                       @JsonProperty("teamName") String teamName,
                       @JsonProperty("status") EntityStatus status,
                       @JsonProperty("actionCount") Long actionCount,
                       @JsonProperty("errorCount") Long errorCount,
                       @JsonProperty("currentLocation") String currentLocation,
                       @JsonProperty("lastActivityAt") Long lastActivityAt) {
        this.displayName = displayName;
        this.teamName = teamName;
        this.status = status;
        this.actionCount = actionCount;
        this.errorCount = errorCount;
        this.currentLocation = currentLocation;
        this.lastActivityAt = lastActivityAt;
    }

    public static EntityPatch empty() {
        return EMPTY;
    }

    /**
     * Field-level comparison: returns a patch holding only the fields of
     * {@code next} that differ from {@code previous}.
     */
    public static EntityPatch between(Entity previous, Entity next) {
        return new EntityPatch(
                differ(previous.getDisplayName(), next.getDisplayName()),
                differ(previous.getTeamName(), next.getTeamName()),
                previous.getStatus() != next.getStatus() ? next.getStatus() : null,
                previous.getActionCount() != next.getActionCount() ? next.getActionCount() : null,
                previous.getErrorCount() != next.getErrorCount() ? next.getErrorCount() : null,
                differ(previous.getCurrentLocation(), next.getCurrentLocation()),
                previous.getLastActivityAt() != next.getLastActivityAt() ? next.getLastActivityAt() : null);
    }

    private static String differ(String before, String after) {
        return before.equals(after) ? null : after;
    }

    /**
     * Merges the listed fields into {@code target}; unlisted fields keep their value.
     */
    public Entity applyTo(Entity target) {
        Entity.Builder builder = target.toBuilder();
        if (displayName != null) {
            builder.displayName(displayName);
        }
        if (teamName != null) {
            builder.teamName(teamName);
        }
        if (status != null) {
            builder.status(status);
        }
        if (actionCount != null) {
            builder.actionCount(actionCount);
        }
        if (errorCount != null) {
            builder.errorCount(errorCount);
        }
        if (currentLocation != null) {
            builder.currentLocation(currentLocation);
        }
        if (lastActivityAt != null) {
            builder.lastActivityAt(lastActivityAt);
        }
        return builder.build();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return changedFields().isEmpty();
    }

    /**
     * Names of the fields this patch carries, in wire order.
     */
    @JsonIgnore
    public List<String> changedFields() {
        List<String> fields = new ArrayList<>(7);
        if (displayName != null) {
            fields.add("displayName");
        }
        if (teamName != null) {
            fields.add("teamName");
        }
        if (status != null) {
            fields.add("status");
        }
        if (actionCount != null) {
            fields.add("actionCount");
        }
        if (errorCount != null) {
            fields.add("errorCount");
        }
        if (currentLocation != null) {
            fields.add("currentLocation");
        }
        if (lastActivityAt != null) {
            fields.add("lastActivityAt");
        }
        return fields;
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

    public Long getActionCount() {
        return actionCount;
    }

    public Long getErrorCount() {
        return errorCount;
    }

    public String getCurrentLocation() {
        return currentLocation;
    }

    public Long getLastActivityAt() {
        return lastActivityAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EntityPatch)) {
            return false;
        }
        EntityPatch other = (EntityPatch) o;
        return Objects.equals(displayName, other.displayName)
                && Objects.equals(teamName, other.teamName)
                && status == other.status
                && Objects.equals(actionCount, other.actionCount)
                && Objects.equals(errorCount, other.errorCount)
                && Objects.equals(currentLocation, other.currentLocation)
                && Objects.equals(lastActivityAt, other.lastActivityAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(displayName, teamName, status, actionCount, errorCount,
                currentLocation, lastActivityAt);
    }

    @Override
    public String toString() {
        return "EntityPatch" + changedFields();
    }
}
