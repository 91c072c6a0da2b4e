package com.rostersync.delta;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.rostersync.state.Entity;
import com.rostersync.state.EntityPatch;

import java.util.Objects;

/**
 * One entry of a delta: an entity was created, updated or removed.
 *
 * The set of change kinds is closed. Consumers handle them through
 * {@link #accept(Visitor)}, which makes the compiler reject any handler
 * that forgets a kind.
 *
 * Wire format (discriminated by "op"):
 * {"op":"created","entity":{...}}
 * {"op":"updated","id":"s1","fields":{"status":"error"}}
 * {"op":"removed","id":"s2"}
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "op")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EntityChange.Created.class, name = "created"),
        @JsonSubTypes.Type(value = EntityChange.Updated.class, name = "updated"),
        @JsonSubTypes.Type(value = EntityChange.Removed.class, name = "removed")
})
public sealed interface EntityChange permits EntityChange.Created, EntityChange.Updated, EntityChange.Removed {

    /**
     * The id of the entity this change targets.
     */
    @JsonIgnore
    String entityId();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R created(Created change);

        R updated(Updated change);

        R removed(Removed change);
    }

    final class Created implements EntityChange {

        private final Entity entity;

        @JsonCreator
        public Created(@JsonProperty("entity") Entity entity) {
            this.entity = Objects.requireNonNull(entity, "entity");
        }

        public Entity getEntity() {
            return entity;
        }

        @Override
        public String entityId() {
            return entity.getId();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.created(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Created && entity.equals(((Created) o).entity);
        }

        @Override
        public int hashCode() {
            return entity.hashCode();
        }

        @Override
        public String toString() {
            return "Created(" + entity.getId() + ")";
        }
    }

    @JsonPropertyOrder({"id", "fields"})
    final class Updated implements EntityChange {

        private final String id;
        private final EntityPatch fields;

        @JsonCreator
        public Updated(@JsonProperty("id") String id, @JsonProperty("fields") EntityPatch fields) {
            this.id = Objects.requireNonNull(id, "id");
            this.fields = fields != null ? fields : EntityPatch.empty();
        }

        public String getId() {
            return id;
        }

        public EntityPatch getFields() {
            return fields;
        }

        @Override
        public String entityId() {
            return id;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.updated(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Updated)) {
                return false;
            }
            Updated other = (Updated) o;
            return id.equals(other.id) && fields.equals(other.fields);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, fields);
        }

        @Override
        public String toString() {
            return "Updated(" + id + ", " + fields.changedFields() + ")";
        }
    }

    final class Removed implements EntityChange {

        private final String id;

        @JsonCreator
        public Removed(@JsonProperty("id") String id) {
            this.id = Objects.requireNonNull(id, "id");
        }

        public String getId() {
            return id;
        }

        @Override
        public String entityId() {
            return id;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.removed(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Removed && id.equals(((Removed) o).id);
        }

        @Override
        public int hashCode() {
            return id.hashCode();
        }

        @Override
        public String toString() {
            return "Removed(" + id + ")";
        }
    }
}
