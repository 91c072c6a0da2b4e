package com.rostersync.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Observed status of a monitored participant.
 *
 * Wire values are lower-case with dashes ("help-requesting"). Values this
 * build does not know map to UNKNOWN instead of failing the whole frame.
 */
public enum EntityStatus {
    ACTIVE("active"),
    IDLE("idle"),
    ERROR("error"),
    HELP_REQUESTING("help-requesting"),
    UNKNOWN("unknown");

    private final String wireValue;

    EntityStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static EntityStatus fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (EntityStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
