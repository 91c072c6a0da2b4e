package com.rostersync.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.rostersync.delta.DeltaMetadata;
import com.rostersync.delta.EntityChange;
import com.rostersync.state.Entity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Encodes and decodes roster feed frames.
 *
 * Current Implementation: JSON using Jackson
 * - Human-readable, easy to inspect on the wire
 * - Unknown properties are ignored so newer feeds can add fields
 *
 * Decoding also checks the frame against the wire contract (required fields
 * per type, increasing version pair, unique entity ids, delta metadata that
 * agrees with its change list), so everything that leaves {@link #decode} is
 * safe to convert into domain objects.
 *
 * The codec is thread-safe - ObjectMapper is thread-safe after configuration.
 */
public class FrameCodec {

    private static final Logger logger = LoggerFactory.getLogger(FrameCodec.class);

    // ObjectMapper is thread-safe and should be reused
    private final ObjectMapper objectMapper;

    public FrameCodec() {
        this.objectMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Serializes a frame to its JSON text.
     */
    public String encode(Frame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            logger.error("Failed to encode frame: {}", frame, e);
            throw new IllegalStateException("Frame encoding failed", e);
        }
    }

    /**
     * Parses and validates a frame.
     *
     * @throws ProtocolException if the text is not JSON, not a frame, or breaks the wire contract
     */
    public Frame decode(String json) {
        Frame frame;
        try {
            frame = objectMapper.readValue(json, Frame.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed frame: " + e.getOriginalMessage(), e);
        }
        if (frame == null) {
            throw new ProtocolException("Empty frame");
        }
        validate(frame);
        return frame;
    }

    /**
     * Encoded size in bytes of a collection: the sum of each element's compact
     * UTF-8 JSON length. Brackets and separators are not counted, so an empty
     * collection measures 0.
     */
    public long measure(Collection<?> items) {
        long total = 0;
        for (Object item : items) {
            try {
                total += objectMapper.writeValueAsBytes(item).length;
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Cannot measure " + item, e);
            }
        }
        return total;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    private void validate(Frame frame) {
        FrameType type = frame.getType();
        if (type == null) {
            throw new ProtocolException("Frame has no type");
        }

        switch (type) {
            case SUBSCRIBE -> {
                if (frame.getClientId() == null || frame.getClientId().isBlank()) {
                    throw new ProtocolException("SUBSCRIBE without clientId");
                }
            }
            case RESYNC_REQUEST -> require(frame.getLastKnownVersion(), "RESYNC_REQUEST", "lastKnownVersion");
            case FULL_SNAPSHOT -> validateFullSnapshot(frame);
            case DELTA -> validateDelta(frame);
            case HEARTBEAT -> {
                // no body
            }
        }
    }

    private void validateFullSnapshot(Frame frame) {
        Long version = require(frame.getVersion(), "FULL_SNAPSHOT", "version");
        if (version < 0) {
            throw new ProtocolException("FULL_SNAPSHOT with negative version " + version);
        }
        List<Entity> entities = require(frame.getEntities(), "FULL_SNAPSHOT", "entities");
        Set<String> seen = new HashSet<>();
        for (Entity entity : entities) {
            if (entity == null) {
                throw new ProtocolException("FULL_SNAPSHOT contains a null entity");
            }
            if (!seen.add(entity.getId())) {
                throw new ProtocolException("FULL_SNAPSHOT repeats entity id " + entity.getId());
            }
        }
    }

    private void validateDelta(Frame frame) {
        Long base = require(frame.getBaseVersion(), "DELTA", "baseVersion");
        Long target = require(frame.getTargetVersion(), "DELTA", "targetVersion");
        if (base < 0 || target <= base) {
            throw new ProtocolException("DELTA with invalid version pair " + base + " -> " + target);
        }
        List<EntityChange> changes = require(frame.getChanges(), "DELTA", "changes");
        for (EntityChange change : changes) {
            if (change == null) {
                throw new ProtocolException("DELTA contains a null change");
            }
        }
        validateMetadata(require(frame.getMetadata(), "DELTA", "metadata"), changes.size());
    }

    private void validateMetadata(DeltaMetadata metadata, int changeCount) {
        if (metadata.getChangeCount() != changeCount) {
            throw new ProtocolException("DELTA metadata counts " + metadata.getChangeCount()
                    + " changes but carries " + changeCount);
        }
        if (metadata.getFullSizeBytes() < 0 || metadata.getDeltaSizeBytes() < 0) {
            throw new ProtocolException("DELTA metadata with negative size " + metadata);
        }
        double ratio = metadata.getCompressionRatio();
        if (Double.isNaN(ratio) || ratio < 0.0 || ratio > 1.0) {
            throw new ProtocolException("DELTA metadata with compression ratio outside [0, 1]: " + ratio);
        }
    }

    private static <T> T require(T value, String frameType, String field) {
        if (value == null) {
            throw new ProtocolException(frameType + " without " + field);
        }
        return value;
    }
}
