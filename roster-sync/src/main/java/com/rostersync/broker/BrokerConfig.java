package com.rostersync.broker;

import com.rostersync.monitor.PerformanceMonitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Settings for the {@link ConnectionBroker}.
 *
 * Every value has a default; {@link #fromEnvironment(Map)} overrides them from
 * ROSTER_SYNC_* environment variables. An unparsable variable is logged and
 * the default kept; a parsable but out-of-range value fails {@link Builder#build()}.
 */
public final class BrokerConfig {

    private static final Logger logger = LoggerFactory.getLogger(BrokerConfig.class);

    public static final String ENV_UPSTREAM_URL = "ROSTER_SYNC_UPSTREAM_URL";
    public static final String ENV_CLIENT_ID = "ROSTER_SYNC_CLIENT_ID";
    public static final String ENV_BACKOFF_BASE_MS = "ROSTER_SYNC_BACKOFF_BASE_MS";
    public static final String ENV_BACKOFF_MULTIPLIER = "ROSTER_SYNC_BACKOFF_MULTIPLIER";
    public static final String ENV_BACKOFF_MAX_MS = "ROSTER_SYNC_BACKOFF_MAX_MS";
    public static final String ENV_BACKOFF_JITTER = "ROSTER_SYNC_BACKOFF_JITTER";
    public static final String ENV_MAX_RETRY_ATTEMPTS = "ROSTER_SYNC_MAX_RETRY_ATTEMPTS";
    public static final String ENV_HEARTBEAT_TIMEOUT_MS = "ROSTER_SYNC_HEARTBEAT_TIMEOUT_MS";
    public static final String ENV_HEARTBEAT_INTERVAL_MS = "ROSTER_SYNC_HEARTBEAT_INTERVAL_MS";
    public static final String ENV_PROTOCOL_ERROR_THRESHOLD = "ROSTER_SYNC_PROTOCOL_ERROR_THRESHOLD";
    public static final String ENV_PROTOCOL_ERROR_WINDOW_MS = "ROSTER_SYNC_PROTOCOL_ERROR_WINDOW_MS";
    public static final String ENV_RESYNC_RETRY_MS = "ROSTER_SYNC_RESYNC_RETRY_MS";
    public static final String ENV_MONITOR_CAPACITY = "ROSTER_SYNC_MONITOR_CAPACITY";
    public static final String ENV_MAX_FRAME_BYTES = "ROSTER_SYNC_MAX_FRAME_BYTES";

    private final URI upstreamUri;
    private final String clientId;
    private final Duration backoffBase;
    private final double backoffMultiplier;
    private final Duration backoffMax;
    private final double backoffJitter;
    private final int maxRetryAttempts;
    private final Duration heartbeatTimeout;
    private final Duration heartbeatInterval;
    private final int protocolErrorThreshold;
    private final Duration protocolErrorWindow;
    private final Duration resyncRetryInterval;
    private final int monitorCapacity;
    private final int maxFrameBytes;

    private BrokerConfig(Builder builder) {
        this.upstreamUri = Objects.requireNonNull(builder.upstreamUri, "upstreamUri");
        this.clientId = builder.clientId != null ? builder.clientId : "observer-" + UUID.randomUUID();
        this.backoffBase = positive(builder.backoffBase, "backoffBase");
        this.backoffMultiplier = builder.backoffMultiplier;
        this.backoffMax = positive(builder.backoffMax, "backoffMax");
        this.backoffJitter = builder.backoffJitter;
        this.maxRetryAttempts = builder.maxRetryAttempts;
        this.heartbeatTimeout = positive(builder.heartbeatTimeout, "heartbeatTimeout");
        this.heartbeatInterval = positive(builder.heartbeatInterval, "heartbeatInterval");
        this.protocolErrorThreshold = builder.protocolErrorThreshold;
        this.protocolErrorWindow = positive(builder.protocolErrorWindow, "protocolErrorWindow");
        this.resyncRetryInterval = Objects.requireNonNull(builder.resyncRetryInterval, "resyncRetryInterval");
        this.monitorCapacity = builder.monitorCapacity;
        this.maxFrameBytes = builder.maxFrameBytes;

        String scheme = upstreamUri.getScheme();
        if (!"ws".equalsIgnoreCase(scheme) && !"wss".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("Upstream URL must be ws:// or wss://, got " + upstreamUri);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1, got " + backoffMultiplier);
        }
        if (backoffJitter < 0.0 || backoffJitter > 1.0) {
            throw new IllegalArgumentException("backoffJitter must be within [0, 1], got " + backoffJitter);
        }
        if (maxRetryAttempts < 0) {
            throw new IllegalArgumentException("maxRetryAttempts must be >= 0, got " + maxRetryAttempts);
        }
        if (protocolErrorThreshold < 1) {
            throw new IllegalArgumentException("protocolErrorThreshold must be >= 1, got " + protocolErrorThreshold);
        }
        if (monitorCapacity < 1 || maxFrameBytes < 1) {
            throw new IllegalArgumentException("monitorCapacity and maxFrameBytes must be positive");
        }
    }

    private static Duration positive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }

    public static BrokerConfig defaults() {
        return builder().build();
    }

    /**
     * Reads overrides from the process environment.
     */
    public static BrokerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static BrokerConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();

        read(env, ENV_UPSTREAM_URL, URI::create, (URI uri) -> builder.upstreamUri(uri));
        read(env, ENV_CLIENT_ID, Function.identity(), builder::clientId);
        read(env, ENV_BACKOFF_BASE_MS, BrokerConfig::millis, builder::backoffBase);
        read(env, ENV_BACKOFF_MULTIPLIER, Double::parseDouble, builder::backoffMultiplier);
        read(env, ENV_BACKOFF_MAX_MS, BrokerConfig::millis, builder::backoffMax);
        read(env, ENV_BACKOFF_JITTER, Double::parseDouble, builder::backoffJitter);
        read(env, ENV_MAX_RETRY_ATTEMPTS, Integer::parseInt, builder::maxRetryAttempts);
        read(env, ENV_HEARTBEAT_TIMEOUT_MS, BrokerConfig::millis, builder::heartbeatTimeout);
        read(env, ENV_HEARTBEAT_INTERVAL_MS, BrokerConfig::millis, builder::heartbeatInterval);
        read(env, ENV_PROTOCOL_ERROR_THRESHOLD, Integer::parseInt, builder::protocolErrorThreshold);
        read(env, ENV_PROTOCOL_ERROR_WINDOW_MS, BrokerConfig::millis, builder::protocolErrorWindow);
        read(env, ENV_RESYNC_RETRY_MS, BrokerConfig::millis, builder::resyncRetryInterval);
        read(env, ENV_MONITOR_CAPACITY, Integer::parseInt, builder::monitorCapacity);
        read(env, ENV_MAX_FRAME_BYTES, Integer::parseInt, builder::maxFrameBytes);

        return builder.build();
    }

    private static Duration millis(String value) {
        long ms = Long.parseLong(value);
        if (ms < 0) {
            throw new IllegalArgumentException("negative duration");
        }
        return Duration.ofMillis(ms);
    }

    private static <T> void read(Map<String, String> env, String name,
                                 Function<String, T> parser, Consumer<T> target) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            target.accept(parser.apply(raw.trim()));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid value '{}' for {}, using default", raw, name);
        }
    }

    public URI getUpstreamUri() {
        return upstreamUri;
    }

    public String getClientId() {
        return clientId;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public Duration getBackoffMax() {
        return backoffMax;
    }

    public double getBackoffJitter() {
        return backoffJitter;
    }

    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }

    public Duration getHeartbeatTimeout() {
        return heartbeatTimeout;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public int getProtocolErrorThreshold() {
        return protocolErrorThreshold;
    }

    public Duration getProtocolErrorWindow() {
        return protocolErrorWindow;
    }

    public Duration getResyncRetryInterval() {
        return resyncRetryInterval;
    }

    public int getMonitorCapacity() {
        return monitorCapacity;
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private URI upstreamUri = URI.create("ws://localhost:8080/roster");
        private String clientId;
        private Duration backoffBase = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration backoffMax = Duration.ofSeconds(30);
        private double backoffJitter = 0.1;
        private int maxRetryAttempts = 5;
        private Duration heartbeatTimeout = Duration.ofSeconds(60);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private int protocolErrorThreshold = 5;
        private Duration protocolErrorWindow = Duration.ofSeconds(60);
        private Duration resyncRetryInterval = Duration.ofSeconds(5);
        private int monitorCapacity = PerformanceMonitor.DEFAULT_CAPACITY;
        private int maxFrameBytes = 1 << 20;

        public Builder upstreamUri(URI upstreamUri) {
            this.upstreamUri = upstreamUri;
            return this;
        }

        public Builder upstreamUri(String upstreamUri) {
            return upstreamUri(URI.create(upstreamUri));
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder backoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder backoffMax(Duration backoffMax) {
            this.backoffMax = backoffMax;
            return this;
        }

        public Builder backoffJitter(double backoffJitter) {
            this.backoffJitter = backoffJitter;
            return this;
        }

        public Builder maxRetryAttempts(int maxRetryAttempts) {
            this.maxRetryAttempts = maxRetryAttempts;
            return this;
        }

        public Builder heartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = heartbeatTimeout;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder protocolErrorThreshold(int protocolErrorThreshold) {
            this.protocolErrorThreshold = protocolErrorThreshold;
            return this;
        }

        public Builder protocolErrorWindow(Duration protocolErrorWindow) {
            this.protocolErrorWindow = protocolErrorWindow;
            return this;
        }

        public Builder resyncRetryInterval(Duration resyncRetryInterval) {
            this.resyncRetryInterval = resyncRetryInterval;
            return this;
        }

        public Builder monitorCapacity(int monitorCapacity) {
            this.monitorCapacity = monitorCapacity;
            return this;
        }

        public Builder maxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public BrokerConfig build() {
            return new BrokerConfig(this);
        }
    }

    @Override
    public String toString() {
        return "BrokerConfig{" +
                "upstreamUri=" + upstreamUri +
                ", clientId='" + clientId + '\'' +
                ", backoff=" + backoffBase.toMillis() + "ms x" + backoffMultiplier +
                " (max " + backoffMax.toMillis() + "ms, jitter " + backoffJitter + ")" +
                ", maxRetryAttempts=" + maxRetryAttempts +
                ", heartbeatTimeout=" + heartbeatTimeout.toMillis() + "ms" +
                '}';
    }
}
