package com.flyknight.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Network settings shared by host and client.
 *
 * Defaults match the LAN game: port 5555, four players, 30 broadcasts per
 * second. {@link #load()} layers {@value #RESOURCE} from the classpath and
 * then JVM system properties over those defaults.
 */
public final class SyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(SyncConfig.class);

    public static final String RESOURCE = "flyknight-sync.properties";

    public static final int DEFAULT_PORT = 5555;
    public static final int DEFAULT_MAX_PLAYERS = 4;
    public static final int DEFAULT_TICK_RATE = 30;

    private final String bindAddress;
    private final int port;
    private final int maxPlayers;
    private final int tickRate;
    private final Duration receiveTimeout;
    private final Duration sendTimeout;
    private final Duration connectTimeout;
    private final int idleTimeoutSeconds;
    private final int maxFrameLength;

    private SyncConfig(Builder builder) {
        this.bindAddress = builder.bindAddress;
        this.port = requireRange("port", builder.port, 0, 65535);
        this.maxPlayers = requireRange("max-players", builder.maxPlayers, 1, Integer.MAX_VALUE);
        this.tickRate = requireRange("tick-rate", builder.tickRate, 1, 1000);
        this.receiveTimeout = requirePositive("receive-timeout-ms", builder.receiveTimeout);
        this.sendTimeout = requirePositive("send-timeout-ms", builder.sendTimeout);
        this.connectTimeout = requirePositive("connect-timeout-ms", builder.connectTimeout);
        this.idleTimeoutSeconds = requireRange("idle-timeout-seconds", builder.idleTimeoutSeconds, 0, Integer.MAX_VALUE);
        this.maxFrameLength = requireRange("max-frame-length", builder.maxFrameLength, 64, Integer.MAX_VALUE);
    }

    public static SyncConfig defaults() {
        return builder().build();
    }

    /**
     * Loads {@value #RESOURCE} if present, then applies system property overrides
     * ({@code flyknight.sync.port=6000} and so on).
     */
    public static SyncConfig load() {
        Properties properties = new Properties();
        try (InputStream in = SyncConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            } else {
                logger.debug("No {} on classpath, using defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(Builder.PREFIX)) {
                properties.setProperty(key, System.getProperty(key));
            }
        }
        return builder().apply(properties).build();
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public int getPort() {
        return port;
    }

    public int getMaxPlayers() {
        return maxPlayers;
    }

    public int getTickRate() {
        return tickRate;
    }

    /**
     * Time between two broadcasts.
     */
    public Duration getTickPeriod() {
        return Duration.ofNanos(1_000_000_000L / tickRate);
    }

    public Duration getReceiveTimeout() {
        return receiveTimeout;
    }

    public Duration getSendTimeout() {
        return sendTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * Seconds of silence after which the host drops a session; 0 disables it.
     */
    public int getIdleTimeoutSeconds() {
        return idleTimeoutSeconds;
    }

    public int getMaxFrameLength() {
        return maxFrameLength;
    }

    /**
     * Copy of this configuration with a different port.
     */
    public SyncConfig withPort(int newPort) {
        return toBuilder().port(newPort).build();
    }

    public Builder toBuilder() {
        return builder()
                .bindAddress(bindAddress)
                .port(port)
                .maxPlayers(maxPlayers)
                .tickRate(tickRate)
                .receiveTimeout(receiveTimeout)
                .sendTimeout(sendTimeout)
                .connectTimeout(connectTimeout)
                .idleTimeoutSeconds(idleTimeoutSeconds)
                .maxFrameLength(maxFrameLength);
    }

    private static int requireRange(String key, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(key + " must be between " + min + " and " + max + ", was " + value);
        }
        return value;
    }

    private static Duration requirePositive(String key, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(key + " must be positive, was " + value);
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        static final String PREFIX = "flyknight.sync.";

        private String bindAddress = "0.0.0.0";
        private int port = DEFAULT_PORT;
        private int maxPlayers = DEFAULT_MAX_PLAYERS;
        private int tickRate = DEFAULT_TICK_RATE;
        private Duration receiveTimeout = Duration.ofSeconds(5);
        private Duration sendTimeout = Duration.ofSeconds(5);
        private Duration connectTimeout = Duration.ofSeconds(5);
        private int idleTimeoutSeconds = 0;
        private int maxFrameLength = 1024 * 1024;

        public Builder bindAddress(String bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder maxPlayers(int maxPlayers) {
            this.maxPlayers = maxPlayers;
            return this;
        }

        public Builder tickRate(int tickRate) {
            this.tickRate = tickRate;
            return this;
        }

        public Builder receiveTimeout(Duration receiveTimeout) {
            this.receiveTimeout = receiveTimeout;
            return this;
        }

        public Builder sendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder idleTimeoutSeconds(int idleTimeoutSeconds) {
            this.idleTimeoutSeconds = idleTimeoutSeconds;
            return this;
        }

        public Builder maxFrameLength(int maxFrameLength) {
            this.maxFrameLength = maxFrameLength;
            return this;
        }

        /**
         * Applies every {@code flyknight.sync.*} key found in the given properties.
         */
        public Builder apply(Properties properties) {
            String address = properties.getProperty(PREFIX + "bind-address");
            if (address != null && !address.isBlank()) {
                bindAddress = address.trim();
            }
            port = intValue(properties, "port", port);
            maxPlayers = intValue(properties, "max-players", maxPlayers);
            tickRate = intValue(properties, "tick-rate", tickRate);
            receiveTimeout = Duration.ofMillis(intValue(properties, "receive-timeout-ms", (int) receiveTimeout.toMillis()));
            sendTimeout = Duration.ofMillis(intValue(properties, "send-timeout-ms", (int) sendTimeout.toMillis()));
            connectTimeout = Duration.ofMillis(intValue(properties, "connect-timeout-ms", (int) connectTimeout.toMillis()));
            idleTimeoutSeconds = intValue(properties, "idle-timeout-seconds", idleTimeoutSeconds);
            maxFrameLength = intValue(properties, "max-frame-length", maxFrameLength);
            return this;
        }

        private static int intValue(Properties properties, String key, int fallback) {
            String raw = properties.getProperty(PREFIX + key);
            if (raw == null || raw.isBlank()) {
                return fallback;
            }
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(PREFIX + key + " is not a number: '" + raw + "'", e);
            }
        }

        public SyncConfig build() {
            return new SyncConfig(this);
        }
    }

    @Override
    public String toString() {
        return "SyncConfig{" +
                "bindAddress='" + bindAddress + '\'' +
                ", port=" + port +
                ", maxPlayers=" + maxPlayers +
                ", tickRate=" + tickRate +
                ", idleTimeoutSeconds=" + idleTimeoutSeconds +
                '}';
    }
}
