package io.github.umputun.beacon;

import io.github.umputun.beacon.errors.BeaconException;
import io.github.umputun.beacon.errors.ErrorReason;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration options for a subscription session.
 * Use {@link #builder()} to create instances.
 */
public final class ClientOptions {

    /** default service origin */
    public static final String DEFAULT_ORIGIN = "https://ps.pndsn.com";

    /** default timeout for non-subscribe requests (heartbeat, leave) */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    /** default timeout for a long-poll subscribe request, longer than the server hold time */
    public static final Duration DEFAULT_SUBSCRIBE_TIMEOUT = Duration.ofSeconds(310);

    /** default presence timeout announced to the server */
    public static final Duration DEFAULT_PRESENCE_TIMEOUT = Duration.ofSeconds(300);

    /** minimum presence timeout accepted by the server */
    public static final Duration MIN_PRESENCE_TIMEOUT = Duration.ofSeconds(20);

    /** default number of envelopes in one batch that triggers an overflow status */
    public static final int DEFAULT_MESSAGE_COUNT_THRESHOLD = 100;

    /** default size of the duplicate detection window */
    public static final int DEFAULT_MESSAGES_CACHE_SIZE = 100;

    private final String origin;
    private final String subscribeKey;
    private final String userId;
    private final String authKey;
    private final String cipherKey;
    private final boolean randomIv;
    private final Duration timeout;
    private final Duration subscribeTimeout;
    private final Duration presenceTimeout;
    private final Duration heartbeatInterval;
    private final String filterExpression;
    private final boolean suppressLeaveEvents;
    private final boolean maintainPresenceState;
    private final boolean dedupeOnSubscribe;
    private final int maximumMessagesCacheSize;
    private final int requestMessageCountThreshold;
    private final ReconnectPolicy reconnectPolicy;

    private ClientOptions(Builder builder) {
        this.origin = builder.origin;
        this.subscribeKey = builder.subscribeKey;
        this.userId = builder.userId;
        this.authKey = builder.authKey;
        this.cipherKey = builder.cipherKey;
        this.randomIv = builder.randomIv;
        this.timeout = builder.timeout;
        this.subscribeTimeout = builder.subscribeTimeout;
        this.presenceTimeout = builder.presenceTimeout;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.filterExpression = builder.filterExpression;
        this.suppressLeaveEvents = builder.suppressLeaveEvents;
        this.maintainPresenceState = builder.maintainPresenceState;
        this.dedupeOnSubscribe = builder.dedupeOnSubscribe;
        this.maximumMessagesCacheSize = builder.maximumMessagesCacheSize;
        this.requestMessageCountThreshold = builder.requestMessageCountThreshold;
        this.reconnectPolicy = builder.reconnectPolicy;
    }

    /**
     * Creates a new builder for ClientOptions.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the service origin, e.g. https://ps.pndsn.com.
     *
     * @return the origin without trailing slash
     */
    public String getOrigin() {
        return origin;
    }

    /**
     * Returns the subscribe key.
     *
     * @return the subscribe key
     */
    public String getSubscribeKey() {
        return subscribeKey;
    }

    /**
     * Returns the identifier this client announces to the service.
     *
     * @return the user id
     */
    public String getUserId() {
        return userId;
    }

    /**
     * Returns the auth key, or null if not set.
     *
     * @return the auth key
     */
    public String getAuthKey() {
        return authKey;
    }

    /**
     * Returns the cipher key, or null if payloads are not encrypted.
     *
     * @return the cipher key
     */
    public String getCipherKey() {
        return cipherKey;
    }

    /**
     * Checks if a cipher key is configured.
     *
     * @return true if payloads are decrypted
     */
    public boolean isCipherEnabled() {
        return cipherKey != null;
    }

    /**
     * Checks if encrypted payloads carry a random IV prefix.
     *
     * @return true for random IV, false for the fixed legacy IV
     */
    public boolean isRandomIv() {
        return randomIv;
    }

    /**
     * Returns the timeout for heartbeat and leave requests.
     *
     * @return the timeout
     */
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Returns the timeout for one long-poll subscribe request.
     *
     * @return the subscribe timeout
     */
    public Duration getSubscribeTimeout() {
        return subscribeTimeout;
    }

    /**
     * Returns how long the server keeps this client present without a heartbeat.
     *
     * @return the presence timeout
     */
    public Duration getPresenceTimeout() {
        return presenceTimeout;
    }

    /**
     * Returns the period of presence heartbeats, zero when disabled.
     *
     * @return the heartbeat interval
     */
    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    /**
     * Returns the server-side filter expression, or null.
     *
     * @return the filter expression
     */
    public String getFilterExpression() {
        return filterExpression;
    }

    /**
     * Checks if leave notifications are skipped on unsubscribe.
     *
     * @return true if leave calls are suppressed
     */
    public boolean isSuppressLeaveEvents() {
        return suppressLeaveEvents;
    }

    /**
     * Checks if presence state is sent with every subscribe request.
     *
     * @return true if state is maintained
     */
    public boolean isMaintainPresenceState() {
        return maintainPresenceState;
    }

    /**
     * Checks if recently seen envelopes are dropped.
     *
     * @return true if duplicates are filtered
     */
    public boolean isDedupeOnSubscribe() {
        return dedupeOnSubscribe;
    }

    /**
     * Returns the size of the duplicate detection window.
     *
     * @return number of remembered envelopes
     */
    public int getMaximumMessagesCacheSize() {
        return maximumMessagesCacheSize;
    }

    /**
     * Returns the batch size that triggers a REQUEST_MESSAGE_COUNT_EXCEEDED status.
     *
     * @return the threshold
     */
    public int getRequestMessageCountThreshold() {
        return requestMessageCountThreshold;
    }

    /**
     * Returns the policy applied to failed polls.
     *
     * @return the reconnect policy
     */
    public ReconnectPolicy getReconnectPolicy() {
        return reconnectPolicy;
    }

    /**
     * Returns a digest identifying the session these options describe.
     * Options with the same fingerprint share one session in a {@link SessionRegistry},
     * so every field that changes how a session polls, decodes or announces itself is included.
     *
     * @return hex-encoded SHA-256 of the session fields
     */
    public String fingerprint() {
        String material = String.join("\u0000",
                origin,
                subscribeKey,
                userId,
                String.valueOf(authKey),
                String.valueOf(cipherKey),
                String.valueOf(randomIv),
                String.valueOf(filterExpression),
                String.valueOf(timeout.toMillis()),
                String.valueOf(subscribeTimeout.toMillis()),
                String.valueOf(presenceTimeout.toMillis()),
                String.valueOf(heartbeatInterval.toMillis()),
                String.valueOf(suppressLeaveEvents),
                String.valueOf(maintainPresenceState),
                String.valueOf(dedupeOnSubscribe),
                String.valueOf(maximumMessagesCacheSize),
                String.valueOf(requestMessageCountThreshold),
                reconnectPolicy.toString());
        byte[] input = material.getBytes(StandardCharsets.UTF_8);
        SHA256Digest digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        byte[] hash = new byte[digest.getDigestSize()];
        digest.doFinal(hash, 0);
        return Hex.toHexString(hash);
    }

    /**
     * Builder for ClientOptions.
     */
    public static final class Builder {
        private String origin = DEFAULT_ORIGIN;
        private String subscribeKey;
        private String userId;
        private String authKey;
        private String cipherKey;
        private boolean randomIv = true;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration subscribeTimeout = DEFAULT_SUBSCRIBE_TIMEOUT;
        private Duration presenceTimeout = DEFAULT_PRESENCE_TIMEOUT;
        private Duration heartbeatInterval = Duration.ZERO;
        private String filterExpression;
        private boolean suppressLeaveEvents;
        private boolean maintainPresenceState = true;
        private boolean dedupeOnSubscribe;
        private int maximumMessagesCacheSize = DEFAULT_MESSAGES_CACHE_SIZE;
        private int requestMessageCountThreshold = DEFAULT_MESSAGE_COUNT_THRESHOLD;
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.exponential();

        private Builder() {
        }

        /**
         * Sets the service origin.
         *
         * @param origin base URL such as https://ps.pndsn.com
         * @return this builder
         * @throws BeaconException if origin is empty
         */
        public Builder origin(String origin) {
            if (origin == null || origin.isEmpty()) {
                throw new BeaconException("origin cannot be empty");
            }
            this.origin = origin.endsWith("/") ? origin.substring(0, origin.length() - 1) : origin;
            return this;
        }

        /**
         * Sets the subscribe key.
         *
         * @param subscribeKey the subscribe key
         * @return this builder
         */
        public Builder subscribeKey(String subscribeKey) {
            this.subscribeKey = subscribeKey;
            return this;
        }

        /**
         * Sets the identifier this client announces to the service.
         *
         * @param userId the user id
         * @return this builder
         */
        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        /**
         * Sets the auth key sent with every request.
         *
         * @param authKey the auth key, null to disable
         * @return this builder
         */
        public Builder authKey(String authKey) {
            this.authKey = authKey;
            return this;
        }

        /**
         * Sets the cipher key used to decrypt message, signal and file payloads.
         *
         * @param cipherKey the passphrase, null to disable decryption
         * @return this builder
         * @throws BeaconException if cipherKey is empty
         */
        public Builder cipherKey(String cipherKey) {
            if (cipherKey != null && cipherKey.isEmpty()) {
                throw new BeaconException("cipherKey cannot be empty");
            }
            this.cipherKey = cipherKey;
            return this;
        }

        /**
         * Selects whether encrypted payloads carry a random IV prefix.
         *
         * @param randomIv false for the fixed legacy IV
         * @return this builder
         */
        public Builder randomIv(boolean randomIv) {
            this.randomIv = randomIv;
            return this;
        }

        /**
         * Sets the timeout for heartbeat and leave requests.
         *
         * @param timeout the timeout duration
         * @return this builder
         * @throws BeaconException if timeout is not positive
         */
        public Builder timeout(Duration timeout) {
            this.timeout = requirePositive(timeout, "timeout");
            return this;
        }

        /**
         * Sets the timeout for one long-poll subscribe request.
         *
         * @param subscribeTimeout the timeout duration
         * @return this builder
         * @throws BeaconException if subscribeTimeout is not positive
         */
        public Builder subscribeTimeout(Duration subscribeTimeout) {
            this.subscribeTimeout = requirePositive(subscribeTimeout, "subscribeTimeout");
            return this;
        }

        /**
         * Sets how long the server keeps this client present without a heartbeat.
         *
         * @param presenceTimeout the presence timeout, at least 20 seconds
         * @return this builder
         * @throws BeaconException if presenceTimeout is below the minimum
         */
        public Builder presenceTimeout(Duration presenceTimeout) {
            Objects.requireNonNull(presenceTimeout, "presenceTimeout cannot be null");
            if (presenceTimeout.compareTo(MIN_PRESENCE_TIMEOUT) < 0) {
                throw new BeaconException("presenceTimeout must be at least "
                        + MIN_PRESENCE_TIMEOUT.getSeconds() + " seconds");
            }
            this.presenceTimeout = presenceTimeout;
            return this;
        }

        /**
         * Sets the period of presence heartbeats.
         *
         * @param heartbeatInterval the period, zero disables heartbeats
         * @return this builder
         * @throws BeaconException if heartbeatInterval is negative
         */
        public Builder heartbeatInterval(Duration heartbeatInterval) {
            Objects.requireNonNull(heartbeatInterval, "heartbeatInterval cannot be null");
            if (heartbeatInterval.isNegative()) {
                throw new BeaconException("heartbeatInterval cannot be negative");
            }
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        /**
         * Sets the server-side filter expression.
         *
         * @param filterExpression the expression, null to disable
         * @return this builder
         */
        public Builder filterExpression(String filterExpression) {
            this.filterExpression = filterExpression == null || filterExpression.isEmpty() ? null : filterExpression;
            return this;
        }

        /**
         * Skips leave notifications on unsubscribe.
         *
         * @param suppressLeaveEvents true to skip leave calls
         * @return this builder
         */
        public Builder suppressLeaveEvents(boolean suppressLeaveEvents) {
            this.suppressLeaveEvents = suppressLeaveEvents;
            return this;
        }

        /**
         * Sends presence state with every subscribe request.
         *
         * @param maintainPresenceState true to send state
         * @return this builder
         */
        public Builder maintainPresenceState(boolean maintainPresenceState) {
            this.maintainPresenceState = maintainPresenceState;
            return this;
        }

        /**
         * Drops envelopes already seen within the duplicate detection window.
         *
         * @param dedupeOnSubscribe true to filter duplicates
         * @return this builder
         */
        public Builder dedupeOnSubscribe(boolean dedupeOnSubscribe) {
            this.dedupeOnSubscribe = dedupeOnSubscribe;
            return this;
        }

        /**
         * Sets the size of the duplicate detection window.
         *
         * @param maximumMessagesCacheSize number of remembered envelopes
         * @return this builder
         * @throws BeaconException if the size is not positive
         */
        public Builder maximumMessagesCacheSize(int maximumMessagesCacheSize) {
            if (maximumMessagesCacheSize <= 0) {
                throw new BeaconException("maximumMessagesCacheSize must be positive");
            }
            this.maximumMessagesCacheSize = maximumMessagesCacheSize;
            return this;
        }

        /**
         * Sets the batch size that triggers a REQUEST_MESSAGE_COUNT_EXCEEDED status.
         *
         * @param requestMessageCountThreshold the threshold
         * @return this builder
         * @throws BeaconException if the threshold is not positive
         */
        public Builder requestMessageCountThreshold(int requestMessageCountThreshold) {
            if (requestMessageCountThreshold <= 0) {
                throw new BeaconException("requestMessageCountThreshold must be positive");
            }
            this.requestMessageCountThreshold = requestMessageCountThreshold;
            return this;
        }

        /**
         * Sets the policy applied to failed polls.
         *
         * @param reconnectPolicy the policy
         * @return this builder
         */
        public Builder reconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy cannot be null");
            return this;
        }

        /**
         * Builds the ClientOptions instance.
         *
         * @return the configured options
         * @throws BeaconException if subscribe key or user id is missing
         */
        public ClientOptions build() {
            if (subscribeKey == null || subscribeKey.isEmpty()) {
                throw new BeaconException(ErrorReason.MISSING_SUBSCRIBE_KEY, "subscribeKey cannot be empty");
            }
            if (userId == null || userId.isBlank()) {
                throw new BeaconException(ErrorReason.MISSING_USER_ID, "userId cannot be empty");
            }
            return new ClientOptions(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " cannot be null");
            if (value.isNegative() || value.isZero()) {
                throw new BeaconException(name + " must be positive");
            }
            return value;
        }
    }
}
