package com.asrayaos.firstflame.config;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Immutable configuration shared by every seeding component.
 * Resolved once at startup, either through the {@link Builder} or from the process environment.
 */
public class SeedingConfig {

    public static final String ENV_SUPABASE_URL = "SUPABASE_URL";
    public static final String ENV_SERVICE_KEY = "SUPABASE_SERVICE_ROLE_KEY";
    public static final String ENV_SLUG = "FIRST_FLAME_SLUG";
    public static final String ENV_SCHEMA = "FIRST_FLAME_SCHEMA";
    public static final String ENV_BUCKET = "FIRST_FLAME_BUCKET";
    public static final String ENV_CONTENT_PREFIX = "FIRST_FLAME_CONTENT_PREFIX";
    public static final String ENV_CHANNEL = "FIRST_FLAME_CHANNEL";
    public static final String ENV_PARTICIPANT_MODE = "FIRST_FLAME_PARTICIPANT_MODE";
    public static final String ENV_RESET_PROGRESS = "FIRST_FLAME_RESET_PROGRESS";
    public static final String ENV_CONTENT_CACHE_SIZE = "FIRST_FLAME_CONTENT_CACHE_SIZE";
    public static final String ENV_CONNECT_TIMEOUT_MS = "FIRST_FLAME_CONNECT_TIMEOUT_MS";
    public static final String ENV_RESPONSE_TIMEOUT_MS = "FIRST_FLAME_RESPONSE_TIMEOUT_MS";

    public static final String DEFAULT_SLUG = "first-flame-ritual";
    public static final String DEFAULT_QUEST_TITLE = "First Flame Ritual";
    public static final String DEFAULT_QUEST_TYPE = "ritual";
    public static final String DEFAULT_QUEST_REALM = "first_flame";
    public static final String DEFAULT_SCHEMA = "ritual";
    public static final String DEFAULT_BUCKET = "asrayaospublicbucket";
    public static final String DEFAULT_CONTENT_PREFIX = "5-day/";
    public static final String DEFAULT_CHANNEL = "flame_status";
    public static final int TOTAL_DAYS = 5;

    private final URI supabaseUrl;
    private final String serviceKey;
    private final String questSlug;
    private final String questTitle;
    private final String questType;
    private final String questRealm;
    private final boolean questPinned;
    private final String schema;
    private final String bucket;
    private final String contentPrefix;
    private final String channel;
    private final ParticipantMode participantMode;
    private final boolean resetProgress;
    private final int contentCacheSize;
    private final Duration connectTimeout;
    private final Duration responseTimeout;

    private SeedingConfig(Builder builder) {
        this.supabaseUrl = builder.supabaseUrl;
        this.serviceKey = builder.serviceKey;
        this.questSlug = builder.questSlug;
        this.questTitle = builder.questTitle;
        this.questType = builder.questType;
        this.questRealm = builder.questRealm;
        this.questPinned = builder.questPinned;
        this.schema = builder.schema;
        this.bucket = builder.bucket;
        this.contentPrefix = builder.contentPrefix;
        this.channel = builder.channel;
        this.participantMode = builder.participantMode;
        this.resetProgress = builder.resetProgress;
        this.contentCacheSize = builder.contentCacheSize;
        this.connectTimeout = builder.connectTimeout;
        this.responseTimeout = builder.responseTimeout;
    }

    /**
     * Builds the configuration from environment variables.
     *
     * @param env the environment, usually {@code System.getenv()}
     * @return the resolved configuration
     * @throws ConfigurationException if the store credentials are missing or a value is malformed
     */
    public static SeedingConfig fromEnvironment(Map<String, String> env) {
        Builder builder = new Builder()
            .setSupabaseUrl(env.get(ENV_SUPABASE_URL))
            .setServiceKey(env.get(ENV_SERVICE_KEY));

        String slug = env.get(ENV_SLUG);
        if (isPresent(slug)) {
            builder.setQuestSlug(slug.trim());
        }
        String schema = env.get(ENV_SCHEMA);
        if (isPresent(schema)) {
            builder.setSchema(schema.trim());
        }
        String bucket = env.get(ENV_BUCKET);
        if (isPresent(bucket)) {
            builder.setBucket(bucket.trim());
        }
        String prefix = env.get(ENV_CONTENT_PREFIX);
        if (prefix != null) {
            builder.setContentPrefix(prefix.trim());
        }
        String channel = env.get(ENV_CHANNEL);
        if (isPresent(channel)) {
            builder.setChannel(channel.trim());
        }
        String mode = env.get(ENV_PARTICIPANT_MODE);
        if (isPresent(mode)) {
            builder.setParticipantMode(ParticipantMode.fromValue(mode));
        }
        String reset = env.get(ENV_RESET_PROGRESS);
        if (isPresent(reset)) {
            builder.setResetProgress(parseBoolean(ENV_RESET_PROGRESS, reset));
        }
        String cacheSize = env.get(ENV_CONTENT_CACHE_SIZE);
        if (isPresent(cacheSize)) {
            builder.setContentCacheSize(parseInt(ENV_CONTENT_CACHE_SIZE, cacheSize));
        }
        String connectMillis = env.get(ENV_CONNECT_TIMEOUT_MS);
        if (isPresent(connectMillis)) {
            builder.setConnectTimeout(Duration.ofMillis(parseInt(ENV_CONNECT_TIMEOUT_MS, connectMillis)));
        }
        String responseMillis = env.get(ENV_RESPONSE_TIMEOUT_MS);
        if (isPresent(responseMillis)) {
            builder.setResponseTimeout(Duration.ofMillis(parseInt(ENV_RESPONSE_TIMEOUT_MS, responseMillis)));
        }
        return builder.build();
    }

    public URI getSupabaseUrl() {
        return supabaseUrl;
    }

    public String getServiceKey() {
        return serviceKey;
    }

    public String getQuestSlug() {
        return questSlug;
    }

    public String getQuestTitle() {
        return questTitle;
    }

    public String getQuestType() {
        return questType;
    }

    public String getQuestRealm() {
        return questRealm;
    }

    public boolean isQuestPinned() {
        return questPinned;
    }

    public String getSchema() {
        return schema;
    }

    public String getBucket() {
        return bucket;
    }

    public String getContentPrefix() {
        return contentPrefix;
    }

    /**
     * Object key of a day's content definition, e.g. {@code 5-day/day-1.json}.
     */
    public String contentKey(int day) {
        return contentPrefix + "day-" + day + ".json";
    }

    public String getChannel() {
        return channel;
    }

    public ParticipantMode getParticipantMode() {
        return participantMode;
    }

    public boolean isResetProgress() {
        return resetProgress;
    }

    public int getContentCacheSize() {
        return contentCacheSize;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getResponseTimeout() {
        return responseTimeout;
    }

    @Override
    public String toString() {
        // no service key
        return "SeedingConfig{" +
                "supabaseUrl=" + supabaseUrl +
                ", questSlug='" + questSlug + '\'' +
                ", schema='" + schema + '\'' +
                ", bucket='" + bucket + '\'' +
                ", contentPrefix='" + contentPrefix + '\'' +
                ", channel='" + channel + '\'' +
                ", participantMode=" + participantMode +
                ", resetProgress=" + resetProgress +
                ", contentCacheSize=" + contentCacheSize +
                ", connectTimeout=" + connectTimeout +
                ", responseTimeout=" + responseTimeout +
                '}';
    }

    private static boolean isPresent(String value) {
        return value != null && !value.trim().isEmpty();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String normalized = value.trim();
        if ("true".equalsIgnoreCase(normalized)) {
            return true;
        }
        if ("false".equalsIgnoreCase(normalized)) {
            return false;
        }
        throw new ConfigurationException(key + " must be true or false, got '" + value + "'");
    }

    public static class Builder {
        private URI supabaseUrl;
        private String serviceKey;
        private String questSlug = DEFAULT_SLUG;
        private String questTitle = DEFAULT_QUEST_TITLE;
        private String questType = DEFAULT_QUEST_TYPE;
        private String questRealm = DEFAULT_QUEST_REALM;
        private boolean questPinned = true;
        private String schema = DEFAULT_SCHEMA;
        private String bucket = DEFAULT_BUCKET;
        private String contentPrefix = DEFAULT_CONTENT_PREFIX;
        private String channel = DEFAULT_CHANNEL;
        private ParticipantMode participantMode = ParticipantMode.UPSERTS;
        private boolean resetProgress = false;
        private int contentCacheSize = 0;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration responseTimeout = Duration.ofSeconds(10);

        /**
         * Sets the project URL of the store, e.g. {@code https://xyz.supabase.co}.
         *
         * @param supabaseUrl the base URL, trailing slashes are ignored
         * @return this builder
         */
        public Builder setSupabaseUrl(String supabaseUrl) {
            if (supabaseUrl == null || supabaseUrl.trim().isEmpty()) {
                this.supabaseUrl = null;
                return this;
            }
            String trimmed = supabaseUrl.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            try {
                this.supabaseUrl = URI.create(trimmed);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid " + ENV_SUPABASE_URL + ": " + supabaseUrl, e);
            }
            return this;
        }

        /**
         * Sets the privileged service key used for every store call.
         *
         * @param serviceKey the service role key
         * @return this builder
         */
        public Builder setServiceKey(String serviceKey) {
            this.serviceKey = serviceKey == null ? null : serviceKey.trim();
            return this;
        }

        public Builder setQuestSlug(String questSlug) {
            this.questSlug = questSlug;
            return this;
        }

        public Builder setQuestTitle(String questTitle) {
            this.questTitle = questTitle;
            return this;
        }

        public Builder setQuestType(String questType) {
            this.questType = questType;
            return this;
        }

        public Builder setQuestRealm(String questRealm) {
            this.questRealm = questRealm;
            return this;
        }

        public Builder setQuestPinned(boolean questPinned) {
            this.questPinned = questPinned;
            return this;
        }

        public Builder setSchema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder setBucket(String bucket) {
            this.bucket = bucket;
            return this;
        }

        public Builder setContentPrefix(String contentPrefix) {
            this.contentPrefix = contentPrefix;
            return this;
        }

        public Builder setChannel(String channel) {
            this.channel = channel;
            return this;
        }

        public Builder setParticipantMode(ParticipantMode participantMode) {
            this.participantMode = participantMode;
            return this;
        }

        /**
         * When set, re-runs overwrite the progress row with day-1 defaults instead of
         * leaving an existing row untouched.
         *
         * @param resetProgress whether to reset progress on repair
         * @return this builder
         */
        public Builder setResetProgress(boolean resetProgress) {
            this.resetProgress = resetProgress;
            return this;
        }

        /**
         * Sets how many validated content definitions are kept in memory. Zero disables caching.
         *
         * @param contentCacheSize the cache capacity
         * @return this builder
         */
        public Builder setContentCacheSize(int contentCacheSize) {
            this.contentCacheSize = contentCacheSize;
            return this;
        }

        public Builder setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder setResponseTimeout(Duration responseTimeout) {
            this.responseTimeout = responseTimeout;
            return this;
        }

        /**
         * Validates and freezes the configuration.
         *
         * @return the configuration
         * @throws ConfigurationException if the credentials are missing or a value is out of range
         */
        public SeedingConfig build() {
            if (supabaseUrl == null) {
                throw new ConfigurationException("Missing required configuration " + ENV_SUPABASE_URL);
            }
            if (serviceKey == null || serviceKey.isEmpty()) {
                throw new ConfigurationException("Missing required configuration " + ENV_SERVICE_KEY);
            }
            if (supabaseUrl.getScheme() == null || supabaseUrl.getHost() == null) {
                throw new ConfigurationException(ENV_SUPABASE_URL + " must be an absolute URL: " + supabaseUrl);
            }
            requireText(ENV_SLUG, questSlug);
            requireText(ENV_SCHEMA, schema);
            requireText(ENV_BUCKET, bucket);
            requireText(ENV_CHANNEL, channel);
            if (contentPrefix == null) {
                contentPrefix = "";
            }
            if (participantMode == null) {
                throw new ConfigurationException(ENV_PARTICIPANT_MODE + " must be set");
            }
            if (contentCacheSize < 0) {
                throw new ConfigurationException(ENV_CONTENT_CACHE_SIZE + " must not be negative");
            }
            requirePositive(ENV_CONNECT_TIMEOUT_MS, connectTimeout);
            requirePositive(ENV_RESPONSE_TIMEOUT_MS, responseTimeout);
            return new SeedingConfig(this);
        }

        private static void requireText(String key, String value) {
            if (value == null || value.trim().isEmpty()) {
                throw new ConfigurationException(key + " must not be blank");
            }
        }

        private static void requirePositive(String key, Duration value) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new ConfigurationException(key + " must be a positive duration");
            }
        }
    }
}
