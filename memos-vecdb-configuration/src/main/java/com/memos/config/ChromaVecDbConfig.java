package com.memos.config;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configuration of the Chroma vector DB: collection settings plus the connection target.
 * <p>
 * Local mode is selected when both host and port are unset; the store then lives under {@code path}.
 * Environment: MEMOS_CHROMA_COLLECTION, MEMOS_CHROMA_VECTOR_DIMENSION, MEMOS_CHROMA_DISTANCE_METRIC,
 * MEMOS_CHROMA_PATH, MEMOS_CHROMA_HOST, MEMOS_CHROMA_PORT, MEMOS_CHROMA_USERNAME, MEMOS_CHROMA_PASSWORD,
 * MEMOS_CHROMA_TLS, MEMOS_CHROMA_TENANT, MEMOS_CHROMA_DATABASE, MEMOS_CHROMA_TIMEOUT_SECONDS.
 */
public final class ChromaVecDbConfig {

    private static final String ENV_COLLECTION = "MEMOS_CHROMA_COLLECTION";
    private static final String ENV_VECTOR_DIMENSION = "MEMOS_CHROMA_VECTOR_DIMENSION";
    private static final String ENV_DISTANCE_METRIC = "MEMOS_CHROMA_DISTANCE_METRIC";
    private static final String ENV_PATH = "MEMOS_CHROMA_PATH";
    private static final String ENV_HOST = "MEMOS_CHROMA_HOST";
    private static final String ENV_PORT = "MEMOS_CHROMA_PORT";
    private static final String ENV_USERNAME = "MEMOS_CHROMA_USERNAME";
    private static final String ENV_PASSWORD = "MEMOS_CHROMA_PASSWORD";
    private static final String ENV_TLS = "MEMOS_CHROMA_TLS";
    private static final String ENV_TENANT = "MEMOS_CHROMA_TENANT";
    private static final String ENV_DATABASE = "MEMOS_CHROMA_DATABASE";
    private static final String ENV_TIMEOUT_SECONDS = "MEMOS_CHROMA_TIMEOUT_SECONDS";

    public static final String DEFAULT_COLLECTION_NAME = "memos_memories";
    public static final int DEFAULT_VECTOR_DIMENSION = 1536;
    public static final String DEFAULT_PATH = ".memos/chroma";
    public static final String DEFAULT_TENANT = "default_tenant";
    public static final String DEFAULT_DATABASE = "default_database";
    public static final int DEFAULT_TIMEOUT_SECONDS = 30;

    private final String collectionName;
    private final int vectorDimension;
    private final DistanceMetric distanceMetric;
    private final ChromaTarget target;
    private final String tenant;
    private final String database;
    private final int requestTimeoutSeconds;

    private ChromaVecDbConfig(Builder b) {
        if (b.collectionName == null || b.collectionName.isBlank()) {
            throw new IllegalArgumentException("collectionName must not be blank");
        }
        if (b.vectorDimension <= 0) {
            throw new IllegalArgumentException("vectorDimension must be positive: " + b.vectorDimension);
        }
        this.collectionName = b.collectionName.trim();
        this.vectorDimension = b.vectorDimension;
        this.distanceMetric = b.distanceMetric;
        this.target = resolveTarget(b);
        this.tenant = b.tenant;
        this.database = b.database;
        this.requestTimeoutSeconds = b.requestTimeoutSeconds > 0 ? b.requestTimeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
    }

    /**
     * Both host and port unset → local; only one of them set → the missing half is defaulted
     * (localhost / 8000).
     */
    private static ChromaTarget resolveTarget(Builder b) {
        if (b.host == null && b.port == null) {
            return new ChromaTarget.LocalTarget(b.path != null ? b.path : DEFAULT_PATH);
        }
        String host = b.host != null ? b.host : "localhost";
        int port = b.port != null ? b.port : 8000;
        return new ChromaTarget.RemoteTarget(host, port, b.username, b.password, b.tls);
    }

    public String getCollectionName() {
        return collectionName;
    }

    public int getVectorDimension() {
        return vectorDimension;
    }

    public DistanceMetric getDistanceMetric() {
        return distanceMetric;
    }

    public ChromaTarget getTarget() {
        return target;
    }

    public boolean isLocal() {
        return target instanceof ChromaTarget.LocalTarget;
    }

    /** Chroma tenant (remote only). Default {@value #DEFAULT_TENANT}. */
    public String getTenant() {
        return tenant;
    }

    /** Chroma database (remote only). Default {@value #DEFAULT_DATABASE}. */
    public String getDatabase() {
        return database;
    }

    /** Per-request timeout for the remote client. Default {@value #DEFAULT_TIMEOUT_SECONDS}. */
    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public static ChromaVecDbConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static ChromaVecDbConfig fromEnvironment(Function<String, String> env) {
        String host = trimToNull(env.apply(ENV_HOST));
        String port = trimToNull(env.apply(ENV_PORT));
        return builder()
                .collectionName(getOrDefault(env, ENV_COLLECTION, DEFAULT_COLLECTION_NAME))
                .vectorDimension(parseInt(env.apply(ENV_VECTOR_DIMENSION), DEFAULT_VECTOR_DIMENSION))
                .distanceMetric(DistanceMetric.fromName(env.apply(ENV_DISTANCE_METRIC)))
                .path(getOrDefault(env, ENV_PATH, DEFAULT_PATH))
                .host(host)
                .port(port != null ? Integer.valueOf(parseInt(port, 8000)) : null)
                .username(trimToNull(env.apply(ENV_USERNAME)))
                .password(env.apply(ENV_PASSWORD))
                .tls(parseBoolean(env.apply(ENV_TLS), false))
                .tenant(getOrDefault(env, ENV_TENANT, DEFAULT_TENANT))
                .database(getOrDefault(env, ENV_DATABASE, DEFAULT_DATABASE))
                .requestTimeoutSeconds(parseInt(env.apply(ENV_TIMEOUT_SECONDS), DEFAULT_TIMEOUT_SECONDS))
                .build();
    }

    /**
     * Builds from the snake_case map used in {@code {"backend": "chroma", "config": {...}}}:
     * collection_name, vector_dimension, distance_metric, path, host, port, username, password,
     * tls, tenant, database, timeout_seconds.
     */
    public static ChromaVecDbConfig fromMap(Map<String, Object> config) {
        Objects.requireNonNull(config, "config");
        Builder b = builder();
        Object collection = config.get("collection_name");
        if (collection != null) b.collectionName(collection.toString());
        b.vectorDimension(toInt(config.get("vector_dimension"), DEFAULT_VECTOR_DIMENSION));
        Object metric = config.get("distance_metric");
        b.distanceMetric(DistanceMetric.fromName(metric != null ? metric.toString() : null));
        Object path = config.get("path");
        if (path != null) b.path(path.toString());
        Object host = config.get("host");
        b.host(host != null ? trimToNull(host.toString()) : null);
        Object port = config.get("port");
        b.port(port != null ? Integer.valueOf(toInt(port, 8000)) : null);
        Object username = config.get("username");
        b.username(username != null ? trimToNull(username.toString()) : null);
        Object password = config.get("password");
        b.password(password != null ? password.toString() : null);
        Object tls = config.get("tls");
        b.tls(tls instanceof Boolean ? (Boolean) tls : parseBoolean(tls != null ? tls.toString() : null, false));
        Object tenant = config.get("tenant");
        if (tenant != null) b.tenant(tenant.toString());
        Object database = config.get("database");
        if (database != null) b.database(database.toString());
        b.requestTimeoutSeconds(toInt(config.get("timeout_seconds"), DEFAULT_TIMEOUT_SECONDS));
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int toInt(Object value, int defaultValue) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return parseInt(value != null ? value.toString() : null, defaultValue);
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: " + value, e);
        }
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static String getOrDefault(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    @Override
    public String toString() {
        return "ChromaVecDbConfig{collectionName=" + collectionName
                + ", vectorDimension=" + vectorDimension
                + ", distanceMetric=" + distanceMetric.spaceName()
                + ", target=" + target + "}";
    }

    public static final class Builder {
        private String collectionName = DEFAULT_COLLECTION_NAME;
        private int vectorDimension = DEFAULT_VECTOR_DIMENSION;
        private DistanceMetric distanceMetric = DistanceMetric.COSINE;
        private String path;
        private String host;
        private Integer port;
        private String username;
        private String password;
        private boolean tls;
        private String tenant = DEFAULT_TENANT;
        private String database = DEFAULT_DATABASE;
        private int requestTimeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

        public Builder collectionName(String collectionName) {
            this.collectionName = collectionName;
            return this;
        }

        public Builder vectorDimension(int vectorDimension) {
            this.vectorDimension = vectorDimension;
            return this;
        }

        public Builder distanceMetric(DistanceMetric distanceMetric) {
            this.distanceMetric = distanceMetric != null ? distanceMetric : DistanceMetric.COSINE;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(Integer port) {
            this.port = port;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder tls(boolean tls) {
            this.tls = tls;
            return this;
        }

        public Builder tenant(String tenant) {
            this.tenant = tenant != null && !tenant.isBlank() ? tenant.trim() : DEFAULT_TENANT;
            return this;
        }

        public Builder database(String database) {
            this.database = database != null && !database.isBlank() ? database.trim() : DEFAULT_DATABASE;
            return this;
        }

        public Builder requestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
            return this;
        }

        public ChromaVecDbConfig build() {
            return new ChromaVecDbConfig(this);
        }
    }
}
