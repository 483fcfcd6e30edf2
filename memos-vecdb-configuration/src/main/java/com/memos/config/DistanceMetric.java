package com.memos.config;

import java.util.Locale;

/**
 * Distance function of a collection. {@link #spaceName()} is the value stored under
 * Chroma's {@code hnsw:space} collection metadata key.
 */
public enum DistanceMetric {

    /** 1 - cosine similarity. */
    COSINE("cosine"),
    /** Squared Euclidean distance. */
    L2("l2"),
    /** 1 - inner product. */
    IP("ip");

    private final String spaceName;

    DistanceMetric(String spaceName) {
        this.spaceName = spaceName;
    }

    public String spaceName() {
        return spaceName;
    }

    /**
     * Parses a metric name. Accepts the Chroma space names ({@code cosine}, {@code l2}, {@code ip})
     * and the aliases {@code euclidean} and {@code dot}. Null/blank → {@link #COSINE}.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static DistanceMetric fromName(String name) {
        if (name == null || name.isBlank()) {
            return COSINE;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "cosine":
                return COSINE;
            case "l2":
            case "euclidean":
                return L2;
            case "ip":
            case "dot":
                return IP;
            default:
                throw new IllegalArgumentException("Unknown distance metric: " + name + " (use cosine, l2, ip)");
        }
    }
}
