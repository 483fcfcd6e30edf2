package com.memos.config;

import java.util.Objects;

/**
 * Where the Chroma client connects: a local on-disk store ({@link LocalTarget}) or a remote
 * server ({@link RemoteTarget}). Resolved once when the vector DB is constructed.
 */
public interface ChromaTarget {

    /** Local persistent store rooted at {@code path}. */
    record LocalTarget(String path) implements ChromaTarget {
        public LocalTarget {
            Objects.requireNonNull(path, "path");
            if (path.isBlank()) {
                throw new IllegalArgumentException("Local Chroma path must not be blank");
            }
        }
    }

    /**
     * Remote Chroma server. {@code username}/{@code password} are optional (Basic auth is only sent when
     * a username is set); {@code tls} selects https.
     */
    record RemoteTarget(String host, int port, String username, String password, boolean tls) implements ChromaTarget {
        public RemoteTarget {
            Objects.requireNonNull(host, "host");
            if (port <= 0 || port > 65535) {
                throw new IllegalArgumentException("Invalid Chroma port: " + port);
            }
        }

        public RemoteTarget(String host, int port) {
            this(host, port, null, null, false);
        }

        public boolean hasCredentials() {
            return username != null && !username.isBlank();
        }

        public String baseUrl() {
            return (tls ? "https://" : "http://") + host + ":" + port;
        }

        /** Password is never printed. */
        @Override
        public String toString() {
            return "RemoteTarget[" + baseUrl() + (hasCredentials() ? ", user=" + username : "") + "]";
        }
    }
}
