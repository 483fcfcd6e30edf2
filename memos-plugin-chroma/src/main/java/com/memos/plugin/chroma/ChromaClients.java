package com.memos.plugin.chroma;

import com.memos.config.ChromaTarget;
import com.memos.config.ChromaVecDbConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

/** Resolves a {@link ChromaTarget} into a client: local store or remote server. */
public final class ChromaClients {

    private static final Logger log = LoggerFactory.getLogger(ChromaClients.class);

    private ChromaClients() {
    }

    public static ChromaClient create(ChromaVecDbConfig config) {
        ChromaTarget target = config.getTarget();
        if (target instanceof ChromaTarget.LocalTarget) {
            String path = ((ChromaTarget.LocalTarget) target).path();
            log.warn("Chroma is running in local mode (host and port are both unset); data is stored under {}", path);
            return new PersistentChromaClient(Path.of(path));
        }
        if (target instanceof ChromaTarget.RemoteTarget) {
            ChromaTarget.RemoteTarget remote = (ChromaTarget.RemoteTarget) target;
            log.info("Connecting to Chroma at {}", remote);
            return new ChromaHttpClient(remote, config.getTenant(), config.getDatabase(),
                    Duration.ofSeconds(config.getRequestTimeoutSeconds()));
        }
        throw new IllegalArgumentException("Unsupported Chroma target: " + target);
    }
}
