package com.memos.vecdb;

import com.memos.config.VectorDbConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Creates {@link VecDb} instances from a {@link VectorDbConfigFactory} using the providers found on the
 * classpath. Providers can also be registered explicitly (tests, embedded use).
 */
public final class VecDbFactory {

    private static final Logger log = LoggerFactory.getLogger(VecDbFactory.class);

    /** backend → provider; first registration wins. */
    private final Map<String, VecDbProvider> providers = new LinkedHashMap<>();

    public VecDbFactory() {
        this(VecDbFactory.class.getClassLoader());
    }

    public VecDbFactory(ClassLoader classLoader) {
        for (VecDbProvider provider : ServiceLoader.load(VecDbProvider.class, classLoader)) {
            register(provider);
        }
    }

    /** Registers a provider unless one is already registered for its backend. */
    public void register(VecDbProvider provider) {
        Objects.requireNonNull(provider, "provider");
        String backend = provider.getBackend();
        if (providers.putIfAbsent(backend, provider) != null) {
            log.warn("Vector DB backend '{}' already registered; ignoring {}", backend, provider.getClass().getName());
        } else {
            log.debug("Registered vector DB backend '{}' ({})", backend, provider.getClass().getName());
        }
    }

    public List<String> getBackends() {
        return Collections.unmodifiableList(new ArrayList<>(providers.keySet()));
    }

    /**
     * Builds the vector DB named by {@code config.getBackend()}.
     *
     * @throws IllegalArgumentException if no provider handles that backend
     */
    public VecDb create(VectorDbConfigFactory config) {
        Objects.requireNonNull(config, "config");
        VecDbProvider provider = providers.get(config.getBackend());
        if (provider == null) {
            throw new IllegalArgumentException("Unknown vector DB backend: " + config.getBackend()
                    + " (available: " + providers.keySet() + ")");
        }
        log.info("Creating vector DB backend '{}'", config.getBackend());
        return provider.create(config.getConfig());
    }

    /** Shorthand for {@code new VecDbFactory().create(config)}. */
    public static VecDb fromConfig(VectorDbConfigFactory config) {
        return new VecDbFactory().create(config);
    }
}
