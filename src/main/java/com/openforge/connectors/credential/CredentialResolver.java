package com.openforge.connectors.credential;

import com.openforge.connectors.error.CredentialNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Resolves a connector's credentials from an ordered list of sources.
 *
 * Resolution walks the providers left to right and stops at the first
 * non-blank value. Results (including "absent" for optional credentials)
 * are memoized for the lifetime of the resolver:
 *
 *   resolve(name)
 *     ├─ cache hit  → return, no locking
 *     └─ cache miss → lock, re-check, walk providers, publish to cache
 *
 * {@link #refresh(String)} and {@link #refreshAll()} drop cached entries
 * under the same lock so a concurrent miss never publishes a stale value
 * after a refresh started.
 */
@Slf4j
public class CredentialResolver {

    private final String owner;
    private final List<CredentialProvider> providers;
    private final Map<String, CredentialSpec> declared;
    private final Clock clock;

    private final ConcurrentHashMap<String, Credential> cache = new ConcurrentHashMap<>();
    private final ReentrantLock updateLock = new ReentrantLock();

    public CredentialResolver(String owner,
                              List<CredentialProvider> providers,
                              Collection<CredentialSpec> declared) {
        this(owner, providers, declared, Clock.systemUTC());
    }

    public CredentialResolver(String owner,
                              List<CredentialProvider> providers,
                              Collection<CredentialSpec> declared,
                              Clock clock) {
        this.owner = owner;
        this.providers = List.copyOf(providers);
        this.clock = clock;
        Map<String, CredentialSpec> byName = new LinkedHashMap<>();
        for (CredentialSpec spec : declared) {
            byName.put(spec.name(), spec);
        }
        this.declared = Collections.unmodifiableMap(byName);
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /**
     * Resolve a declared credential by logical name. Names the connector did
     * not declare are treated as required, looked up under their upper-cased
     * environment-variable form.
     */
    public Credential resolve(String name) {
        CredentialSpec spec = declared.get(name);
        return resolve(spec != null ? spec : CredentialSpec.required(name, null));
    }

    public Credential resolve(CredentialSpec spec) {
        Credential cached = cache.get(spec.name());
        if (cached != null) {
            return cached;
        }
        updateLock.lock();
        try {
            cached = cache.get(spec.name());
            if (cached != null) {
                return cached;
            }
            Credential resolved = lookup(spec);
            cache.put(spec.name(), resolved);
            return resolved;
        } finally {
            updateLock.unlock();
        }
    }

    /** Drop the cached value and resolve again from the sources. */
    public Credential refresh(String name) {
        updateLock.lock();
        try {
            cache.remove(name);
            return resolve(name);
        } finally {
            updateLock.unlock();
        }
    }

    public void refreshAll() {
        updateLock.lock();
        try {
            cache.clear();
        } finally {
            updateLock.unlock();
        }
        log.debug("[Credentials:{}] Cache cleared", owner);
    }

    public Collection<CredentialSpec> declared() {
        return declared.values();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Credential lookup(CredentialSpec spec) {
        List<String> consulted = new ArrayList<>(providers.size());
        for (CredentialProvider provider : providers) {
            consulted.add(provider.describe(spec));
            Optional<String> value = provider.lookup(spec)
                    .map(String::trim)
                    .filter(v -> !v.isEmpty());
            if (value.isPresent()) {
                log.debug("[Credentials:{}] Resolved '{}' from {}", owner, spec.name(), provider.origin());
                return new Credential(spec.name(), value.get(), provider.origin(), clock.instant());
            }
        }
        if (spec.required()) {
            throw new CredentialNotFoundException(spec.name(), consulted);
        }
        log.debug("[Credentials:{}] Optional credential '{}' not set", owner, spec.name());
        return Credential.absent(spec.name(), clock.instant());
    }
}
