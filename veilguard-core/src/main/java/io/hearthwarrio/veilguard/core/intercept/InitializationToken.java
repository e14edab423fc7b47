package io.hearthwarrio.veilguard.core.intercept;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One-shot initialization guard scoped to a single execution context.
 */
public final class InitializationToken {

    private final Set<String> claimed = new HashSet<>();

    /**
     * @param key initialization key
     * @return true the first time {@code key} is claimed, false afterwards
     */
    public synchronized boolean claim(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return claimed.add(key);
    }

    public synchronized boolean isClaimed(String key) {
        return claimed.contains(key);
    }
}
