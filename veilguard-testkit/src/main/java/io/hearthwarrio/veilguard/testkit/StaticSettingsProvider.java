package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.SettingsProvider;
import io.hearthwarrio.veilguard.core.SiteSettings;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * {@link SettingsProvider} answering from an in-memory map.
 * <p>
 * Completes immediately unless {@link #deferred()} is set, in which case the stages stay open until
 * {@link #completePending()} or {@link #failPending(Throwable)}.
 */
public final class StaticSettingsProvider implements SettingsProvider {

    private final SiteSettings fallback;
    private final Map<String, SiteSettings> perDomain = new HashMap<>();
    private final List<String> requestedDomains = new ArrayList<>();
    private final List<Pending> pending = new ArrayList<>();
    private boolean deferred;

    public StaticSettingsProvider(SiteSettings fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
    }

    public static StaticSettingsProvider of(SiteSettings settings) {
        return new StaticSettingsProvider(settings);
    }

    public StaticSettingsProvider withSite(String domain, SiteSettings settings) {
        perDomain.put(domain, Objects.requireNonNull(settings, "settings must not be null"));
        return this;
    }

    public StaticSettingsProvider deferred() {
        this.deferred = true;
        return this;
    }

    @Override
    public CompletionStage<SiteSettings> resolve(String domain) {
        requestedDomains.add(domain);
        SiteSettings s = perDomain.getOrDefault(domain, fallback);
        if (!deferred) {
            return CompletableFuture.completedFuture(s);
        }
        CompletableFuture<SiteSettings> f = new CompletableFuture<>();
        pending.add(new Pending(f, s));
        return f;
    }

    public void completePending() {
        for (Pending p : new ArrayList<>(pending)) {
            p.future.complete(p.settings);
        }
        pending.clear();
    }

    public void failPending(Throwable error) {
        for (Pending p : new ArrayList<>(pending)) {
            p.future.completeExceptionally(error);
        }
        pending.clear();
    }

    public List<String> getRequestedDomains() {
        return List.copyOf(requestedDomains);
    }

    private static final class Pending {
        final CompletableFuture<SiteSettings> future;
        final SiteSettings settings;

        Pending(CompletableFuture<SiteSettings> future, SiteSettings settings) {
            this.future = future;
            this.settings = settings;
        }
    }
}
