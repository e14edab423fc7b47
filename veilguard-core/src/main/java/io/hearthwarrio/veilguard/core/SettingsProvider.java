package io.hearthwarrio.veilguard.core;

import java.util.concurrent.CompletionStage;

/**
 * Read contract of the external settings collaborator.
 * <p>
 * Settings are requested once per page load. The engine never blocks on the returned stage; completion is
 * re-posted onto the host event loop.
 */
@FunctionalInterface
public interface SettingsProvider {

    /**
     * @param domain normalized host name of the page
     * @return settings for the site (global mode merged with the per-site override)
     */
    CompletionStage<SiteSettings> resolve(String domain);
}
