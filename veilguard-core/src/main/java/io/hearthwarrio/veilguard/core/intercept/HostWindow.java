package io.hearthwarrio.veilguard.core.intercept;

/**
 * Browsing context opened by {@link DocumentCapabilities#openWindow(String, String, String)}.
 */
public interface HostWindow {

    String getUrl();
}
