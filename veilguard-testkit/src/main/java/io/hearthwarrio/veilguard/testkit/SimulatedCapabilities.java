package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.intercept.CapabilityHost;
import io.hearthwarrio.veilguard.core.intercept.DocumentCapabilities;
import io.hearthwarrio.veilguard.core.intercept.HostWindow;
import io.hearthwarrio.veilguard.core.intercept.InitializationToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Native capabilities of a {@link SimulatedPage}, plus the context that holds them.
 * <p>
 * Page scripts in tests go through {@link #current()}, which returns whatever decorator is installed.
 */
public final class SimulatedCapabilities implements DocumentCapabilities, CapabilityHost {

    private final SimulatedPage page;
    private final boolean topLevel;
    private final InitializationToken token = new InitializationToken();
    private final List<String> openedUrls = new ArrayList<>();
    private DocumentCapabilities installed = this;

    public SimulatedCapabilities(SimulatedPage page) {
        this(page, true);
    }

    public SimulatedCapabilities(SimulatedPage page, boolean topLevel) {
        this.page = Objects.requireNonNull(page, "page must not be null");
        this.topLevel = topLevel;
    }

    /**
     * @return capabilities page scripts currently see
     */
    public DocumentCapabilities current() {
        return installed;
    }

    public List<String> getOpenedUrls() {
        return List.copyOf(openedUrls);
    }

    // ----------- native capabilities -----------

    @Override
    public HostWindow openWindow(String url, String name, String features) {
        String u = url == null ? "" : url;
        openedUrls.add(u);
        return () -> u;
    }

    @Override
    public HostNode appendChild(HostNode parent, HostNode child) {
        parent.appendChild(child);
        return child;
    }

    @Override
    public void setAttribute(HostNode element, String name, String value) {
        element.setAttribute(name, value);
    }

    @Override
    public void insertAdjacentMarkup(HostNode element, String position, String markup) {
        page.insertAdjacentHtml(element, position, markup);
    }

    // ----------- context -----------

    @Override
    public boolean isTopLevelContext() {
        return topLevel;
    }

    @Override
    public DocumentCapabilities getCapabilities() {
        return installed;
    }

    @Override
    public void setCapabilities(DocumentCapabilities capabilities) {
        this.installed = Objects.requireNonNull(capabilities, "capabilities must not be null");
    }

    @Override
    public InitializationToken initializationToken() {
        return token;
    }
}
