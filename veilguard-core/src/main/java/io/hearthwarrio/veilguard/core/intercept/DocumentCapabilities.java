package io.hearthwarrio.veilguard.core.intercept;

import io.hearthwarrio.veilguard.core.host.HostNode;

/**
 * The four tree-mutating entry points page scripts call.
 */
public interface DocumentCapabilities {

    /**
     * Opens a new browsing context.
     *
     * @param url      target address (may be null or empty)
     * @param name     target name
     * @param features window features
     * @return opened context, or null when nothing was opened
     */
    HostWindow openWindow(String url, String name, String features);

    /**
     * @param parent new parent
     * @param child  element to insert
     * @return the inserted element
     */
    HostNode appendChild(HostNode parent, HostNode child);

    void setAttribute(HostNode element, String name, String value);

    /**
     * @param element  reference element
     * @param position insertion position ({@code beforebegin}, {@code afterbegin}, {@code beforeend}, {@code afterend})
     * @param markup   markup fragment
     */
    void insertAdjacentMarkup(HostNode element, String position, String markup);
}
