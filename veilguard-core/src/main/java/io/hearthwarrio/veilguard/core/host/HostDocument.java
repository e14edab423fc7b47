package io.hearthwarrio.veilguard.core.host;

import java.util.List;
import java.util.Set;

/**
 * Document-level view of the host tree.
 */
public interface HostDocument {

    /**
     * @return host name of the page (for example {@code www.example.com}); empty when unknown
     */
    String getDomain();

    HostNode getDocumentElement();

    /**
     * @return head element, or null when the document has none yet
     */
    HostNode getHead();

    /**
     * @return body element, or null when the document has none yet
     */
    HostNode getBody();

    HostNode getElementById(String id);

    HostNode createElement(String tagName);

    /**
     * @param selector selector group
     * @return matching elements in document order
     * @throws RuntimeException when the selector is malformed (host specific)
     */
    List<HostNode> querySelectorAll(String selector);

    Viewport getViewport();

    void addEventListener(String type, HostEventListener listener, boolean capture);

    /**
     * Observes structural changes of the whole subtree.
     * <p>
     * Child-list changes are always reported. Attribute changes are reported only for the attribute names
     * in {@code attributeFilter}; an empty filter disables attribute reporting.
     *
     * @param listener        batch listener
     * @param attributeFilter attribute names to report (may be empty)
     * @return subscription handle
     */
    MutationSubscription observe(MutationListener listener, Set<String> attributeFilter);
}
